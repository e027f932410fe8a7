package romantoolscli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import romantools.RoManTools;
import romantools.RomanizationMethod;

@Command(name = "validate", description = "\033[1;34mValidate romanized Mandarin text\033[0m", mixinStandardHelpOptions = true)
public class ValidateCommand extends TextCommand {
    @Option(names = {"-m", "--method"}, paramLabel = "<method>", description = "Romanization method: py, wg", required = true)
    private String method;

    @Option(names = {"-w", "--per-word"}, description = "Report validity of each word and syllable as JSON")
    private boolean perWord;

    @Override
    String execute(RoManTools tools, String inputText) throws Exception {
        RomanizationMethod m = method(method);
        if (perWord) {
            return toJson(tools.validatePerWord(inputText, m));
        }
        return String.valueOf(tools.validate(inputText, m));
    }
}
