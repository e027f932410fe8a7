package romantoolscli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import romantools.RoManTools;

@Command(name = "syllable-count", description = "\033[1;34mCount the syllables of every word (0 for invalid words)\033[0m", mixinStandardHelpOptions = true)
public class SyllableCountCommand extends TextCommand {
    @Option(names = {"-m", "--method"}, paramLabel = "<method>", description = "Romanization method: py, wg", required = true)
    private String method;

    @Override
    String execute(RoManTools tools, String inputText) throws Exception {
        return toJson(tools.countSyllables(inputText, method(method)));
    }
}
