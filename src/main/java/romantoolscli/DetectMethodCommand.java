package romantoolscli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import romantools.RoManTools;

@Command(name = "detect-method", description = "\033[1;34mDetect which romanization methods accept the text\033[0m", mixinStandardHelpOptions = true)
public class DetectMethodCommand extends TextCommand {
    @Option(names = {"-w", "--per-word"}, description = "Detect methods for each whitespace-separated word")
    private boolean perWord;

    @Override
    String execute(RoManTools tools, String inputText) throws Exception {
        return toJson(perWord ? tools.detectMethodPerWord(inputText) : tools.detectMethod(inputText));
    }
}
