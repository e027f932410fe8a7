package romantoolscli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import romantools.RoManTools;

/**
 * Full conversion: every word is converted, unknown syllables are marked with {@code (!)}.
 */
@Command(name = "convert", description = "\033[1;34mConvert romanized Mandarin text between methods\033[0m", mixinStandardHelpOptions = true)
public class ConvertCommand extends TextCommand {
    @Option(names = {"-f", "--from"}, paramLabel = "<method>", description = "Source method: py, wg", required = true)
    private String from;

    @Option(names = {"-t", "--to"}, paramLabel = "<method>", description = "Target method: py, wg", required = true)
    private String to;

    @Override
    String execute(RoManTools tools, String inputText) {
        return tools.convert(inputText, method(from), method(to));
    }
}
