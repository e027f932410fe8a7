package romantoolscli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import romantools.RoManTools;

/**
 * Selective conversion: only valid romanized words change, everything else is kept byte for byte.
 */
@Command(name = "cherry-pick", description = "\033[1;34mConvert only the romanized Mandarin words of a text\033[0m", mixinStandardHelpOptions = true)
public class CherryPickCommand extends TextCommand {
    @Option(names = {"-f", "--from"}, paramLabel = "<method>", description = "Source method: py, wg", required = true)
    private String from;

    @Option(names = {"-t", "--to"}, paramLabel = "<method>", description = "Target method: py, wg", required = true)
    private String to;

    @Override
    String execute(RoManTools tools, String inputText) {
        return tools.cherryPick(inputText, method(from), method(to));
    }
}
