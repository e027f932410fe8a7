package romantoolscli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import romantools.RoManTools;

/**
 * Prints the syllables of every word as JSON, e.g. {@code [["zhong","guo"],["ti","an"]]}.
 */
@Command(name = "segment", description = "\033[1;34mSegment romanized Mandarin text into syllables\033[0m", mixinStandardHelpOptions = true)
public class SegmentCommand extends TextCommand {
    @Option(names = {"-m", "--method"}, paramLabel = "<method>", description = "Romanization method: py, wg", required = true)
    private String method;

    @Override
    String execute(RoManTools tools, String inputText) throws Exception {
        return toJson(tools.segment(inputText, method(method)));
    }
}
