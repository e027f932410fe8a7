package romantoolscli;

import picocli.CommandLine.Option;
import romantools.RoManConfig;

/**
 * Processing flags shared by every text command.
 */
public class CommonOptions {
    @Option(names = {"-C", "--crumbs"}, description = "Print a step-by-step trace of the processing")
    boolean crumbs;

    @Option(names = {"-S", "--error-skip"}, description = "Skip invalid words and keep non-letter text (default: false)")
    boolean errorSkip;

    @Option(names = {"-R", "--error-report"}, description = "Report syllable errors on stderr (default: false)")
    boolean errorReport;

    RoManConfig toConfig() {
        return RoManConfig.of(crumbs, errorSkip, errorReport);
    }
}
