package romantoolscli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import romantools.RoManTools;

@Command(
        name = "romantools",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mRomanized Mandarin tools: segment, validate, convert and detect Pinyin / Wade-Giles\033[0m",
        subcommands = {
                SegmentCommand.class,
                ValidateCommand.class,
                ConvertCommand.class,
                CherryPickCommand.class,
                SyllableCountCommand.class,
                DetectMethodCommand.class,
                DictgenCommand.class
        }
)
public class Main implements Runnable {
    @Option(names = "--list-methods", description = "List all supported romanization methods")
    private boolean listMethods;

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        if (listMethods) {
            spec.commandLine().getOut().println("Supported romanization methods:");
            RoManTools.listMethods().forEach(m -> spec.commandLine().getOut().println("  " + m));
            spec.commandLine().getOut().flush();
            return;
        }
        // Called when no subcommand is provided
        spec.commandLine().getOut().println(
                "Use --help or a subcommand (segment / validate / convert / cherry-pick / syllable-count / detect-method / dictgen)");
        spec.commandLine().getOut().flush();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
