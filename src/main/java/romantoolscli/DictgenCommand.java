package romantoolscli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import romantools.RomanizationData;

import java.io.File;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(name = "dictgen", description = "\033[1;34mGenerate the JSON data bundle from the plain-text tables\033[0m", mixinStandardHelpOptions = true)
public class DictgenCommand implements Runnable {

    @Option(names = {"-f", "--format"}, description = "Bundle format: [json]", defaultValue = "json")
    private String format;

    @Option(names = {"-o", "--output"}, paramLabel = "<filename>", description = "Output filename")
    private String output;

    @Option(names = {"-d", "--dicts"}, paramLabel = "<dir>", defaultValue = "dicts",
            description = "Directory (file system or classpath) holding the plain-text tables")
    private String dicts;

    @Spec
    private CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(DictgenCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public void run() {
        try {
            String defaultOutput = "json".equals(format) ? "romanization_data.json" : null;
            if (defaultOutput == null) {
                LOGGER.severe("Unsupported format: " + format);
                System.err.println("❌ Unsupported format: " + format);
                System.exit(1);
            }

            String outputFile = (output != null) ? output : defaultOutput;
            File outputPath = Paths.get(outputFile).toAbsolutePath().toFile();

            RomanizationData data = RomanizationData.fromDicts(dicts);
            data.serializeToJson(outputPath.getAbsolutePath());
            spec.commandLine().getOut().println(BLUE + "Romanization data saved in JSON format at: " + outputPath + RESET);
            spec.commandLine().getOut().flush();

        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Exception during data generation", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            System.exit(1);
        }
    }
}
