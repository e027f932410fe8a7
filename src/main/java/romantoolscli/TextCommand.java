package romantoolscli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import romantools.RoManTools;
import romantools.RomanizationMethod;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared plumbing of the text subcommands: input from the positional text, {@code -i <file>} or
 * stdin, output to stdout or {@code -o <file>}, JSON rendering of structured results and error
 * reporting.
 */
abstract class TextCommand implements Runnable {
    @Mixin
    CommonOptions common;

    @Parameters(paramLabel = "<text>", arity = "0..*", description = "Text to process (default: read -i <file> or stdin)")
    List<String> text;

    @Option(names = {"-i", "--input"}, paramLabel = "<file>", description = "Input file")
    File input;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output file")
    File output;

    @Spec
    CommandSpec spec;

    private static final Logger LOGGER = Logger.getLogger(TextCommand.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Runs the action and returns what should be printed.
     */
    abstract String execute(RoManTools tools, String inputText) throws Exception;

    @Override
    public void run() {
        try {
            RoManTools tools = new RoManTools(common.toConfig());
            String result = execute(tools, readInput());

            if (output != null) {
                Files.write(output.toPath(), result.getBytes(StandardCharsets.UTF_8));
            } else {
                PrintWriter out = spec.commandLine().getOut();
                out.println(result);
                out.flush();
            }

            if (common.errorReport && !tools.getLastErrors().isEmpty()) {
                PrintWriter err = spec.commandLine().getErr();
                tools.getLastErrors().forEach(e -> err.println("⚠ " + e));
                err.flush();
            }
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during " + spec.name(), e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            System.exit(1);
        }
    }

    String readInput() throws IOException {
        if (text != null && !text.isEmpty()) {
            return String.join(" ", text);
        }
        if (input != null) {
            return new String(Files.readAllBytes(input.toPath()), StandardCharsets.UTF_8);
        }
        if (System.console() != null) {
            System.err.println("Input text, <Ctrl+D> (Unix) <Ctrl-Z> (Windows) to submit:");
        }
        return stripTrailingNewline(new String(System.in.readAllBytes(), StandardCharsets.UTF_8));
    }

    private static String stripTrailingNewline(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r')) end--;
        return s.substring(0, end);
    }

    static RomanizationMethod method(String name) {
        return RomanizationMethod.fromStr(name);
    }

    static String toJson(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }
}
