package romantools;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes crumbs as {@code #}-prefixed log lines, one {@code #} per nesting level:
 * <pre>
 * # Segmentation: Processing text
 * ## initial found: zh
 * ### Syllable: "zhong" valid: true
 * </pre>
 * Invalid results are logged at {@link Level#WARNING}, everything else at {@link Level#INFO}.
 */
public class LoggingCrumbObserver implements CrumbObserver {
    private final Logger logger;

    public LoggingCrumbObserver() {
        this(Logger.getLogger("romantools.crumbs"));
    }

    public LoggingCrumbObserver(Logger logger) {
        this.logger = logger;
    }

    private void crumb(int level, String stage, String message, Level logLevel) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < level; i++) sb.append('#');
        sb.append(' ').append(stage);
        if (!message.isEmpty()) sb.append(": ").append(message);
        logger.log(logLevel, sb.toString());
    }

    @Override
    public void stage(String stage, String message) {
        crumb(1, stage, message, Level.INFO);
    }

    @Override
    public void initialFound(String text, String initial) {
        crumb(2, "initial found", initial, Level.INFO);
    }

    @Override
    public void finalFound(String text, String fin) {
        crumb(2, "final found", fin, Level.INFO);
    }

    @Override
    public void syllableValidated(Syllable syllable) {
        String msg = "\"" + syllable.fullSyllable() + "\" valid: " + syllable.isValid();
        if (syllable.isValid()) {
            crumb(3, "Syllable", msg, Level.INFO);
        } else {
            crumb(3, "Syllable", msg, Level.WARNING);
            for (String error : syllable.errors()) {
                crumb(3, "Validation", error, Level.WARNING);
            }
        }
    }

    @Override
    public void syllableCached(String text) {
        crumb(2, "Cached", "\"" + text + "\"", Level.INFO);
    }

    @Override
    public void syllableConverted(String source, String target, boolean cached) {
        crumb(2, cached ? "Cached" : "Converted text", "\"" + source + "\" -> \"" + target + "\"", Level.INFO);
    }

    @Override
    public void wordAssembled(String preview, String output) {
        crumb(2, "Word", "\"" + preview + "\" -> \"" + output + "\"", Level.INFO);
    }

    @Override
    public void nonText(String text) {
        crumb(2, "Non-text", "\"" + text + "\"", Level.INFO);
    }
}
