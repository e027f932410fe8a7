package romantools;

/**
 * Hook points called while text is segmented and converted. Every method defaults to a no-op,
 * so implementations override only the events they care about.
 *
 * @see LoggingCrumbObserver
 */
public interface CrumbObserver {

    /**
     * Observer that ignores every event.
     */
    CrumbObserver NOOP = new CrumbObserver() {
    };

    /**
     * An action (segmentation, conversion, ...) started or moved to a new stage.
     */
    default void stage(String stage, String message) {
    }

    /**
     * The initial of {@code text} was found ({@link ValidityTable#NO_INITIAL} for none).
     */
    default void initialFound(String text, String initial) {
    }

    default void finalFound(String text, String fin) {
    }

    /**
     * A syllable was built and checked against the validity table.
     */
    default void syllableValidated(Syllable syllable) {
    }

    /**
     * A segment was served from the engine's syllable cache.
     */
    default void syllableCached(String text) {
    }

    /**
     * A syllable was converted; {@code cached} is {@code true} when the converter cache served it.
     */
    default void syllableConverted(String source, String target, boolean cached) {
    }

    /**
     * A word was reassembled into its output spelling.
     */
    default void wordAssembled(String preview, String output) {
    }

    /**
     * A non-letter span was passed through.
     */
    default void nonText(String text) {
    }
}
