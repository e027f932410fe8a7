package romantools;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for processing romanized Mandarin text written in Pinyin or Wade-Giles.
 *
 * <p>Every action chunks the input (see {@link TextChunker}), parses each letter run into
 * syllables and then segments, validates, counts, detects or converts:</p>
 * <pre>{@code
 * RoManTools tools = new RoManTools();
 * tools.segment("Zhongguo ti'an tianqi", RomanizationMethod.PINYIN); // [[zhong, guo], [ti, an], [tian, qi]]
 * tools.convert("ni hao chang'an yuan", RomanizationMethod.PINYIN, RomanizationMethod.WADE_GILES);
 * // ni hao ch'ang-an yüan
 * tools.cherryPick("Welcome to Zhongguo", RomanizationMethod.PINYIN, RomanizationMethod.WADE_GILES);
 * // Welcome to Chung-kuo
 * }</pre>
 *
 * <p>Tables are shared read-only. Each instance owns its syllable and conversion caches, which
 * are safe for concurrent use.</p>
 */
public class RoManTools {
    /**
     * Internal logger used for diagnostic and fallback messages.
     * Logging is disabled by default.
     */
    private static final Logger LOGGER = Logger.getLogger(RoManTools.class.getName());

    static {
        // Disable logging by default
        LOGGER.setLevel(Level.OFF);
    }

    /**
     * Enables or disables verbose logging of data loading and per-action diagnostics.
     *
     * @param enabled {@code true} to enable logging, {@code false} to disable it
     */
    public static void setVerboseLogging(boolean enabled) {
        LOGGER.setLevel(enabled ? Level.INFO : Level.OFF);
        RomanizationData.setVerboseLogging(enabled);
    }

    /**
     * Lazily loaded shared {@link RomanizationData}.
     * <p>
     * Loading order:
     * </p>
     * <ol>
     *   <li>{@code dicts/romanization_data.json} on the file system</li>
     *   <li>{@code /dicts/romanization_data.json} on the classpath</li>
     *   <li>the plain-text sources via {@link RomanizationData#fromDicts()}</li>
     * </ol>
     *
     * <p>If all attempts fail, a {@link RuntimeException} is thrown.</p>
     */
    public static final class DataHolder {
        private DataHolder() {
        }

        private static class Holder {
            private static final RomanizationData DEFAULT = load();
        }

        /**
         * Returns the shared data, loading it on first invocation.
         *
         * @return the shared data bundle
         * @throws RuntimeException if no source can be loaded
         */
        public static RomanizationData get() {
            return Holder.DEFAULT;
        }

        private static RomanizationData load() {
            try {
                Path jsonPath = Paths.get("dicts", "romanization_data.json");
                if (Files.exists(jsonPath)) {
                    LOGGER.info("Loading romanization data from " + jsonPath.toAbsolutePath());
                    return RomanizationData.fromJson(jsonPath.toString());
                }
                try (InputStream in = RomanizationData.class.getResourceAsStream("/dicts/romanization_data.json")) {
                    if (in != null) return RomanizationData.fromJson(in);
                    LOGGER.info("No JSON bundle found, loading plain-text sources");
                    return RomanizationData.fromDicts();
                }
            } catch (Exception e) {
                throw new RuntimeException("Failed to load romanization data", e);
            }
        }
    }

    private final RomanizationData data;
    private final RoManConfig config;
    private final CrumbObserver observer;
    private final ConcurrentMap<RomanizationMethod, SyllableEngine> engines = new ConcurrentHashMap<>();
    private final ConverterCache converters;

    /**
     * Diagnostics of the last action, filled when {@link RoManConfig#isErrorReport()} is set.
     */
    private volatile List<String> lastErrors = Collections.emptyList();

    /**
     * Shared data, all flags off.
     */
    public RoManTools() {
        this(RoManConfig.defaults());
    }

    public RoManTools(RoManConfig config) {
        this(DataHolder.get(), config);
    }

    public RoManTools(RomanizationData data, RoManConfig config) {
        this(data, config, config.isCrumbs() ? new LoggingCrumbObserver() : CrumbObserver.NOOP);
    }

    /**
     * @param data     the tables to use
     * @param config   processing flags
     * @param observer receives crumbs; replaces the default logging observer
     */
    public RoManTools(RomanizationData data, RoManConfig config, CrumbObserver observer) {
        this.data = Objects.requireNonNull(data);
        this.config = Objects.requireNonNull(config);
        this.observer = observer == null ? CrumbObserver.NOOP : observer;
        this.converters = new ConverterCache(() -> this.data, this.observer);
    }

    public RoManConfig getConfig() {
        return config;
    }

    public RomanizationData getData() {
        return data;
    }

    /**
     * Diagnostics collected by the last action; empty unless error reporting is enabled.
     */
    public List<String> getLastErrors() {
        return lastErrors;
    }

    /**
     * Supported methods, one line each, e.g. {@code "pinyin or py: Pinyin"}.
     */
    public static List<String> listMethods() {
        List<String> out = new ArrayList<>();
        for (RomanizationMethod m : RomanizationMethod.values()) {
            out.add(m.fullName() + " or " + m.asStr() + ": " + m.prettyName());
        }
        return out;
    }

    // --- building blocks ---

    /**
     * Engine of {@code method}, created on first use.
     *
     * @throws IllegalStateException if the data has no table for the method
     */
    public SyllableEngine engine(RomanizationMethod method) {
        return engines.computeIfAbsent(method, m -> new SyllableEngine(
                m.createStrategy(data.validityTable(m)), new BoundedCache<>(), observer));
    }

    /**
     * Chunks {@code text} for {@code method}; literals are kept only when errors are skipped.
     */
    public List<Chunk> chunks(String text, RomanizationMethod method) {
        return chunks(text, method, config.isErrorSkip());
    }

    private List<Chunk> chunks(String text, RomanizationMethod method, boolean keepLiterals) {
        Objects.requireNonNull(method, "method");
        return new TextChunker(engine(method), keepLiterals, observer).chunk(text);
    }

    private static List<Chunk.Word> words(List<Chunk> chunks) {
        List<Chunk.Word> out = new ArrayList<>();
        for (Chunk c : chunks) {
            if (c.isWord()) out.add((Chunk.Word) c);
        }
        return out;
    }

    private void record(List<Chunk> chunks) {
        if (!config.isErrorReport()) {
            lastErrors = Collections.emptyList();
            return;
        }
        List<String> errors = new ArrayList<>();
        for (Chunk.Word w : words(chunks)) {
            for (Syllable s : w.syllables()) {
                for (String e : s.errors()) {
                    errors.add(w.text() + ": " + e);
                }
            }
        }
        if (!errors.isEmpty()) {
            LOGGER.log(Level.WARNING, errors.size() + " problem(s) found");
        }
        lastErrors = Collections.unmodifiableList(errors);
    }

    // --- actions ---

    /**
     * Segments {@code text} into syllables, chunk by chunk.
     *
     * @param text   the text
     * @param method its romanization method
     * @return one {@link Segment} per chunk
     */
    public List<Segment> segment(String text, RomanizationMethod method) {
        observer.stage("Segment Text", "Processing text");
        List<Chunk> chunks = chunks(text, method);
        List<Segment> out = new ArrayList<>(chunks.size());
        for (Chunk c : chunks) {
            out.add(c.isWord() ? Segment.word(((Chunk.Word) c).spellings()) : Segment.literal(c.text()));
        }
        record(chunks);
        observer.stage("Segment Text", "Assembling segments");
        return out;
    }

    /**
     * Returns {@code true} when every syllable of {@code text} is valid.
     */
    public boolean validate(String text, RomanizationMethod method) {
        observer.stage("Validation", "Processing text");
        List<Chunk> chunks = chunks(text, method);
        record(chunks);
        for (Chunk.Word w : words(chunks)) {
            if (!w.allValid()) return false;
        }
        return true;
    }

    /**
     * Validity of every word and each of its syllables.
     */
    public List<WordValidation> validatePerWord(String text, RomanizationMethod method) {
        observer.stage("Validation", "Processing text per word");
        List<Chunk> chunks = chunks(text, method);
        record(chunks);
        List<WordValidation> out = new ArrayList<>();
        for (Chunk.Word w : words(chunks)) {
            List<Boolean> valid = new ArrayList<>();
            for (Syllable s : w.syllables()) valid.add(s.isValid());
            out.add(new WordValidation(String.join("", w.spellings()), w.spellings(), valid));
        }
        return out;
    }

    /**
     * Converts {@code text} from one method to another.
     *
     * <p>With errors not skipped, only words are kept and they are joined with single spaces;
     * unknown syllables carry a {@code (!)} marker. With errors skipped, non-letter text is kept
     * verbatim and invalid words pass through unchanged.</p>
     */
    public String convert(String text, RomanizationMethod from, RomanizationMethod to) {
        return convert(text, from, to, config.isErrorSkip());
    }

    /**
     * Converts only the convertible words of {@code text}, leaving every other character as it
     * was. Always runs with errors skipped.
     */
    public String cherryPick(String text, RomanizationMethod from, RomanizationMethod to) {
        return convert(text, from, to, true);
    }

    private String convert(String text, RomanizationMethod from, RomanizationMethod to, boolean errorSkip) {
        Objects.requireNonNull(to, "to");
        List<Chunk> chunks = chunks(text, from, errorSkip);
        observer.stage("Converting text", from.prettyName() + " -> " + to.prettyName());
        WordReconstructor reconstructor = new WordReconstructor(converters.get(from, to),
                engine(to).strategy(), data.stopwordSet(), errorSkip, observer);

        List<String> parts = new ArrayList<>(chunks.size());
        for (Chunk c : chunks) {
            parts.add(c.isWord() ? reconstructor.reconstruct((Chunk.Word) c) : c.text());
        }
        record(chunks);
        return String.join(errorSkip ? "" : " ", parts);
    }

    /**
     * Syllable count of every word; 0 for a word with an invalid syllable.
     */
    public List<Integer> countSyllables(String text, RomanizationMethod method) {
        observer.stage("Syllable Count", "Processing text");
        List<Chunk> chunks = chunks(text, method);
        record(chunks);
        List<Integer> out = new ArrayList<>();
        for (Chunk.Word w : words(chunks)) {
            out.add(w.allValid() ? w.syllables().size() : 0);
        }
        return out;
    }

    /**
     * Shorthands of the methods under which the whole of {@code text} is valid.
     */
    public List<String> detectMethod(String text) {
        observer.stage("Detect Method", "Processing text");
        return detect(text);
    }

    /**
     * Methods accepting each word of {@code text}, split on Unicode whitespace (no-break spaces included).
     */
    public List<WordMethods> detectMethodPerWord(String text) {
        observer.stage("Detect Method", "Processing text per word");
        List<WordMethods> out = new ArrayList<>();
        if (text == null) return out;
        for (String word : text.split("(?U)\\s+")) {
            if (word.isEmpty()) continue;
            out.add(new WordMethods(word, detect(word)));
        }
        return out;
    }

    private List<String> detect(String text) {
        List<String> out = new ArrayList<>();
        for (RomanizationMethod m : RomanizationMethod.values()) {
            List<Chunk.Word> words = words(chunks(text, m));
            if (words.isEmpty()) continue;
            boolean any = false;
            boolean all = true;
            for (Chunk.Word w : words) {
                if (!w.syllables().isEmpty()) any = true;
                if (!w.allValid()) all = false;
            }
            if (any && all) out.add(m.asStr());
        }
        return out;
    }

    // --- results ---

    /**
     * One chunk of segmented text: a word's syllables or a literal. Serializes as a JSON array of
     * strings or a JSON string.
     */
    public static final class Segment {
        private final List<String> syllables;
        private final String literal;

        private Segment(List<String> syllables, String literal) {
            this.syllables = syllables;
            this.literal = literal;
        }

        public static Segment word(List<String> syllables) {
            return new Segment(Collections.unmodifiableList(new ArrayList<>(syllables)), null);
        }

        public static Segment literal(String text) {
            return new Segment(null, text);
        }

        public boolean isWord() {
            return syllables != null;
        }

        /**
         * Syllables of a word; empty for a literal.
         */
        public List<String> syllables() {
            return syllables == null ? Collections.<String>emptyList() : syllables;
        }

        /**
         * Literal text, or the syllables joined for a word.
         */
        public String text() {
            return literal != null ? literal : String.join("", syllables);
        }

        @JsonValue
        public Object value() {
            return syllables != null ? syllables : literal;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Segment)) return false;
            Segment s = (Segment) o;
            return Objects.equals(syllables, s.syllables) && Objects.equals(literal, s.literal);
        }

        @Override
        public int hashCode() {
            return Objects.hash(syllables, literal);
        }

        @Override
        public String toString() {
            return String.valueOf(value());
        }
    }

    /**
     * Per-word validation result.
     */
    @JsonPropertyOrder({"word", "syllables", "valid"})
    public static final class WordValidation {
        private final String word;
        private final List<String> syllables;
        private final List<Boolean> valid;

        public WordValidation(String word, List<String> syllables, List<Boolean> valid) {
            this.word = word;
            this.syllables = Collections.unmodifiableList(new ArrayList<>(syllables));
            this.valid = Collections.unmodifiableList(new ArrayList<>(valid));
        }

        public String getWord() {
            return word;
        }

        public List<String> getSyllables() {
            return syllables;
        }

        public List<Boolean> getValid() {
            return valid;
        }

        @Override
        public String toString() {
            return "{word=" + word + ", syllables=" + syllables + ", valid=" + valid + "}";
        }
    }

    /**
     * Methods accepting one word.
     */
    @JsonPropertyOrder({"word", "methods"})
    public static final class WordMethods {
        private final String word;
        private final List<String> methods;

        public WordMethods(String word, List<String> methods) {
            this.word = word;
            this.methods = Collections.unmodifiableList(new ArrayList<>(methods));
        }

        public String getWord() {
            return word;
        }

        public List<String> getMethods() {
            return methods;
        }

        @Override
        public String toString() {
            return "{word=" + word + ", methods=" + methods + "}";
        }
    }
}
