package romantools;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bundle of every table the romanization engine consumes: one validity matrix per method, the
 * cross-method conversion rows and the stopword list.
 *
 * <p>This class supports loading from:
 * <ul>
 *     <li>A precompiled JSON bundle ({@code romanization_data.json}), see {@link #fromJson(File)}</li>
 *     <li>The plain-text sources under {@code dicts/}, see {@link #fromDicts(String)}</li>
 * </ul>
 *
 * <p>The public fields are the serialized form. Derived structures ({@link ValidityTable},
 * the stopword set) are built lazily on first use and cached per instance.</p>
 */
public class RomanizationData {
    private static final Logger LOGGER = Logger.getLogger(RomanizationData.class.getName());

    static {
        LOGGER.setLevel(Level.OFF);
    }

    static void setVerboseLogging(boolean enabled) {
        LOGGER.setLevel(enabled ? Level.INFO : Level.OFF);
    }

    /**
     * Name of the conversion CSV column holding row annotations.
     */
    public static final String META_COLUMN = "meta";

    /**
     * Meta value for syllables with no spelling in the target method.
     */
    public static final String META_RARE = "rare";

    /**
     * Serialized validity matrix of one method.
     */
    public static class MethodTable {
        /**
         * Row labels, sentinel included.
         */
        public List<String> initials = new ArrayList<>();

        /**
         * Column labels.
         */
        public List<String> finals = new ArrayList<>();

        /**
         * One bit string per initial, {@code '1'} marking a valid pair.
         */
        public List<String> rows = new ArrayList<>();

        public MethodTable() {
        }

        public MethodTable(List<String> initials, List<String> finals, List<String> rows) {
            this.initials = initials;
            this.finals = finals;
            this.rows = rows;
        }

        ValidityTable toValidityTable() {
            boolean[][] matrix = new boolean[rows.size()][];
            for (int i = 0; i < rows.size(); i++) {
                String bits = rows.get(i);
                matrix[i] = new boolean[bits.length()];
                for (int f = 0; f < bits.length(); f++) {
                    matrix[i][f] = bits.charAt(f) == '1';
                }
            }
            return new ValidityTable(initials, finals, matrix);
        }
    }

    /**
     * One row of the conversion mapping: the spelling of a syllable in each method, keyed by
     * method shorthand, plus an optional annotation.
     */
    public static class ConversionRow {
        public Map<String, String> spellings = new LinkedHashMap<>();
        public String meta = "";

        public ConversionRow() {
        }

        public ConversionRow(Map<String, String> spellings, String meta) {
            this.spellings = spellings;
            this.meta = meta;
        }

        /**
         * Spelling in the given method, or an empty string.
         */
        public String spelling(RomanizationMethod method) {
            String s = spellings.get(method.asStr());
            return s == null ? "" : s;
        }

        public boolean rare() {
            return META_RARE.equals(meta);
        }
    }

    public Map<String, MethodTable> methods = new LinkedHashMap<>();
    public List<ConversionRow> conversions = new ArrayList<>();
    public List<String> stopwords = new ArrayList<>();

    // --- lazily derived structures ---

    private final Map<RomanizationMethod, AtomicReference<ValidityTable>> tableSlots =
            new EnumMap<>(RomanizationMethod.class);
    private final AtomicReference<Set<String>> stopwordSlot = new AtomicReference<>();

    public RomanizationData() {
        for (RomanizationMethod m : RomanizationMethod.values()) {
            tableSlots.put(m, new AtomicReference<>());
        }
    }

    /**
     * Returns the validity table of {@code method}, building it on first access.
     *
     * @param method the romanization method
     * @return the shared immutable table
     * @throws IllegalStateException if this bundle has no table for the method
     */
    public ValidityTable validityTable(RomanizationMethod method) {
        return getOrInit(tableSlots.get(method), () -> {
            MethodTable t = methods.get(method.asStr());
            if (t == null) {
                throw new IllegalStateException("No validity table loaded for method: " + method.prettyName());
            }
            ValidityTable table = t.toValidityTable();
            LOGGER.info("Built validity table for " + method.prettyName() + ": " + table);
            return table;
        });
    }

    /**
     * Stopwords as a set, built on first access.
     */
    public Set<String> stopwordSet() {
        return getOrInit(stopwordSlot, () -> Collections.unmodifiableSet(new HashSet<>(stopwords)));
    }

    /**
     * Builds the single-syllable lookup from {@code from} spellings to {@code to} spellings.
     */
    public ConversionTable conversionTable(RomanizationMethod from, RomanizationMethod to) {
        return new ConversionTable(from, to, conversions);
    }

    private static <T> T getOrInit(AtomicReference<T> slot, Callable<T> build) {
        T v = slot.get();
        if (v != null) return v;
        try {
            T built = build.call();
            return slot.compareAndSet(null, built) ? built : slot.get();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    @Override
    public String toString() {
        return "<RomanizationData with " + methods.size() + " methods, " + conversions.size()
                + " conversion rows, " + stopwords.size() + " stopwords>";
    }

    // --- JSON ---

    /**
     * Loads a bundle from a JSON file.
     *
     * @param jsonFile the JSON file to read
     * @return the parsed bundle
     * @throws IOException if reading fails
     */
    public static RomanizationData fromJson(File jsonFile) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(jsonFile, RomanizationData.class);
    }

    public static RomanizationData fromJson(String path) throws IOException {
        return fromJson(new File(path));
    }

    /**
     * Loads a bundle from a JSON stream, typically a classpath resource.
     *
     * @param in the input stream containing the JSON data
     * @return the parsed bundle
     * @throws IOException if the JSON cannot be read or parsed
     */
    public static RomanizationData fromJson(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(in, RomanizationData.class);
    }

    /**
     * Serializes this bundle to a pretty-printed JSON file.
     *
     * @param outputPath the output path where the JSON should be written
     * @throws RuntimeException if writing the file fails
     */
    public void serializeToJson(String outputPath) {
        ObjectMapper mapper = new ObjectMapper();
        try (Writer writer = new OutputStreamWriter(Files.newOutputStream(Paths.get(outputPath)), StandardCharsets.UTF_8)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, this);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write JSON to: " + outputPath, e);
        }
    }

    // --- plain-text sources ---

    static final String CONVERSION_FILE = "conversion_mapping.csv";
    static final String STOPWORDS_FILE = "stopwords.txt";

    /**
     * Validity CSV file name of a method, e.g. {@code pyDF.csv}.
     */
    static String validityFile(RomanizationMethod method) {
        return method.asStr() + "DF.csv";
    }

    /**
     * Equivalent to {@code fromDicts("dicts")}.
     */
    public static RomanizationData fromDicts() {
        return fromDicts("dicts");
    }

    /**
     * Loads every table from the plain-text sources under {@code basePath}.
     * <p>
     * Each file is read from the file system path {@code basePath/filename} when it exists,
     * otherwise from the classpath resource {@code /basePath/filename}.
     * </p>
     *
     * @param basePath the directory (file system or classpath) holding the sources
     * @return a fully populated bundle
     * @throws RuntimeException if a file is missing or malformed
     */
    public static RomanizationData fromDicts(String basePath) {
        final RomanizationData r = new RomanizationData();

        for (RomanizationMethod method : RomanizationMethod.values()) {
            String filename = validityFile(method);
            r.methods.put(method.asStr(), readSource(basePath, filename, RomanizationData::parseValidityCsv));
        }
        r.conversions.addAll(readSource(basePath, CONVERSION_FILE, RomanizationData::parseConversionCsv));
        r.stopwords.addAll(readSource(basePath, STOPWORDS_FILE, RomanizationData::parseStopwords));

        LOGGER.info("Loaded " + r + " from " + basePath);
        return r;
    }

    private interface SourceParser<T> {
        T parse(BufferedReader br) throws IOException;
    }

    private static <T> T readSource(String basePath, String filename, SourceParser<T> parser) {
        final Path fsPath = Paths.get(basePath, filename);
        try {
            if (Files.exists(fsPath)) {
                try (BufferedReader br = Files.newBufferedReader(fsPath, StandardCharsets.UTF_8)) {
                    return parser.parse(br);
                }
            }
            final String resPath = "/" + basePath + "/" + filename;
            try (InputStream in = RomanizationData.class.getResourceAsStream(resPath)) {
                if (in == null) throw new FileNotFoundException("Missing resource: " + resPath +
                        " (also checked FS: " + fsPath.toAbsolutePath() + ")");
                try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                    return parser.parse(br);
                }
            }
        } catch (IOException | RuntimeException ex) {
            throw new RuntimeException("Error loading romanization data: " + filename, ex);
        }
    }

    /**
     * Parses a validity CSV: the header's cells 1..n are the finals, column 0 of every following
     * row is an initial and a cell of {@code 1} marks a valid pair.
     */
    static MethodTable parseValidityCsv(BufferedReader br) throws IOException {
        String header = br.readLine();
        if (header == null) throw new IOException("Empty validity table");
        String[] head = stripBom(header).split(",", -1);
        List<String> finals = new ArrayList<>();
        for (int i = 1; i < head.length; i++) {
            finals.add(head[i].trim());
        }

        List<String> initials = new ArrayList<>();
        List<String> rows = new ArrayList<>();
        String line;
        int lineNo = 1;
        while ((line = br.readLine()) != null) {
            lineNo++;
            if (line.trim().isEmpty()) continue;
            String[] cells = line.split(",", -1);
            if (cells.length != head.length) {
                throw new IOException("Line " + lineNo + ": expected " + head.length + " cells, got " + cells.length);
            }
            initials.add(RomanizationChars.foldApostrophes(cells[0].trim()));
            StringBuilder bits = new StringBuilder(finals.size());
            for (int i = 1; i < cells.length; i++) {
                bits.append("1".equals(cells[i].trim()) ? '1' : '0');
            }
            rows.add(bits.toString());
        }
        return new MethodTable(initials, finals, rows);
    }

    /**
     * Parses the conversion CSV. The header names one column per method shorthand plus the
     * {@value #META_COLUMN} column.
     */
    static List<ConversionRow> parseConversionCsv(BufferedReader br) throws IOException {
        String header = br.readLine();
        if (header == null) throw new IOException("Empty conversion table");
        String[] head = stripBom(header).split(",", -1);
        int metaCol = -1;
        for (int i = 0; i < head.length; i++) {
            head[i] = head[i].trim();
            if (META_COLUMN.equals(head[i])) metaCol = i;
        }

        List<ConversionRow> rows = new ArrayList<>();
        String line;
        while ((line = br.readLine()) != null) {
            if (line.trim().isEmpty()) continue;
            String[] cells = line.split(",", -1);
            Map<String, String> spellings = new LinkedHashMap<>();
            String meta = "";
            for (int i = 0; i < head.length; i++) {
                String cell = i < cells.length ? cells[i].trim() : "";
                if (i == metaCol) {
                    meta = cell;
                } else {
                    spellings.put(head[i], RomanizationChars.foldApostrophes(cell));
                }
            }
            rows.add(new ConversionRow(spellings, meta));
        }
        return rows;
    }

    /**
     * One lower-cased word per line; blank lines and {@code #} comments are skipped.
     */
    static List<String> parseStopwords(BufferedReader br) throws IOException {
        List<String> words = new ArrayList<>();
        String line;
        while ((line = br.readLine()) != null) {
            String w = stripBom(line).trim();
            if (w.isEmpty() || w.startsWith("#")) continue;
            words.add(RomanizationChars.foldApostrophes(w.toLowerCase(Locale.ROOT)));
        }
        return words;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
