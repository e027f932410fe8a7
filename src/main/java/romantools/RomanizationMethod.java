package romantools;

import java.util.*;

/**
 * Supported romanization methods.
 *
 * <p>Each constant carries its shorthand ({@code "py"}, {@code "wg"}), which is also the column
 * name used by the conversion table, and its display name. Each constant builds the
 * {@link RomanizationStrategy} that knows how to carve that method's syllables.</p>
 *
 * <p>Adding a method means adding a constant, a strategy subclass and its data files.</p>
 */
public enum RomanizationMethod {

    /**
     * Hanyu Pinyin.
     */
    PINYIN("py", "Pinyin") {
        @Override
        RomanizationStrategy createStrategy(ValidityTable table) {
            return new PinyinStrategy(table);
        }
    },

    /**
     * Wade-Giles.
     */
    WADE_GILES("wg", "Wade-Giles") {
        @Override
        RomanizationStrategy createStrategy(ValidityTable table) {
            return new WadeGilesStrategy(table);
        }
    };

    private final String shorthand;
    private final String prettyName;

    RomanizationMethod(String shorthand, String prettyName) {
        this.shorthand = shorthand;
        this.prettyName = prettyName;
    }

    /**
     * Creates the segmentation strategy of this method over the given validity table.
     *
     * @param table the method's validity table
     * @return a new strategy instance
     */
    abstract RomanizationStrategy createStrategy(ValidityTable table);

    /**
     * Returns the shorthand of this method.
     * <p>
     * Example: {@code WADE_GILES.asStr()} → {@code "wg"}.
     * </p>
     *
     * @return the shorthand
     */
    public String asStr() {
        return shorthand;
    }

    /**
     * Display name, e.g. {@code "Wade-Giles"}.
     */
    public String prettyName() {
        return prettyName;
    }

    /**
     * Lower-case full name, e.g. {@code "wade-giles"}.
     */
    public String fullName() {
        return prettyName.toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive index of shorthand, full name and enum name.
     */
    private static final Map<String, RomanizationMethod> LOOKUP = buildLookup();

    private static Map<String, RomanizationMethod> buildLookup() {
        Map<String, RomanizationMethod> m = new HashMap<>();
        for (RomanizationMethod method : values()) {
            m.put(method.name().toLowerCase(Locale.ROOT), method);
            m.put(method.shorthand, method);
            m.put(method.fullName(), method);
        }
        return Collections.unmodifiableMap(m);
    }

    /**
     * Parses a method name, accepting the shorthand ({@code "py"}), the full name
     * ({@code "pinyin"}, {@code "wade-giles"}) or the enum name ({@code "WADE_GILES"}),
     * ignoring case.
     *
     * @param value the method name
     * @return the matching method
     * @throws IllegalArgumentException if {@code value} is {@code null}, empty or unknown
     */
    public static RomanizationMethod fromStr(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Romanization method cannot be null");
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Romanization method cannot be empty");
        }
        RomanizationMethod method = LOOKUP.get(trimmed.toLowerCase(Locale.ROOT));
        if (method == null) {
            throw new IllegalArgumentException("Unsupported romanization method: " + value);
        }
        return method;
    }

    /**
     * Tolerant variant of {@link #fromStr(String)}; never throws.
     *
     * @param value the method name, may be {@code null}
     * @return the matching method, or {@code null} if unknown
     */
    public static RomanizationMethod tryParse(String value) {
        if (value == null) return null;
        return LOOKUP.get(value.trim().toLowerCase(Locale.ROOT));
    }
}
