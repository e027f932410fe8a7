package romantools;

import java.util.Locale;
import java.util.Objects;

/**
 * Converts one syllable spelling through a {@link ConversionTable}, memoizing results by the
 * case-folded, apostrophe-folded spelling.
 *
 * <p>A syllable missing from the table comes back as {@code text + "(!)"}; a rare syllable with
 * no target spelling as {@code text + "(!rare Pinyin!)"} (the source method's name).</p>
 */
public class SyllableConverter {
    /**
     * Suffix appended to a syllable the table does not know.
     */
    public static final String MISS_MARKER = "(!)";

    private final ConversionTable table;
    private final BoundedCache<String, String> cache;
    private final CrumbObserver observer;

    public SyllableConverter(ConversionTable table) {
        this(table, new BoundedCache<>(), CrumbObserver.NOOP);
    }

    public SyllableConverter(ConversionTable table, BoundedCache<String, String> cache, CrumbObserver observer) {
        this.table = Objects.requireNonNull(table);
        this.cache = Objects.requireNonNull(cache);
        this.observer = observer == null ? CrumbObserver.NOOP : observer;
    }

    public RomanizationMethod from() {
        return table.from();
    }

    public RomanizationMethod to() {
        return table.to();
    }

    static String rareMarker(RomanizationMethod source) {
        return "(!rare " + source.prettyName() + "!)";
    }

    /**
     * Converts {@code text}. A hit is returned lower-case; a miss keeps {@code text} as given and
     * appends its marker.
     */
    public String convert(String text) {
        String result = resolve(text);
        return isMarker(result) ? text + result : result;
    }

    /**
     * Converts a parsed syllable and re-applies its casing. Misses keep the original spelling.
     */
    public String convert(Syllable syllable) {
        String result = resolve(syllable.fullSyllable());
        return isMarker(result) ? syllable.originalText() + result : syllable.applyCaps(result);
    }

    /**
     * Target spelling, or the marker to append for a miss.
     */
    private String resolve(String text) {
        String key = ConversionTable.key(text);
        String hit = cache.get(key);
        if (hit != null) {
            observer.syllableConverted(text, hit, true);
            return hit;
        }
        String result = cache.getOrCompute(key, this::lookup);
        observer.syllableConverted(text, result, false);
        return result;
    }

    private static boolean isMarker(String result) {
        return result.startsWith("(!");
    }

    private String lookup(String key) {
        String target = table.lookup(key);
        if (target != null) return target.toLowerCase(Locale.ROOT);
        if (table.isRare(key)) return rareMarker(table.from());
        return MISS_MARKER;
    }
}
