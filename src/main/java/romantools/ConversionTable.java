package romantools;

import java.util.*;

/**
 * Single-syllable spelling lookup from one method to another, built from the conversion rows.
 *
 * <p>Keys are lower-cased with apostrophe variants folded. When several rows share a source
 * spelling, the first row wins, so variant spellings listed after the canonical row convert in
 * one direction only.</p>
 */
public final class ConversionTable {
    private final RomanizationMethod from;
    private final RomanizationMethod to;
    private final Map<String, String> targets = new HashMap<>();
    private final Set<String> rare = new HashSet<>();

    public ConversionTable(RomanizationMethod from, RomanizationMethod to,
                           List<RomanizationData.ConversionRow> rows) {
        this.from = from;
        this.to = to;
        for (RomanizationData.ConversionRow row : rows) {
            String source = key(row.spelling(from));
            if (source.isEmpty() || targets.containsKey(source) || rare.contains(source)) continue;
            String target = row.spelling(to);
            if (!target.isEmpty()) {
                targets.put(source, target);
            } else if (row.rare()) {
                rare.add(source);
            }
        }
    }

    static String key(String syllable) {
        return RomanizationChars.foldApostrophes(syllable.toLowerCase(Locale.ROOT));
    }

    /**
     * Target spelling of {@code syllable}, or {@code null} when the table has none.
     */
    public String lookup(String syllable) {
        return targets.get(key(syllable));
    }

    /**
     * Returns {@code true} for syllables listed with no target spelling because they are rare.
     */
    public boolean isRare(String syllable) {
        return rare.contains(key(syllable));
    }

    public RomanizationMethod from() {
        return from;
    }

    public RomanizationMethod to() {
        return to;
    }

    public int size() {
        return targets.size();
    }
}
