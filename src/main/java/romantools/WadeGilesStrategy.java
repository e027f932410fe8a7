package romantools;

import java.util.List;
import java.util.regex.Pattern;

import static romantools.ValidityTable.NO_INITIAL;

/**
 * Wade-Giles rules.
 *
 * <p>Apostrophes belong to aspirated initials ({@code ch'}, {@code k'}, {@code ts'} ...), so letter
 * runs are split at dashes only and the original apostrophe character stays inside the initial.
 * Without a separator the syllable boundary is ambiguous and is searched for:</p>
 * <ul>
 *   <li>with a known initial, the longest valid final whose remainder can open a syllable wins;</li>
 *   <li>without one, the shortest complete syllable whose remainder can open a syllable wins.</li>
 * </ul>
 * <p>Both searches look one syllable ahead only. When nothing fits, the whole text is returned
 * and fails validation.</p>
 */
public class WadeGilesStrategy extends RomanizationStrategy {
    private static final Pattern FINE_SPLIT = Pattern.compile(
            "[" + LETTERS + APOSTROPHE_CLASS + "]+|[" + DASH_CLASS + "][" + LETTERS + APOSTROPHE_CLASS + "]+");

    public WadeGilesStrategy(ValidityTable table) {
        super(table);
    }

    @Override
    public RomanizationMethod method() {
        return RomanizationMethod.WADE_GILES;
    }

    @Override
    public Pattern fineSplitPattern() {
        return FINE_SPLIT;
    }

    @Override
    public boolean stripsLeadingApostrophe() {
        return false;
    }

    /**
     * The apostrophe is part of the initial and keeps its original character.
     */
    @Override
    protected String handleApostropheInInitial(String text, int index) {
        return text.substring(0, index + 1);
    }

    @Override
    public String findFinal(String text, String initial, List<String> errors) {
        int apostrophe = RomanizationChars.indexOfApostrophe(text);
        if (apostrophe >= 0) {
            return finalBeforeSeparator(text, apostrophe);
        }
        if (!NO_INITIAL.equals(initial) && !initial.isEmpty()) {
            return longestFinal(text, initial);
        }
        return firstCompleteSyllable(text);
    }

    /**
     * The final ends where the aspirated initial owning the apostrophe at {@code index} begins,
     * so {@code inp'ing} yields {@code in}. Falls back to everything before the apostrophe.
     */
    String finalBeforeSeparator(String text, int index) {
        for (String initial : table.initialsLongestFirst()) {
            int stem = initial.length() - 1;
            if (stem < 1 || initial.charAt(stem) != RomanizationChars.APOSTROPHE || stem > index) continue;
            int start = index - stem;
            if (start > 0 && text.regionMatches(start, initial, 0, stem)) {
                return text.substring(0, start);
            }
        }
        return text.substring(0, index);
    }

    /**
     * Longest final that validates with {@code initial} and either consumes the text or leaves a
     * remainder that can open a syllable.
     */
    String longestFinal(String text, String initial) {
        for (int end = Math.min(text.length(), table.maxFinalLength()); end > 0; end--) {
            String fin = text.substring(0, end);
            if (!table.isValid(initial, fin)) continue;
            if (end == text.length() || canBeginSyllable(text, end)) {
                return fin;
            }
        }
        return text;
    }

    /**
     * Shortest prefix (at least two characters) that is a complete syllable and either consumes
     * the text or leaves a remainder that can open a syllable.
     */
    String firstCompleteSyllable(String text) {
        int limit = Math.min(text.length(), table.maxInitialLength() + table.maxFinalLength());
        for (int end = 2; end <= limit; end++) {
            String prefix = text.substring(0, end);
            if (!isCompleteSyllable(prefix)) continue;
            if (end == text.length() || canBeginSyllable(text, end)) {
                return prefix;
            }
        }
        return text;
    }

    /**
     * Splits {@code text} as known initial (longest first) plus final, or as a vowel-initial
     * final, and checks the table.
     */
    boolean isCompleteSyllable(String text) {
        for (String initial : table.initialsLongestFirst()) {
            if (text.startsWith(initial) && table.isValid(initial, text.substring(initial.length()))) {
                return true;
            }
        }
        return RomanizationChars.startsWithVowel(text) && table.isValid("", text);
    }

    /**
     * Every join gets a dash.
     */
    @Override
    public String joinSeparator(String prev, String curr) {
        return String.valueOf(RomanizationChars.DASH);
    }
}
