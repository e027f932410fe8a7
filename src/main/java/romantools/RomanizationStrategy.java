package romantools;

import java.util.List;
import java.util.regex.Pattern;

import static romantools.ValidityTable.NO_INITIAL;

/**
 * Method-specific rules for carving one syllable off the front of a lower-cased letter run.
 *
 * <p>Subclasses supply final extraction, the pattern that splits a letter run at the separators
 * the method treats as syllable joins, and the separator to write between two converted syllables
 * when this method is the conversion target. Initial extraction and validation are shared.</p>
 */
public abstract class RomanizationStrategy {
    /**
     * Letters of a romanized word, as a regex character class body.
     */
    static final String LETTERS = "a-zA-Z" + RomanizationChars.EXTRA_LETTERS;
    static final String APOSTROPHE_CLASS = RomanizationChars.APOSTROPHES;
    static final String DASH_CLASS = "\\-–—";

    protected final ValidityTable table;

    protected RomanizationStrategy(ValidityTable table) {
        this.table = table;
    }

    public abstract RomanizationMethod method();

    public ValidityTable table() {
        return table;
    }

    /**
     * Splits a letter run into the sub-runs fed to the engine one by one.
     */
    public abstract Pattern fineSplitPattern();

    /**
     * Whether a leading apostrophe is removed before parsing. Methods whose apostrophes belong
     * to initials keep it.
     */
    public boolean stripsLeadingApostrophe() {
        return true;
    }

    /**
     * Extracts the initial of {@code text}.
     *
     * @param text   lower-cased text
     * @param errors receives an {@code invalid initial} diagnostic when the candidate is unknown
     * @return the initial, {@link ValidityTable#NO_INITIAL} for a vowel-initial syllable, or the
     * whole text when it has no vowel
     */
    public String findInitial(String text, List<String> errors) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (RomanizationChars.isVowel(c)) {
                if (i == 0) return NO_INITIAL;
                String initial = text.substring(0, i);
                if (!table.hasInitial(initial)) {
                    errors.add("invalid initial: '" + initial + "'");
                }
                return initial;
            }
            if (RomanizationChars.isApostrophe(c)) {
                return handleApostropheInInitial(text, i);
            }
            if (RomanizationChars.isDash(c)) {
                return handleDashInInitial(text, i);
            }
        }
        return text;
    }

    /**
     * Initial when an apostrophe is met at {@code index} before any vowel. By default the
     * apostrophe is a boundary and is not part of the initial.
     */
    protected String handleApostropheInInitial(String text, int index) {
        return text.substring(0, index);
    }

    protected String handleDashInInitial(String text, int index) {
        return text.substring(0, index);
    }

    /**
     * Extracts the final from {@code text}, the text following the initial (or the whole text
     * when the initial is {@link ValidityTable#NO_INITIAL}).
     *
     * @param text    lower-cased text starting where the final starts
     * @param initial the initial found by {@link #findInitial(String, List)}
     * @param errors  receives diagnostics
     * @return the final; may be empty only for text that cannot start a final
     */
    public abstract String findFinal(String text, String initial, List<String> errors);

    /**
     * Table lookup; an empty initial or the sentinel means "no initial".
     */
    public boolean validateSyllable(String initial, String fin) {
        return table.isValid(NO_INITIAL.equals(initial) ? "" : initial, fin);
    }

    /**
     * Separator written between two converted syllables when this method is the conversion target.
     *
     * @param prev previous converted syllable, lower-cased
     * @param curr current converted syllable, lower-cased
     * @return the separator, possibly empty
     */
    public abstract String joinSeparator(String prev, String curr);

    /**
     * Returns {@code true} if the suffix of {@code text} starting at {@code from} could open another
     * syllable: it has more than one character and starts with a known initial or a vowel.
     */
    protected boolean canBeginSyllable(String text, int from) {
        if (text.length() - from <= 1) return false;
        for (String initial : table.initialsLongestFirst()) {
            if (text.startsWith(initial, from)) return true;
        }
        return RomanizationChars.isVowel(text.charAt(from));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + method().asStr() + "]";
    }
}
