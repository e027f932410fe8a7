package romantools;

import java.util.*;

/**
 * One syllable carved from a letter run by the {@link SyllableEngine}.
 *
 * <p>All spellings except {@link #originalText()} are lower-cased. The initial is empty for
 * vowel-initial syllables; the {@link ValidityTable#NO_INITIAL} sentinel is only used for table
 * lookups. Instances are immutable and may be shared through the engine cache.</p>
 */
public final class Syllable {
    private final String sourceText;
    private final String initial;
    private final String fin;
    private final String fullSyllable;
    private final String remainder;
    private final boolean valid;
    private final String leadingSymbol;
    private final boolean leadingApostrophe;
    private final boolean leadingDash;
    private final String originalText;
    private final boolean uppercase;
    private final boolean titleCase;
    private final List<String> errors;

    Syllable(String sourceText, String initial, String fin, String remainder, boolean valid,
             String leadingSymbol, boolean leadingApostrophe, boolean leadingDash,
             String originalText, List<String> errors) {
        this.sourceText = sourceText;
        this.initial = initial;
        this.fin = fin;
        this.fullSyllable = initial + fin;
        this.remainder = remainder;
        this.valid = valid;
        this.leadingSymbol = leadingSymbol;
        this.leadingApostrophe = leadingApostrophe;
        this.leadingDash = leadingDash;
        this.originalText = originalText;
        this.uppercase = isUpper(originalText);
        this.titleCase = isTitle(originalText);
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    /**
     * At least one cased letter and no lower-case letter.
     */
    static boolean isUpper(String text) {
        boolean cased = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLowerCase(c)) return false;
            if (Character.isUpperCase(c)) cased = true;
        }
        return cased;
    }

    /**
     * Letters only: an upper-case first letter followed by lower-case letters.
     */
    static boolean isTitle(String text) {
        boolean first = true;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isLetter(c)) continue;
            if (first) {
                if (!Character.isUpperCase(c)) return false;
                first = false;
            } else if (!Character.isLowerCase(c)) {
                return false;
            }
        }
        return !first;
    }

    /**
     * Re-applies this syllable's casing to a converted spelling.
     *
     * @param text a lower-case spelling
     * @return the spelling upper-cased, capitalized or unchanged
     */
    public String applyCaps(String text) {
        if (text.isEmpty()) return text;
        if (uppercase) return text.toUpperCase(Locale.ROOT);
        if (titleCase) {
            return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1).toLowerCase(Locale.ROOT);
        }
        return text;
    }

    /**
     * Lower-cased text this syllable was parsed from, leading symbol stripped, remainder included.
     */
    public String sourceText() {
        return sourceText;
    }

    public String initial() {
        return initial;
    }

    public String finalPart() {
        return fin;
    }

    /**
     * {@code initial + final}.
     */
    public String fullSyllable() {
        return fullSyllable;
    }

    /**
     * Unconsumed lower-cased suffix of {@link #sourceText()}.
     */
    public String remainder() {
        return remainder;
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * The apostrophe or dash stripped from the front of the segment before parsing, verbatim,
     * or an empty string.
     */
    public String leadingSymbol() {
        return leadingSymbol;
    }

    public boolean hasLeadingApostrophe() {
        return leadingApostrophe;
    }

    public boolean hasLeadingDash() {
        return leadingDash;
    }

    /**
     * The input slice of {@link #fullSyllable()}, original case and characters.
     */
    public String originalText() {
        return originalText;
    }

    public boolean isUppercase() {
        return uppercase;
    }

    public boolean isTitleCase() {
        return titleCase;
    }

    /**
     * Full syllable with any kept leading apostrophe removed and apostrophe variants folded.
     */
    public String coreText() {
        return RomanizationChars.foldApostrophes(RomanizationChars.stripLeadingApostrophes(fullSyllable));
    }

    /**
     * Input text this syllable consumed: the stripped symbol followed by the original slice.
     */
    public String consumedText() {
        return leadingSymbol + originalText;
    }

    /**
     * Diagnostics for an invalid syllable; empty when valid.
     */
    public List<String> errors() {
        return errors;
    }

    @Override
    public String toString() {
        return "Syllable{" + (leadingSymbol.isEmpty() ? "" : leadingSymbol) + fullSyllable
                + (valid ? "" : " (invalid)") + (remainder.isEmpty() ? "" : " | " + remainder) + "}";
    }
}
