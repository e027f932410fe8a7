package romantools;

import java.util.List;
import java.util.regex.Pattern;

import static romantools.RomanizationChars.isVowel;

/**
 * Hanyu Pinyin rules.
 *
 * <p>Apostrophes and dashes only ever mark syllable joins, so letter runs are split at them before
 * parsing. Finals are found by scanning left to right: vowels extend the final while some valid
 * final still starts with the text seen so far, and the first consonant decides where it ends
 * (see {@link #handleConsonantCase(String, int, String)}).</p>
 */
public class PinyinStrategy extends RomanizationStrategy {
    private static final Pattern FINE_SPLIT = Pattern.compile(
            "[" + LETTERS + "]+|[" + APOSTROPHE_CLASS + DASH_CLASS + "][" + LETTERS + "]+");

    public PinyinStrategy(ValidityTable table) {
        super(table);
    }

    @Override
    public RomanizationMethod method() {
        return RomanizationMethod.PINYIN;
    }

    @Override
    public Pattern fineSplitPattern() {
        return FINE_SPLIT;
    }

    @Override
    public String findFinal(String text, String initial, List<String> errors) {
        for (int i = 0; i < text.length(); i++) {
            if (isVowel(text.charAt(i))) {
                String fin = handleVowelCase(text, i, initial, errors);
                if (fin != null) return fin;
            } else {
                return handleConsonantCase(text, i, initial);
            }
        }
        return text;
    }

    /**
     * Vowel at {@code i}: keep scanning while a valid final starts with {@code text[0..i]};
     * otherwise stop before this vowel. A lone leading vowel is never rejected on its own.
     *
     * @return the final, or {@code null} to continue scanning
     */
    String handleVowelCase(String text, int i, String initial, List<String> errors) {
        if (i + 1 == text.length()) return text;
        if (!table.hasValidFinalStartingWith(initial, text.substring(0, i + 1))) {
            errors.add("invalid final: '" + text + "'");
            return i == 0 ? null : text.substring(0, i);
        }
        return null;
    }

    /**
     * Consonant at {@code i}.
     * <ul>
     *   <li>{@code er}: ends after the {@code r} unless a vowel follows.</li>
     *   <li>{@code ng}: kept when nothing follows the {@code g}, a consonant follows it, or the
     *       {@code n}-only final is not valid; otherwise the {@code g} opens the next syllable.</li>
     *   <li>{@code n}: kept unless a vowel follows and the final without it is valid.</li>
     *   <li>anything else ends the final before it.</li>
     * </ul>
     */
    String handleConsonantCase(String text, int i, String initial) {
        int remainder = text.length() - i - 1;
        char c = text.charAt(i);
        if (i > 0 && c == 'r' && text.charAt(i - 1) == 'e') {
            if (remainder == 0 || !isVowel(text.charAt(i + 1))) {
                return text.substring(0, i + 1);
            }
        }
        if (c == 'n') {
            boolean nextIsG = remainder > 0 && text.charAt(i + 1) == 'g';
            if (nextIsG) {
                boolean takeNg = remainder == 1
                        || !isVowel(text.charAt(i + 2))
                        || !table.isValid(initial, text.substring(0, i + 1));
                return takeNg ? text.substring(0, i + 2) : text.substring(0, i + 1);
            }
            boolean keepN = remainder == 0
                    || !isVowel(text.charAt(i + 1))
                    || !table.isValid(initial, text.substring(0, i));
            return keepN ? text.substring(0, i + 1) : text.substring(0, i);
        }
        return text.substring(0, i);
    }

    /**
     * An apostrophe is needed where the next syllable starts with a vowel and the previous one
     * ends in a vowel, {@code n}, {@code ng} or {@code er}.
     */
    @Override
    public String joinSeparator(String prev, String curr) {
        if (prev.isEmpty() || curr.isEmpty() || !isVowel(curr.charAt(0))) return "";
        char last = prev.charAt(prev.length() - 1);
        if (isVowel(last) || last == 'n' || prev.endsWith("ng") || prev.endsWith("er")) {
            return String.valueOf(RomanizationChars.APOSTROPHE);
        }
        return "";
    }
}
