package romantools;

import java.util.*;

/**
 * Character classes shared by every romanization method: vowels, apostrophe and dash variants,
 * the letters that may appear inside a romanized word, and the closed set of contraction suffixes.
 */
public final class RomanizationChars {
    private RomanizationChars() {
    }

    /**
     * Canonical apostrophe used by the data tables.
     */
    public static final char APOSTROPHE = '\'';

    /**
     * Canonical dash used between Wade-Giles syllables.
     */
    public static final char DASH = '-';

    /**
     * Letters accepted inside a word (besides ASCII a-z / A-Z).
     */
    static final String EXTRA_LETTERS = "üÜêÊŭŬ";

    /**
     * Apostrophe variants found in real-world text.
     */
    static final String APOSTROPHES = "'’‘ʼʻ`";

    /**
     * Dash variants found in real-world text.
     */
    static final String DASHES = "-–—";

    private static final boolean[] VOWEL_TABLE = new boolean[Character.MAX_VALUE + 1];
    private static final boolean[] APOSTROPHE_TABLE = new boolean[Character.MAX_VALUE + 1];
    private static final boolean[] DASH_TABLE = new boolean[Character.MAX_VALUE + 1];
    private static final boolean[] LETTER_TABLE = new boolean[Character.MAX_VALUE + 1];

    static {
        for (char c : "aeiouüvêŭ".toCharArray()) {
            VOWEL_TABLE[c] = true;
        }
        for (char c : APOSTROPHES.toCharArray()) {
            APOSTROPHE_TABLE[c] = true;
        }
        for (char c : DASHES.toCharArray()) {
            DASH_TABLE[c] = true;
        }
        for (char c = 'a'; c <= 'z'; c++) {
            LETTER_TABLE[c] = true;
            LETTER_TABLE[Character.toUpperCase(c)] = true;
        }
        for (char c : EXTRA_LETTERS.toCharArray()) {
            LETTER_TABLE[c] = true;
        }
    }

    /**
     * Contraction suffixes that may follow an apostrophe at the end of a word
     * ({@code Li's}, {@code he'd}, {@code we'll}).
     */
    public static final Set<String> CONTRACTIONS =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList("s", "d", "ll")));

    /**
     * Returns {@code true} for lower-case vowels, including {@code ü}, {@code v}, {@code ê} and {@code ŭ}.
     *
     * @param ch the character to test (expected lower-case)
     * @return whether the character is a vowel
     */
    public static boolean isVowel(char ch) {
        return VOWEL_TABLE[ch];
    }

    public static boolean isApostrophe(char ch) {
        return APOSTROPHE_TABLE[ch];
    }

    public static boolean isDash(char ch) {
        return DASH_TABLE[ch];
    }

    /**
     * Apostrophe or dash.
     */
    public static boolean isSymbol(char ch) {
        return APOSTROPHE_TABLE[ch] || DASH_TABLE[ch];
    }

    public static boolean isLetter(char ch) {
        return LETTER_TABLE[ch];
    }

    /**
     * Returns {@code true} when {@code text} starts with a vowel.
     */
    static boolean startsWithVowel(String text) {
        return !text.isEmpty() && isVowel(text.charAt(0));
    }

    /**
     * Replaces every apostrophe variant with {@link #APOSTROPHE}. The result always has the same
     * length as the input, so indexes computed on it are valid on the original text.
     *
     * @param text the text to fold
     * @return the folded text, or {@code text} itself when it contains no variant
     */
    public static String foldApostrophes(String text) {
        char[] chars = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != APOSTROPHE && APOSTROPHE_TABLE[c]) {
                if (chars == null) chars = text.toCharArray();
                chars[i] = APOSTROPHE;
            }
        }
        return chars == null ? text : new String(chars);
    }

    /**
     * Index of the first apostrophe variant in {@code text}, or {@code -1}.
     */
    static int indexOfApostrophe(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (APOSTROPHE_TABLE[text.charAt(i)]) return i;
        }
        return -1;
    }

    /**
     * Strips leading apostrophe variants ({@code 's} → {@code s}).
     */
    static String stripLeadingApostrophes(String text) {
        int i = 0;
        while (i < text.length() && APOSTROPHE_TABLE[text.charAt(i)]) i++;
        return text.substring(i);
    }
}
