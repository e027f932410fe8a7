package romantools;

import java.util.*;

/**
 * Rebuilds one parsed word in the target method.
 *
 * <p>A word is convertible when every syllable is valid, or when only a trailing contraction
 * ({@code Li's}) is not, and, while errors are skipped, when it is not a stopword. Convertible
 * words are joined with the target's separators; a trailing contraction keeps its apostrophe and
 * spelling. Other words are written back verbatim.</p>
 *
 * <p>With errors not skipped every syllable goes through the converter, so unknown syllables
 * surface with their markers, and stopwords are not consulted.</p>
 */
public class WordReconstructor {
    private final SyllableConverter converter;
    private final RomanizationStrategy target;
    private final Set<String> stopwords;
    private final boolean errorSkip;
    private final CrumbObserver observer;

    /**
     * @param converter syllable converter from the source to the target method
     * @param target    strategy of the target method, for its separators
     * @param stopwords lower-cased words never converted while errors are skipped
     * @param errorSkip pass invalid words through instead of converting them with markers
     * @param observer  receives a {@code wordAssembled} event per word
     */
    public WordReconstructor(SyllableConverter converter, RomanizationStrategy target, Set<String> stopwords,
                             boolean errorSkip, CrumbObserver observer) {
        this.converter = Objects.requireNonNull(converter);
        this.target = Objects.requireNonNull(target);
        this.stopwords = stopwords == null ? Collections.<String>emptySet() : stopwords;
        this.errorSkip = errorSkip;
        this.observer = observer == null ? CrumbObserver.NOOP : observer;
    }

    /**
     * Rebuilds {@code word}; a word passed through unconverted comes back as its raw text.
     */
    public String reconstruct(Chunk.Word word) {
        return reconstruct(word.syllables(), word.text());
    }

    public String reconstruct(List<Syllable> syllables) {
        StringBuilder sb = new StringBuilder();
        for (Syllable s : syllables) sb.append(s.consumedText());
        return reconstruct(syllables, sb.toString());
    }

    private String reconstruct(List<Syllable> syllables, String passthrough) {
        if (syllables.isEmpty()) return passthrough;
        boolean contraction = isContraction(syllables);
        boolean convertible = isConvertible(syllables, contraction);
        int last = syllables.size() - 1;

        String out;
        if (!errorSkip) {
            List<String> converted = new ArrayList<>(syllables.size());
            for (Syllable s : syllables) {
                converted.add(converter.convert(s));
            }
            out = convertible ? join(converted, false) : joinWithOriginalSymbols(converted, syllables);
        } else if (convertible) {
            List<String> converted = new ArrayList<>(syllables.size());
            for (int i = 0; i < syllables.size(); i++) {
                Syllable s = syllables.get(i);
                converted.add(contraction && i == last ? s.consumedText() : converter.convert(s));
            }
            out = join(converted, contraction);
        } else {
            out = passthrough;
        }
        observer.wordAssembled(preview(syllables), out);
        return out;
    }

    /**
     * Lower-cased word with canonical leading symbols, as matched against the stopwords.
     */
    static String preview(List<Syllable> syllables) {
        StringBuilder sb = new StringBuilder();
        for (Syllable s : syllables) {
            if (s.hasLeadingApostrophe()) {
                sb.append(RomanizationChars.APOSTROPHE);
            } else if (s.hasLeadingDash()) {
                sb.append(RomanizationChars.DASH);
            }
            sb.append(s.coreText());
        }
        return sb.toString();
    }

    /**
     * Every syllable but the last is valid and the last is an apostrophe-led contraction suffix.
     * Only recognized while errors are skipped.
     */
    boolean isContraction(List<Syllable> syllables) {
        if (!errorSkip || syllables.isEmpty()) return false;
        int last = syllables.size() - 1;
        for (int i = 0; i < last; i++) {
            if (!syllables.get(i).isValid()) return false;
        }
        Syllable tail = syllables.get(last);
        return tail.hasLeadingApostrophe() && RomanizationChars.CONTRACTIONS.contains(tail.coreText());
    }

    boolean isConvertible(List<Syllable> syllables, boolean contraction) {
        boolean valid = true;
        for (Syllable s : syllables) {
            if (!s.isValid()) {
                valid = false;
                break;
            }
        }
        if (!valid && !contraction) return false;
        return !errorSkip || !stopwords.contains(preview(syllables));
    }

    private String join(List<String> converted, boolean contraction) {
        StringBuilder sb = new StringBuilder(converted.get(0));
        int last = converted.size() - 1;
        for (int i = 1; i < converted.size(); i++) {
            String curr = converted.get(i);
            if (!(contraction && i == last)) {
                sb.append(target.joinSeparator(
                        converted.get(i - 1).toLowerCase(Locale.ROOT), curr.toLowerCase(Locale.ROOT)));
            }
            sb.append(curr);
        }
        return sb.toString();
    }

    private static String joinWithOriginalSymbols(List<String> converted, List<Syllable> syllables) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < converted.size(); i++) {
            sb.append(syllables.get(i).leadingSymbol()).append(converted.get(i));
        }
        return sb.toString();
    }
}
