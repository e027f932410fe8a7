package romantools;

import java.util.*;

import static romantools.ValidityTable.NO_INITIAL;

/**
 * Carves a letter run into syllables: initial, then final, then the remainder is parsed again
 * until nothing is left.
 *
 * <p>Every step consumes at least one character, so a run of length {@code n} yields at most
 * {@code n} syllables. Parsed syllables are memoized per engine, keyed by the raw text of the step.</p>
 */
public class SyllableEngine {
    private final RomanizationStrategy strategy;
    private final BoundedCache<String, Syllable> cache;
    private final CrumbObserver observer;

    public SyllableEngine(RomanizationStrategy strategy) {
        this(strategy, new BoundedCache<>(), CrumbObserver.NOOP);
    }

    public SyllableEngine(RomanizationStrategy strategy, BoundedCache<String, Syllable> cache, CrumbObserver observer) {
        this.strategy = Objects.requireNonNull(strategy);
        this.cache = Objects.requireNonNull(cache);
        this.observer = observer == null ? CrumbObserver.NOOP : observer;
    }

    public RomanizationStrategy strategy() {
        return strategy;
    }

    public RomanizationMethod method() {
        return strategy.method();
    }

    /**
     * Parses a letter run (letters with at most one leading apostrophe or dash, plus the
     * apostrophes the method keeps inside initials) to completion.
     *
     * @param segment the run, original case
     * @return its syllables, in order; empty only for empty input
     */
    public List<Syllable> parse(String segment) {
        List<Syllable> out = new ArrayList<>();
        String rest = segment;
        while (!rest.isEmpty()) {
            Syllable syllable = next(rest);
            out.add(syllable);
            rest = rest.substring(syllable.consumedText().length());
        }
        return out;
    }

    /**
     * Parses the first syllable of {@code raw}, serving it from the cache when possible.
     */
    public Syllable next(String raw) {
        Syllable cached = cache.get(raw);
        if (cached != null) {
            observer.syllableCached(raw);
            return cached;
        }
        return cache.getOrCompute(raw, this::build);
    }

    private Syllable build(String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);
        String symbol = "";
        boolean apostrophe = false;
        boolean dash = false;
        char first = lower.charAt(0);
        if (RomanizationChars.isApostrophe(first)) {
            apostrophe = true;
            if (strategy.stripsLeadingApostrophe()) symbol = String.valueOf(first);
        } else if (RomanizationChars.isDash(first)) {
            dash = true;
            symbol = String.valueOf(first);
        }
        int start = symbol.length();
        String text = lower.substring(start);

        List<String> errors = new ArrayList<>();
        String initial;
        String fin;
        if (text.isEmpty()) {
            initial = "";
            fin = "";
        } else {
            initial = strategy.findInitial(text, errors);
            observer.initialFound(text, initial);
            if (NO_INITIAL.equals(initial)) {
                initial = "";
                fin = strategy.findFinal(text, NO_INITIAL, errors);
            } else {
                fin = strategy.findFinal(text.substring(initial.length()), initial, errors);
            }
            if (initial.isEmpty() && fin.isEmpty()) {
                fin = text.substring(0, 1);
            }
            observer.finalFound(text, fin);
        }

        String full = initial + fin;
        String remainder = text.substring(full.length());
        boolean valid = !fin.isEmpty() && strategy.validateSyllable(initial, fin);
        if (valid) {
            errors.clear();
        } else {
            errors.add("\"" + full + "\" valid: false");
        }
        String original = raw.substring(start, start + full.length());
        Syllable syllable = new Syllable(text, initial, fin, remainder, valid, symbol, apostrophe, dash,
                original, errors);
        observer.syllableValidated(syllable);
        return syllable;
    }
}
