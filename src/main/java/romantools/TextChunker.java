package romantools;

import java.text.Normalizer;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static romantools.RomanizationStrategy.APOSTROPHE_CLASS;
import static romantools.RomanizationStrategy.DASH_CLASS;
import static romantools.RomanizationStrategy.LETTERS;

/**
 * Splits free text into {@link Chunk}s in two passes.
 *
 * <ol>
 *   <li>Coarse: letter runs, which may contain single apostrophes or dashes between letters, are
 *       separated from everything else. Non-letter spans become literals when errors are skipped
 *       and are dropped otherwise. Chunk text is always the raw input; only the copy of a letter
 *       run handed to the engine is NFC-normalized, together with the combining marks it carries.</li>
 *   <li>Fine: each letter run is split with the method's
 *       {@link RomanizationStrategy#fineSplitPattern()} and every sub-run is parsed by the engine.
 *       All syllables of one letter run form one word.</li>
 * </ol>
 */
public final class TextChunker {
    private static final String LETTER_RUN = "[" + LETTERS + "][" + LETTERS + "\\p{M}]*";
    private static final String RUN = LETTER_RUN + "(?:[" + APOSTROPHE_CLASS + DASH_CLASS + "]" + LETTER_RUN + ")*";
    private static final Pattern STRICT = Pattern.compile(RUN);
    private static final Pattern LENIENT = Pattern.compile(RUN + "|[^" + LETTERS + "]+");

    private final SyllableEngine engine;
    private final boolean keepLiterals;
    private final CrumbObserver observer;

    /**
     * @param engine       parses the letter runs
     * @param keepLiterals keep non-letter spans as {@link Chunk.Literal}s
     * @param observer     receives a {@code nonText} event per literal
     */
    public TextChunker(SyllableEngine engine, boolean keepLiterals, CrumbObserver observer) {
        this.engine = Objects.requireNonNull(engine);
        this.keepLiterals = keepLiterals;
        this.observer = observer == null ? CrumbObserver.NOOP : observer;
    }

    public List<Chunk> chunk(String input) {
        List<Chunk> chunks = new ArrayList<>();
        if (input == null || input.isEmpty()) return chunks;

        Matcher m = (keepLiterals ? LENIENT : STRICT).matcher(input);
        while (m.find()) {
            String span = m.group();
            if (RomanizationChars.isLetter(span.charAt(0))) {
                chunks.add(new Chunk.Word(span, parseRun(Normalizer.normalize(span, Normalizer.Form.NFC))));
            } else {
                observer.nonText(span);
                chunks.add(new Chunk.Literal(span));
            }
        }
        return chunks;
    }

    /**
     * Sub-runs of a letter run, as cut by the method's fine split.
     */
    List<String> split(String run) {
        List<String> parts = new ArrayList<>();
        Matcher m = engine.strategy().fineSplitPattern().matcher(run);
        while (m.find()) {
            parts.add(m.group());
        }
        if (parts.isEmpty()) parts.add(run);
        return parts;
    }

    private List<Syllable> parseRun(String run) {
        List<Syllable> syllables = new ArrayList<>();
        for (String part : split(run)) {
            syllables.addAll(engine.parse(part));
        }
        return syllables;
    }
}
