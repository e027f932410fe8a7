package romantools;

import java.util.*;

/**
 * One piece of chunked input: either a {@link Word} (a letter run parsed into syllables) or a
 * {@link Literal} (everything else, kept verbatim).
 */
public abstract class Chunk {
    private final String text;

    Chunk(String text) {
        this.text = text;
    }

    /**
     * The input text this chunk covers, verbatim.
     */
    public String text() {
        return text;
    }

    public abstract boolean isWord();

    /**
     * A letter run and its syllables.
     */
    public static final class Word extends Chunk {
        private final List<Syllable> syllables;

        public Word(String text, List<Syllable> syllables) {
            super(text);
            this.syllables = Collections.unmodifiableList(new ArrayList<>(syllables));
        }

        @Override
        public boolean isWord() {
            return true;
        }

        public List<Syllable> syllables() {
            return syllables;
        }

        public boolean allValid() {
            for (Syllable s : syllables) {
                if (!s.isValid()) return false;
            }
            return true;
        }

        /**
         * Full syllables in order.
         */
        public List<String> spellings() {
            List<String> out = new ArrayList<>(syllables.size());
            for (Syllable s : syllables) out.add(s.fullSyllable());
            return out;
        }

        @Override
        public String toString() {
            return "Word" + spellings();
        }
    }

    /**
     * Non-letter text.
     */
    public static final class Literal extends Chunk {
        public Literal(String text) {
            super(text);
        }

        @Override
        public boolean isWord() {
            return false;
        }

        @Override
        public String toString() {
            return "Literal[" + text() + "]";
        }
    }
}
