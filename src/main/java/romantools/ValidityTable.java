package romantools;

import java.util.*;

/**
 * Immutable matrix of permitted (initial, final) combinations for one romanization method.
 *
 * <p>Row labels are the initials, including the {@link #NO_INITIAL} sentinel for vowel-initial
 * syllables; column labels are the finals. Lookups fold apostrophe variants to {@code '}, and a
 * label absent from either list is simply invalid.</p>
 */
public final class ValidityTable {
    /**
     * Row label used for syllables that have no initial.
     */
    public static final String NO_INITIAL = "ø";

    private final List<String> initials;
    private final List<String> finals;
    private final Map<String, Integer> initialIndex;
    private final Map<String, Integer> finalIndex;
    private final boolean[][] matrix;
    private final List<String> initialsLongestFirst;
    private final int maxInitialLength;
    private final int maxFinalLength;

    /**
     * @param initials row labels, in table order
     * @param finals   column labels, in table order
     * @param matrix   {@code matrix[i][f]} is {@code true} when initial {@code i} combines with final {@code f}
     * @throws IllegalArgumentException if the matrix shape does not match the labels
     */
    public ValidityTable(List<String> initials, List<String> finals, boolean[][] matrix) {
        if (matrix.length != initials.size()) {
            throw new IllegalArgumentException("Expected " + initials.size() + " rows, got " + matrix.length);
        }
        this.initials = Collections.unmodifiableList(new ArrayList<>(initials));
        this.finals = Collections.unmodifiableList(new ArrayList<>(finals));
        this.matrix = new boolean[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            if (matrix[i].length != finals.size()) {
                throw new IllegalArgumentException("Row '" + initials.get(i) + "' has " + matrix[i].length
                        + " cells, expected " + finals.size());
            }
            this.matrix[i] = matrix[i].clone();
        }
        this.initialIndex = indexOf(this.initials);
        this.finalIndex = indexOf(this.finals);

        List<String> sorted = new ArrayList<>();
        for (String s : this.initials) {
            if (!NO_INITIAL.equals(s)) sorted.add(s);
        }
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        this.initialsLongestFirst = Collections.unmodifiableList(sorted);
        this.maxInitialLength = sorted.isEmpty() ? 0 : sorted.get(0).length();
        int longest = 0;
        for (String f : this.finals) longest = Math.max(longest, f.length());
        this.maxFinalLength = longest;
    }

    private static Map<String, Integer> indexOf(List<String> labels) {
        Map<String, Integer> m = new HashMap<>(labels.size() * 2);
        for (int i = 0; i < labels.size(); i++) {
            m.putIfAbsent(labels.get(i), i);
        }
        return m;
    }

    /**
     * Returns whether {@code initial + fin} is a permitted syllable. An empty initial is looked up
     * as {@link #NO_INITIAL}.
     *
     * @param initial the initial, may be empty
     * @param fin     the final
     * @return {@code true} if the pair is marked valid
     */
    public boolean isValid(String initial, String fin) {
        Integer row = initialIndex.get(rowKey(initial));
        Integer col = finalIndex.get(fin);
        return row != null && col != null && matrix[row][col];
    }

    public boolean hasInitial(String initial) {
        return initialIndex.containsKey(rowKey(initial));
    }

    /**
     * Returns {@code true} if some final beginning with {@code prefix} forms a valid pair with
     * {@code initial}.
     */
    public boolean hasValidFinalStartingWith(String initial, String prefix) {
        Integer row = initialIndex.get(rowKey(initial));
        if (row == null) return false;
        for (int f = 0; f < finals.size(); f++) {
            if (matrix[row][f] && finals.get(f).startsWith(prefix)) return true;
        }
        return false;
    }

    private static String rowKey(String initial) {
        return initial.isEmpty() ? NO_INITIAL : RomanizationChars.foldApostrophes(initial);
    }

    /**
     * Row labels in table order, including the sentinel.
     */
    public List<String> initials() {
        return initials;
    }

    public List<String> finals() {
        return finals;
    }

    /**
     * Real initials (sentinel excluded), longest first.
     */
    public List<String> initialsLongestFirst() {
        return initialsLongestFirst;
    }

    /**
     * Row {@code i} as a bit string ({@code "0110..."}), the compact form used by the JSON bundle.
     */
    String rowBits(int i) {
        StringBuilder sb = new StringBuilder(finals.size());
        for (boolean b : matrix[i]) sb.append(b ? '1' : '0');
        return sb.toString();
    }

    /**
     * Length of the longest real initial; 0 when the table has none.
     */
    public int maxInitialLength() {
        return maxInitialLength;
    }

    /**
     * Length of the longest final. No longer candidate can validate.
     */
    public int maxFinalLength() {
        return maxFinalLength;
    }

    /**
     * Number of valid pairs.
     */
    public int validCount() {
        int n = 0;
        for (boolean[] row : matrix) {
            for (boolean b : row) if (b) n++;
        }
        return n;
    }

    @Override
    public String toString() {
        return "<ValidityTable " + initials.size() + " initials x " + finals.size() + " finals, "
                + validCount() + " valid>";
    }
}
