package romantools;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WadeGilesStrategyTest {
    private final WadeGilesStrategy strategy = new WadeGilesStrategy(TestData.table(RomanizationMethod.WADE_GILES));

    @Test
    void shouldKeepApostropheInInitial() {
        List<String> errors = new ArrayList<>();
        assertThat(strategy.findInitial("ch'ang", errors)).isEqualTo("ch'");
        assertThat(strategy.findInitial("p’ing", errors)).isEqualTo("p’");
        assertThat(strategy.findInitial("hsien", errors)).isEqualTo("hs");
        assertThat(errors).isEmpty();
    }

    @Test
    void shouldEndFinalBeforeAspiratedInitial() {
        assertThat(strategy.findFinal("inp'ing", "l", new ArrayList<>())).isEqualTo("in");
        assertThat(strategy.finalBeforeSeparator("ank'an", 3)).isEqualTo("an");
    }

    @Test
    void shouldPickLongestFinalLeavingAParsableRemainder() {
        assertThat(strategy.findFinal("ungkuo", "ch", new ArrayList<>())).isEqualTo("ung");
        assertThat(strategy.findFinal("enmin", "j", new ArrayList<>())).isEqualTo("en");
        assertThat(strategy.findFinal("ih", "sh", new ArrayList<>())).isEqualTo("ih");
    }

    @Test
    void shouldSplitVowelInitialWordsAtFirstCompleteSyllable() {
        assertThat(strategy.findFinal("anwei", ValidityTable.NO_INITIAL, new ArrayList<>())).isEqualTo("an");
        assertThat(strategy.firstCompleteSyllable("erh")).isEqualTo("erh");
    }

    @Test
    void shouldReturnTextWhenNoDecompositionExists() {
        assertThat(strategy.firstCompleteSyllable("aaaa")).isEqualTo("aaaa");
        assertThat(strategy.longestFinal("xq", "ch")).isEqualTo("xq");

        Syllable whole = new SyllableEngine(strategy).next("aaaa");
        assertThat(whole.fullSyllable()).isEqualTo("aaaa");
        assertThat(whole.isValid()).isFalse();
    }

    @Test
    void shouldLimitSearchToTableLengths() {
        String tail = "chang".repeat(400);
        assertThat(strategy.longestFinal("ang" + tail, "ch")).isEqualTo("ang");
        assertThat(strategy.firstCompleteSyllable("an" + tail)).isEqualTo("an");
    }

    @Test
    void shouldRecognizeCompleteSyllables() {
        assertThat(strategy.isCompleteSyllable("kuo")).isTrue();
        assertThat(strategy.isCompleteSyllable("erh")).isTrue();
        assertThat(strategy.isCompleteSyllable("xa")).isFalse();
    }

    @Test
    void shouldAlwaysJoinWithDash() {
        assertThat(strategy.joinSeparator("chung", "kuo")).isEqualTo("-");
        assertThat(strategy.joinSeparator("hsi", "an")).isEqualTo("-");
    }

    @Test
    void shouldKeepApostrophesInsideFineSplitRuns() {
        TextChunker chunker = new TextChunker(new SyllableEngine(strategy), false, null);

        assertThat(chunker.split("ch'ang-an")).containsExactly("ch'ang", "-an");
        assertThat(chunker.split("linp’ing")).containsExactly("linp’ing");
    }

    @Test
    void shouldNotStripLeadingApostrophe() {
        assertThat(strategy.stripsLeadingApostrophe()).isFalse();
        assertThat(strategy.method()).isEqualTo(RomanizationMethod.WADE_GILES);
    }
}
