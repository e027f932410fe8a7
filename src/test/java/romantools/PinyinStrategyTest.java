package romantools;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PinyinStrategyTest {
    private final PinyinStrategy strategy = new PinyinStrategy(TestData.table(RomanizationMethod.PINYIN));

    @Test
    void shouldFindInitials() {
        List<String> errors = new ArrayList<>();
        assertThat(strategy.findInitial("zhongguo", errors)).isEqualTo("zh");
        assertThat(strategy.findInitial("an", errors)).isEqualTo(ValidityTable.NO_INITIAL);
        assertThat(strategy.findInitial("xyz", errors)).isEqualTo("xyz");
        assertThat(errors).isEmpty();
    }

    @Test
    void shouldReportUnknownInitial() {
        List<String> errors = new ArrayList<>();
        assertThat(strategy.findInitial("bla", errors)).isEqualTo("bl");
        assertThat(errors).containsExactly("invalid initial: 'bl'");
    }

    @Test
    void shouldStopInitialAtApostrophe() {
        assertThat(strategy.findInitial("x'an", new ArrayList<>())).isEqualTo("x");
    }

    @Test
    void shouldTakeNgUnlessItOpensTheNextSyllable() {
        List<String> errors = new ArrayList<>();
        assertThat(strategy.findFinal("ongguo", "zh", errors)).isEqualTo("ong");
        assertThat(strategy.findFinal("angan", "ch", errors)).isEqualTo("an");
        assertThat(strategy.findFinal("ing", "m", errors)).isEqualTo("ing");
    }

    @Test
    void shouldGiveNToFollowingVowelWhenShorterFinalIsValid() {
        assertThat(strategy.findFinal("ian", "t", new ArrayList<>())).isEqualTo("ian");
        assertThat(strategy.findFinal("anan", "t", new ArrayList<>())).isEqualTo("a");
    }

    @Test
    void shouldEndErAfterR() {
        assertThat(strategy.findFinal("er", ValidityTable.NO_INITIAL, new ArrayList<>())).isEqualTo("er");
    }

    @Test
    void shouldStopBeforeConsonant() {
        assertThat(strategy.findFinal("aoming", "h", new ArrayList<>())).isEqualTo("ao");
        assertThat(strategy.findFinal("uo", "g", new ArrayList<>())).isEqualTo("uo");
    }

    @Test
    void shouldInsertApostropheBeforeVowelInitialSyllable() {
        assertThat(strategy.joinSeparator("chang", "an")).isEqualTo("'");
        assertThat(strategy.joinSeparator("xi", "an")).isEqualTo("'");
        assertThat(strategy.joinSeparator("nü", "er")).isEqualTo("'");
        assertThat(strategy.joinSeparator("zhong", "guo")).isEmpty();
        assertThat(strategy.joinSeparator("", "an")).isEmpty();
    }

    @Test
    void shouldSplitRunsAtApostrophesAndDashes() {
        SyllableEngine engine = new SyllableEngine(strategy);
        TextChunker chunker = new TextChunker(engine, false, null);

        assertThat(chunker.split("ti'an")).containsExactly("ti", "'an");
        assertThat(chunker.split("Zhang-San")).containsExactly("Zhang", "-San");
        assertThat(chunker.split("tianqi")).containsExactly("tianqi");
    }

    @Test
    void shouldDescribeItself() {
        assertThat(strategy.method()).isEqualTo(RomanizationMethod.PINYIN);
        assertThat(strategy.stripsLeadingApostrophe()).isTrue();
        assertThat(strategy).hasToString("PinyinStrategy[py]");
    }
}
