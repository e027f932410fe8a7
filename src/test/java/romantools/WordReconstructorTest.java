package romantools;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WordReconstructorTest {
    private final SyllableEngine py = TestData.engine(RomanizationMethod.PINYIN);
    private final SyllableEngine wg = TestData.engine(RomanizationMethod.WADE_GILES);

    private WordReconstructor toWadeGiles(boolean errorSkip, CrumbObserver observer) {
        return new WordReconstructor(
                TestData.converter(RomanizationMethod.PINYIN, RomanizationMethod.WADE_GILES),
                wg.strategy(), TestData.DATA.stopwordSet(), errorSkip, observer);
    }

    private Chunk.Word word(String text) {
        return (Chunk.Word) new TextChunker(py, false, null).chunk(text).get(0);
    }

    @Test
    void shouldJoinWithTargetSeparators() {
        WordReconstructor r = toWadeGiles(false, null);
        assertThat(r.reconstruct(word("Zhongguo"))).isEqualTo("Chung-kuo");
        assertThat(r.reconstruct(word("chang'an"))).isEqualTo("ch'ang-an");
    }

    @Test
    void shouldConvertStopwordsOnlyWhenStrict() {
        assertThat(toWadeGiles(false, null).reconstruct(word("he"))).isEqualTo("ho");
        assertThat(toWadeGiles(true, null).reconstruct(word("he"))).isEqualTo("he");
    }

    @Test
    void shouldKeepContractionSuffix() {
        WordReconstructor lenient = toWadeGiles(true, null);
        assertThat(lenient.isContraction(word("Li's").syllables())).isTrue();
        assertThat(lenient.reconstruct(word("Li's"))).isEqualTo("Li's");

        WordReconstructor strict = toWadeGiles(false, null);
        assertThat(strict.isContraction(word("Li's").syllables())).isFalse();
        assertThat(strict.reconstruct(word("Li's"))).isEqualTo("Li's(!)");
    }

    @Test
    void shouldPassInvalidWordsThroughWhenSkipping() {
        assertThat(toWadeGiles(true, null).reconstruct(word("Hello"))).isEqualTo("Hello");
        assertThat(toWadeGiles(true, null).reconstruct(word("xyz"))).isEqualTo("xyz");
    }

    @Test
    void shouldInsertPinyinApostropheWhenTargetingPinyin() {
        WordReconstructor r = new WordReconstructor(
                TestData.converter(RomanizationMethod.WADE_GILES, RomanizationMethod.PINYIN),
                py.strategy(), TestData.DATA.stopwordSet(), false, null);
        Chunk.Word hsian = (Chunk.Word) new TextChunker(wg, false, null).chunk("hsi-an").get(0);

        assertThat(r.reconstruct(hsian)).isEqualTo("xi'an");
    }

    @Test
    void shouldPreviewWithCanonicalSymbols() {
        assertThat(WordReconstructor.preview(word("Ti’an").syllables())).isEqualTo("ti'an");
        assertThat(WordReconstructor.preview(new ArrayList<>())).isEmpty();
    }

    @Test
    void shouldReportAssembledWords() {
        List<String> seen = new ArrayList<>();
        CrumbObserver observer = new CrumbObserver() {
            @Override
            public void wordAssembled(String preview, String output) {
                seen.add(preview + "=" + output);
            }
        };
        toWadeGiles(true, observer).reconstruct(word("Beijing"));

        assertThat(seen).containsExactly("beijing=Pei-ching");
    }
}
