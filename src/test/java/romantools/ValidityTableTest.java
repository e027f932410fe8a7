package romantools;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidityTableTest {

    private static ValidityTable small() {
        return new ValidityTable(
                Arrays.asList("ø", "ch", "ch'"),
                Arrays.asList("a", "an", "ih"),
                new boolean[][]{
                        {true, true, false},
                        {true, false, true},
                        {true, true, true}
                });
    }

    @Test
    void shouldLookUpPairs() {
        ValidityTable t = small();
        assertThat(t.isValid("ch", "ih")).isTrue();
        assertThat(t.isValid("ch", "an")).isFalse();
    }

    @Test
    void shouldUseSentinelForEmptyInitial() {
        ValidityTable t = small();
        assertThat(t.isValid("", "an")).isTrue();
        assertThat(t.isValid(ValidityTable.NO_INITIAL, "an")).isTrue();
        assertThat(t.isValid("", "ih")).isFalse();
    }

    @Test
    void shouldFoldApostropheVariantsInInitials() {
        ValidityTable t = small();
        assertThat(t.isValid("ch’", "an")).isTrue();
        assertThat(t.hasInitial("chʻ")).isTrue();
    }

    @Test
    void shouldTreatUnknownLabelsAsInvalid() {
        ValidityTable t = small();
        assertThat(t.isValid("zz", "a")).isFalse();
        assertThat(t.isValid("ch", "zz")).isFalse();
        assertThat(t.hasValidFinalStartingWith("zz", "a")).isFalse();
    }

    @Test
    void shouldFindValidFinalsByPrefix() {
        ValidityTable t = small();
        assertThat(t.hasValidFinalStartingWith("ch'", "a")).isTrue();
        assertThat(t.hasValidFinalStartingWith("ch", "i")).isTrue();
        assertThat(t.hasValidFinalStartingWith("", "i")).isFalse();
    }

    @Test
    void shouldListInitialsLongestFirstWithoutSentinel() {
        assertThat(small().initialsLongestFirst()).containsExactly("ch'", "ch");
        assertThat(small().validCount()).isEqualTo(7);
    }

    @Test
    void shouldKnowLongestLabels() {
        assertThat(small().maxInitialLength()).isEqualTo(3);
        assertThat(small().maxFinalLength()).isEqualTo(2);
        assertThat(TestData.table(RomanizationMethod.WADE_GILES).maxFinalLength()).isEqualTo(4);
    }

    @Test
    void shouldRejectMisshapenMatrix() {
        assertThatThrownBy(() -> new ValidityTable(Arrays.asList("ø"), Arrays.asList("a", "e"),
                new boolean[][]{{true}}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldLoadBothMethodTables() {
        ValidityTable py = TestData.table(RomanizationMethod.PINYIN);
        ValidityTable wg = TestData.table(RomanizationMethod.WADE_GILES);

        assertThat(py.initials()).hasSize(24).startsWith("ø");
        assertThat(py.finals()).hasSize(36);
        assertThat(py.isValid("zh", "ong")).isTrue();
        assertThat(py.isValid("b", "ong")).isFalse();

        assertThat(wg.initials()).hasSize(25).contains("ch'", "hs", "tz'");
        assertThat(wg.finals()).hasSize(43);
        assertThat(wg.isValid("ch'", "ang")).isTrue();
        assertThat(wg.isValid("", "erh")).isTrue();
    }
}
