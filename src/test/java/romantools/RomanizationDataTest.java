package romantools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RomanizationDataTest {

    @Test
    void shouldLoadPlainTextSourcesFromClasspath() {
        RomanizationData data = TestData.DATA;

        assertThat(data.methods).containsOnlyKeys("py", "wg");
        assertThat(data.conversions).hasSize(472);
        assertThat(data.stopwords).contains("a", "he's", "she", "you'll").doesNotContain("#");
        assertThat(data.stopwordSet()).hasSize(data.stopwords.size());
    }

    @Test
    void shouldParseValidityCsv() throws IOException {
        String csv = ",a,an\nø,1,0\nch’,0,1\n";
        RomanizationData.MethodTable t = RomanizationData.parseValidityCsv(new BufferedReader(new StringReader(csv)));

        assertThat(t.finals).containsExactly("a", "an");
        assertThat(t.initials).containsExactly("ø", "ch'");
        assertThat(t.rows).containsExactly("10", "01");
        assertThat(t.toValidityTable().isValid("ch'", "an")).isTrue();
    }

    @Test
    void shouldRejectRaggedValidityRows() {
        String csv = ",a,an\nb,1\n";
        assertThatThrownBy(() -> RomanizationData.parseValidityCsv(new BufferedReader(new StringReader(csv))))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Line 2");
    }

    @Test
    void shouldParseConversionRowsWithMeta() throws IOException {
        String csv = "py,wg,meta\nzhong,chung,\nyo,,rare\n";
        List<RomanizationData.ConversionRow> rows =
                RomanizationData.parseConversionCsv(new BufferedReader(new StringReader(csv)));

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).spelling(RomanizationMethod.WADE_GILES)).isEqualTo("chung");
        assertThat(rows.get(0).rare()).isFalse();
        assertThat(rows.get(1).rare()).isTrue();
        assertThat(rows.get(1).spelling(RomanizationMethod.WADE_GILES)).isEmpty();
    }

    @Test
    void shouldSkipCommentsAndBlankStopwords() throws IOException {
        String text = "# header\n\nHe’s\nman\n";
        assertThat(RomanizationData.parseStopwords(new BufferedReader(new StringReader(text))))
                .containsExactly("he's", "man");
    }

    @Test
    void shouldRoundTripThroughJson(@TempDir Path dir) throws IOException {
        String out = dir.resolve("romanization_data.json").toString();
        TestData.DATA.serializeToJson(out);

        RomanizationData back = RomanizationData.fromJson(out);

        assertThat(back.methods.get("wg").initials).isEqualTo(TestData.DATA.methods.get("wg").initials);
        assertThat(back.methods.get("py").rows).isEqualTo(TestData.DATA.methods.get("py").rows);
        assertThat(back.conversions).hasSameSizeAs(TestData.DATA.conversions);
        assertThat(back.stopwords).isEqualTo(TestData.DATA.stopwords);
        assertThat(back.validityTable(RomanizationMethod.PINYIN).isValid("zh", "ong")).isTrue();
        assertThat(back.conversionTable(RomanizationMethod.PINYIN, RomanizationMethod.WADE_GILES).lookup("guo"))
                .isEqualTo("kuo");
    }

    @Test
    void shouldPreferFileSystemSources(@TempDir Path dir) throws IOException {
        write(dir, "pyDF.csv", ",a\nø,1\n");
        write(dir, "wgDF.csv", ",a\nø,1\n");
        write(dir, "conversion_mapping.csv", "py,wg,meta\na,a,\n");
        write(dir, "stopwords.txt", "ma\n");

        RomanizationData data = RomanizationData.fromDicts(dir.toString());

        assertThat(data.conversions).hasSize(1);
        assertThat(data.stopwords).containsExactly("ma");
        assertThat(data.validityTable(RomanizationMethod.WADE_GILES).validCount()).isEqualTo(1);
    }

    @Test
    void shouldFailOnMissingSources(@TempDir Path dir) {
        assertThatThrownBy(() -> RomanizationData.fromDicts(dir.resolve("nowhere").toString()))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("pyDF.csv");
    }

    @Test
    void shouldFailOnMissingMethodTable() {
        RomanizationData data = new RomanizationData();
        assertThatThrownBy(() -> data.validityTable(RomanizationMethod.WADE_GILES))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Wade-Giles");
    }

    private static void write(Path dir, String name, String content) throws IOException {
        Files.write(dir.resolve(name), Arrays.asList(content.split("\n")), StandardCharsets.UTF_8);
        assertThat(new File(dir.toFile(), name)).exists();
    }
}
