package romantoolscli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    private static String run(String... args) {
        StringWriter out = new StringWriter();
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out));
        int exit = cmd.execute(args);
        assertThat(exit).isZero();
        return out.toString().trim();
    }

    @Test
    void shouldListMethods() {
        assertThat(run("--list-methods"))
                .contains("Supported romanization methods:")
                .contains("pinyin or py: Pinyin")
                .contains("wade-giles or wg: Wade-Giles");
    }

    @Test
    void shouldSegmentAsJson() {
        assertThat(run("segment", "-m", "py", "Zhongguo", "ti'an"))
                .isEqualTo("[[\"zhong\",\"guo\"],[\"ti\",\"an\"]]");
    }

    @Test
    void shouldKeepLiteralsWithErrorSkip() {
        assertThat(run("segment", "-S", "-m", "py", "Hello, Zhongguo!"))
                .isEqualTo("[[\"he\",\"llo\"],\", \",[\"zhong\",\"guo\"],\"!\"]");
    }

    @Test
    void shouldValidate() {
        assertThat(run("validate", "-m", "wg", "Chung-kuo")).isEqualTo("true");
        assertThat(run("validate", "-m", "py", "-w", "xian"))
                .isEqualTo("[{\"word\":\"xian\",\"syllables\":[\"xian\"],\"valid\":[true]}]");
    }

    @Test
    void shouldConvert() {
        assertThat(run("convert", "-f", "py", "-t", "wg", "ni hao chang'an yuan"))
                .isEqualTo("ni hao ch'ang-an yüan");
        assertThat(run("convert", "--from", "wade-giles", "--to", "pinyin", "Chung-kuo")).isEqualTo("Zhongguo");
    }

    @Test
    void shouldCherryPick() {
        assertThat(run("cherry-pick", "-f", "py", "-t", "wg", "Welcome to Zhongguo"))
                .isEqualTo("Welcome to Chung-kuo");
    }

    @Test
    void shouldCountSyllables() {
        assertThat(run("syllable-count", "-m", "py", "Zhongguo hello")).isEqualTo("[2,0]");
    }

    @Test
    void shouldDetectMethod() {
        assertThat(run("detect-method", "Zhongguo")).isEqualTo("[\"py\"]");
        assertThat(run("detect-method", "-w", "Beijing Chung-kuo"))
                .isEqualTo("[{\"word\":\"Beijing\",\"methods\":[\"py\"]},{\"word\":\"Chung-kuo\",\"methods\":[\"wg\"]}]");
    }

    @Test
    void shouldReadInputFileAndWriteOutputFile(@TempDir Path dir) throws IOException {
        Path in = dir.resolve("in.txt");
        Path out = dir.resolve("out.txt");
        Files.write(in, "Beijing".getBytes(StandardCharsets.UTF_8));

        run("convert", "-f", "py", "-t", "wg", "-i", in.toString(), "-o", out.toString());

        assertThat(new String(Files.readAllBytes(out), StandardCharsets.UTF_8)).isEqualTo("Pei-ching");
    }

    @Test
    void shouldGenerateJsonBundle(@TempDir Path dir) {
        Path json = dir.resolve("bundle.json");

        assertThat(run("dictgen", "-o", json.toString())).contains("Romanization data saved in JSON format at:");
        assertThat(json).exists().isNotEmptyFile();
    }
}
