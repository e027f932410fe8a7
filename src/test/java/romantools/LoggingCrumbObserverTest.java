package romantools;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class LoggingCrumbObserverTest {
    private final Logger logger = Logger.getLogger("romantools.crumbs.test");
    private final List<LogRecord> records = new ArrayList<>();
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void setUp() {
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);
        logger.addHandler(handler);
    }

    @AfterEach
    void tearDown() {
        logger.removeHandler(handler);
    }

    private List<String> messages() {
        List<String> out = new ArrayList<>();
        for (LogRecord r : records) out.add(r.getMessage());
        return out;
    }

    @Test
    void shouldPrefixCrumbsByLevel() {
        LoggingCrumbObserver observer = new LoggingCrumbObserver(logger);
        observer.stage("Segmentation", "Processing text");
        observer.initialFound("zhong", "zh");
        observer.wordAssembled("beijing", "Pei-ching");

        assertThat(messages()).containsExactly(
                "# Segmentation: Processing text",
                "## initial found: zh",
                "## Word: \"beijing\" -> \"Pei-ching\"");
    }

    @Test
    void shouldWarnOnInvalidSyllables() {
        RoManTools tools = new RoManTools(TestData.DATA, RoManConfig.defaults().withCrumbs(true),
                new LoggingCrumbObserver(logger));
        tools.validate("xyz", RomanizationMethod.PINYIN);

        assertThat(messages()).contains("# Validation: Processing text", "### Syllable: \"xyz\" valid: false");
        assertThat(records).anyMatch(r -> r.getLevel() == Level.WARNING);
    }
}
