package com.dotparser.maven.report;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportConfigLoaderTest {

    private Path testBaseDir;

    @BeforeEach
    void setUp() throws IOException {
        testBaseDir = Path.of("target/test-output", getClass().getSimpleName(),
                String.valueOf(System.nanoTime()));
        Files.createDirectories(testBaseDir);
    }

    @Test
    void loadDefault_readsBundledConfiguration() throws IOException {
        ReportConfig config = ReportConfigLoader.loadDefault();
        assertThat(config.getTemplate()).isEqualTo("summary.md.mustache");
        assertThat(config.getExtension()).isEqualTo("md");
        assertThat(config.getNodeOrder()).isEqualTo(ReportConfig.NodeOrder.SOURCE);
        assertThat(config.isShowAttributes()).isTrue();
        assertThat(config.getMaxEdges()).isNull();
    }

    @Test
    void load_readsAllKeys() throws IOException {
        Path file = testBaseDir.resolve("report.yml");
        Files.writeString(file, "template: custom.txt.mustache\n"
                + "extension: txt\n"
                + "nodeOrder: Name\n"
                + "showAttributes: false\n"
                + "maxEdges: 10\n");

        ReportConfig config = ReportConfigLoader.load(file);

        assertThat(config.getTemplate()).isEqualTo("custom.txt.mustache");
        assertThat(config.getExtension()).isEqualTo("txt");
        assertThat(config.getNodeOrder()).isEqualTo(ReportConfig.NodeOrder.NAME);
        assertThat(config.isShowAttributes()).isFalse();
        assertThat(config.getMaxEdges()).isEqualTo(10);
    }

    @Test
    void load_missingKeysKeepDefaults() throws IOException {
        Path file = testBaseDir.resolve("partial.yml");
        Files.writeString(file, "extension: markdown\n");

        ReportConfig config = ReportConfigLoader.load(file);

        assertThat(config.getExtension()).isEqualTo("markdown");
        assertThat(config.getTemplate()).isEqualTo("summary.md.mustache");
    }

    @Test
    void load_rejectsUnknownNodeOrder() throws IOException {
        Path file = testBaseDir.resolve("bad-order.yml");
        Files.writeString(file, "nodeOrder: random\n");

        assertThatThrownBy(() -> ReportConfigLoader.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("nodeOrder")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void load_rejectsNonMappingDocument() throws IOException {
        Path file = testBaseDir.resolve("list.yml");
        Files.writeString(file, "- a\n- b\n");

        assertThatThrownBy(() -> ReportConfigLoader.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("YAML mapping");
    }

    @Test
    void load_rejectsMalformedYaml() throws IOException {
        Path file = testBaseDir.resolve("broken.yml");
        Files.writeString(file, "template: [unclosed\n");

        assertThatThrownBy(() -> ReportConfigLoader.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void loadFromResource_missingResource() {
        assertThatThrownBy(() -> ReportConfigLoader.loadFromResource("/no-such-config.yml"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Resource not found");
    }
}
