package com.architecture.memory.workflowscan.service;

import com.architecture.memory.workflowscan.model.ScanConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScanConfigLoaderTest {

    @TempDir
    Path repo;

    private final ScanConfigLoader loader = new ScanConfigLoader(Map.of("SCAN_WORKERS", "6")::get);

    private void writeConfig(String name, String yaml) throws IOException {
        Files.writeString(repo.resolve(name), yaml);
    }

    @Test
    void load_returnsBaseWhenRepositoryHasNoConfig() {
        ScanConfig base = ScanConfig.defaults();

        assertThat(loader.load(repo, base)).isSameAs(base);
    }

    @Test
    void load_overlaysScannerSection() throws IOException {
        writeConfig(".workflow-scanner.yml", String.join("\n",
                "scanner:",
                "  include_extensions: ['.cs', '.xaml']",
                "  exclude_dirs: [legacy]",
                "  analyze_workflows: false",
                "  detect:",
                "    file_operations: false",
                "    message_queues: 'false'",
                "  edge_inference:",
                "    max_line_distance: 5",
                "    data_flow_edges: false",
                ""));

        ScanConfig config = loader.load(repo, ScanConfig.defaults());

        assertThat(config.getIncludeExtensions()).containsExactly(".cs", ".xaml");
        assertThat(config.getExcludeDirs()).containsExactly("legacy");
        assertThat(config.getExcludePatterns()).isEqualTo(ScanConfig.DEFAULT_EXCLUDE_PATTERNS);
        assertThat(config.isAnalyzeWorkflows()).isFalse();
        assertThat(config.getDetect().isFileIo()).isFalse();
        assertThat(config.getDetect().isMessageQueues()).isFalse();
        assertThat(config.getDetect().isDatabase()).isTrue();
        assertThat(config.getEdgeInference().getMaxLineDistance()).isEqualTo(5);
        assertThat(config.getEdgeInference().isDataFlowEdges()).isFalse();
        assertThat(config.getEdgeInference().isProximityEdges()).isTrue();
    }

    @Test
    void load_acceptsYamlExtensionAndExpandsEnvironment() throws IOException {
        writeConfig(".workflow-scanner.yaml", String.join("\n",
                "scanner:",
                "  worker_threads: ${SCAN_WORKERS}",
                "  max_schemas: ${MAX_SCHEMAS:-250}",
                ""));

        ScanConfig config = loader.load(repo, ScanConfig.defaults());

        assertThat(config.getWorkerThreads()).isEqualTo(6);
        assertThat(config.getMaxSchemas()).isEqualTo(250);
    }

    @Test
    void load_clampsWorkerThreadsToOne() throws IOException {
        writeConfig(".workflow-scanner.yml", "scanner:\n  worker_threads: 0\n");

        assertThat(loader.load(repo, ScanConfig.defaults()).getWorkerThreads()).isEqualTo(1);
    }

    @Test
    void load_fallsBackToBaseOnMalformedYaml() throws IOException {
        writeConfig(".workflow-scanner.yml", "scanner:\n  include_extensions: [.cs\n  : :\n");
        ScanConfig base = ScanConfig.defaults();

        assertThat(loader.load(repo, base)).isSameAs(base);
    }

    @Test
    void load_fallsBackToBaseOnWrongValueType() throws IOException {
        writeConfig(".workflow-scanner.yml", "scanner:\n  worker_threads: many\n");
        ScanConfig base = ScanConfig.defaults();

        assertThat(loader.load(repo, base)).isSameAs(base);
    }

    @Test
    void load_ignoresDocumentWithoutScannerSection() throws IOException {
        writeConfig(".workflow-scanner.yml", "other:\n  key: value\n");
        ScanConfig base = ScanConfig.defaults();

        assertThat(loader.load(repo, base)).isSameAs(base);
    }

    @Test
    void expandEnvironment_replacesUnsetVariableWithEmptyText() {
        assertThat(loader.expandEnvironment("a=${UNSET_VAR} b=${UNSET_VAR:-x} c=${SCAN_WORKERS:-1}"))
                .isEqualTo("a= b=x c=6");
    }
}
