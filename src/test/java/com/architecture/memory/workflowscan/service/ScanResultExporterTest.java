package com.architecture.memory.workflowscan.service;

import com.architecture.memory.workflowscan.model.CodeLocation;
import com.architecture.memory.workflowscan.model.ScanResult;
import com.architecture.memory.workflowscan.model.ScanStatus;
import com.architecture.memory.workflowscan.model.SchemaSource;
import com.architecture.memory.workflowscan.model.TableSchema;
import com.architecture.memory.workflowscan.model.WorkflowEdge;
import com.architecture.memory.workflowscan.model.WorkflowGraph;
import com.architecture.memory.workflowscan.model.WorkflowNode;
import com.architecture.memory.workflowscan.model.WorkflowType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ScanResultExporterTest {

    @TempDir
    Path outputDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void export_writesSnakeCaseResultsFile() throws IOException {
        WorkflowGraph graph = new WorkflowGraph();
        graph.addNode(WorkflowNode.builder()
                .id("Repo.cs:db_write:4")
                .type(WorkflowType.DATABASE_WRITE)
                .name("DB Write: orders")
                .location(CodeLocation.of("Repo.cs", 4))
                .tableName("orders")
                .build());
        graph.addNode(WorkflowNode.builder()
                .id("Repo.cs:api_call:2")
                .type(WorkflowType.API_CALL)
                .name("HTTP POST")
                .location(CodeLocation.of("Repo.cs", 2))
                .endpoint("/api/orders")
                .method("POST")
                .build());
        graph.addEdge(WorkflowEdge.of("Repo.cs:api_call:2", "Repo.cs:db_write:4", "Data Ingestion"));
        ScanResult result = new ScanResult("/repos/shop", graph);
        result.setFilesScanned(1);
        result.setFilesDiscovered(3);
        result.setStatus(ScanStatus.COMPLETED);
        result.getSchemasDiscovered().register(TableSchema.builder()
                .entityName("Order").tableName("orders").source(SchemaSource.DB_SET).build());
        result.getWarnings().add("Schema limit reached");

        Path written = new ScanResultExporter(objectMapper, outputDir).export("scan-1", result);

        assertThat(written).isEqualTo(outputDir.resolve("scan-1").resolve("results.json"));
        JsonNode json = objectMapper.readTree(written.toFile());
        assertThat(json.path("scan_id").asText()).isEqualTo("scan-1");
        assertThat(json.path("repository_path").asText()).isEqualTo("/repos/shop");
        assertThat(json.path("status").asText()).isEqualTo("completed");
        assertThat(json.path("files_scanned").asInt()).isEqualTo(1);
        assertThat(json.path("files_discovered").asInt()).isEqualTo(3);
        assertThat(json.path("nodes")).hasSize(2);
        JsonNode write = json.path("nodes").get(0);
        assertThat(write.path("type").asText()).isEqualTo("database_write");
        assertThat(write.path("table_name").asText()).isEqualTo("orders");
        assertThat(write.path("location").path("line_number").asInt()).isEqualTo(4);
        assertThat(json.path("edges").get(0).path("label").asText()).isEqualTo("Data Ingestion");
        assertThat(json.path("schemas").get(0).path("entity_name").asText()).isEqualTo("Order");
        assertThat(json.path("warnings").get(0).asText()).isEqualTo("Schema limit reached");
        assertThat(json.has("scan_time_seconds")).isTrue();
    }

    @Test
    void export_leavesCallersMapperUntouched() throws IOException {
        new ScanResultExporter(objectMapper, outputDir).export("scan-2", new ScanResult("/r", new WorkflowGraph()));

        assertThat(objectMapper.getPropertyNamingStrategy()).isNull();
    }
}
