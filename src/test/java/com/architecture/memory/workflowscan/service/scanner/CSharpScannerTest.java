package com.architecture.memory.workflowscan.service.scanner;

import com.architecture.memory.workflowscan.model.DetectionToggles;
import com.architecture.memory.workflowscan.model.SchemaRegistry;
import com.architecture.memory.workflowscan.model.SchemaSource;
import com.architecture.memory.workflowscan.model.TableSchema;
import com.architecture.memory.workflowscan.model.WorkflowGraph;
import com.architecture.memory.workflowscan.model.WorkflowNode;
import com.architecture.memory.workflowscan.model.WorkflowType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CSharpScannerTest {

    @TempDir
    Path repo;

    private final CSharpScanner scanner = new CSharpScanner();

    private Path write(String name, String content) throws Exception {
        Path file = repo.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static WorkflowNode node(WorkflowGraph graph, Path file, String category, int line) {
        return graph.getNode(file + ":" + category + ":" + line)
                .orElseThrow(() -> new AssertionError("no " + category + " node at line " + line));
    }

    @Test
    void scanFile_detectsEntityWriteAndHttpCall() throws Exception {
        Path file = write("OrderService.cs", String.join("\n",
                "public class OrderService {",
                "    public async Task Create(Order order) {",
                "        _context.Orders.Add(order);",
                "        var response = await client.PostAsync(\"/api/orders\", content);",
                "    }",
                "}"));

        WorkflowGraph graph = scanner.scanFile(file);

        assertThat(graph.nodeCount()).isEqualTo(2);
        WorkflowNode write = node(graph, file, "db_write", 3);
        assertThat(write.getType()).isEqualTo(WorkflowType.DATABASE_WRITE);
        assertThat(write.getTableName()).isEqualTo("Orders");
        assertThat(write.getName()).isEqualTo("DB Write: Orders");
        assertThat(write.getCodeSnippet()).contains("_context.Orders.Add(order);");

        WorkflowNode call = node(graph, file, "api", 4);
        assertThat(call.getType()).isEqualTo(WorkflowType.API_CALL);
        assertThat(call.getMethod()).isEqualTo("POST");
        assertThat(call.getEndpoint()).isEqualTo("/api/orders");
        assertThat(call.getName()).isEqualTo("API Call: POST");
    }

    @Test
    void scanFile_resolvesTableNamesThroughRegistry() throws Exception {
        SchemaRegistry registry = new SchemaRegistry();
        registry.register(TableSchema.builder()
                .entityName("Order").tableName("Orders").dbsetName("Orders").source(SchemaSource.DB_SET).build());
        registry.register(TableSchema.builder()
                .entityName("Order").tableName("orders").source(SchemaSource.TABLE_ATTRIBUTE).build());
        Path file = write("Repo.cs", String.join("\n",
                "var open = _context.Orders.Where(o => o.Open).ToList();",
                "var all = _db.Foo.ToList();"));

        WorkflowGraph graph = scanner.scanFile(file, registry);

        assertThat(node(graph, file, "db_read", 1).getTableName()).isEqualTo("orders");
        assertThat(node(graph, file, "db_read", 2).getTableName()).isEqualTo("Foo");
        assertThat(node(graph, file, "db_read", 2).getName()).isEqualTo("DB Query: Foo");
    }

    @Test
    void scanFile_doesNotTakeContextMethodsForEntities() throws Exception {
        Path file = write("Save.cs", String.join("\n",
                "var customer = _context.Customers;",
                "customer.Name = name;",
                "await _context.SaveChangesAsync();"));

        WorkflowGraph graph = scanner.scanFile(file);

        WorkflowNode save = node(graph, file, "db_write", 3);
        assertThat(save.getTableName()).isEqualTo("Customers");
    }

    @Test
    void scanFile_findsSqlTextNearCommand() throws Exception {
        Path file = write("Dao.cs", String.join("\n",
                "var sql = \"SELECT * FROM Users WHERE Id = @id\";",
                "using var cmd = new SqlCommand(sql, connection);",
                "var reader = cmd.ExecuteReader();"));

        WorkflowGraph graph = scanner.scanFile(file);

        WorkflowNode sql = node(graph, file, "sql", 2);
        assertThat(sql.getType()).isEqualTo(WorkflowType.DATABASE_READ);
        assertThat(sql.getQuery()).isEqualTo("\"SELECT * FROM Users WHERE Id = @id\"");
        assertThat(graph.getNode(file + ":sql:3")).isPresent();
    }

    @Test
    void scanFile_detectsMessagingWithPlatform() throws Exception {
        Path file = write("Bus.cs", String.join("\n",
                "await sender.SendMessageAsync(message);",
                "channel.BasicConsume(\"orders\", true, consumer);",
                "channel.BasicPublish(exchange, \"invoices\", null, body);"));

        WorkflowGraph graph = scanner.scanFile(file);

        WorkflowNode send = node(graph, file, "msg", 1);
        assertThat(send.getType()).isEqualTo(WorkflowType.MESSAGE_SEND);
        assertThat(send.getMetadata()).containsEntry("platform", CSharpScanner.SERVICE_BUS);
        WorkflowNode consume = node(graph, file, "msg", 2);
        assertThat(consume.getType()).isEqualTo(WorkflowType.MESSAGE_RECEIVE);
        assertThat(consume.getName()).isEqualTo("Message Consume");
        assertThat(consume.getQueueName()).isEqualTo("orders");
        WorkflowNode publish = node(graph, file, "msg", 3);
        assertThat(publish.getName()).isEqualTo("Message Publish");
        assertThat(publish.getMetadata()).containsEntry("platform", CSharpScanner.RABBITMQ);
    }

    @Test
    void scanFile_detectsFileOperations() throws Exception {
        Path file = write("Report.cs", String.join("\n",
                "var text = File.ReadAllText(\"input.csv\");",
                "File.WriteAllText(\"report.txt\", text);"));

        WorkflowGraph graph = scanner.scanFile(file);

        assertThat(node(graph, file, "file", 1).getType()).isEqualTo(WorkflowType.FILE_READ);
        assertThat(node(graph, file, "file", 1).getFilePath()).isEqualTo("input.csv");
        assertThat(node(graph, file, "file", 2).getType()).isEqualTo(WorkflowType.FILE_WRITE);
    }

    @Test
    void scanFile_skipsDisabledCategories() throws Exception {
        CSharpScanner apiOnly = new CSharpScanner(DetectionToggles.builder()
                .database(false).fileIo(false).messageQueues(false).dataTransforms(false).build());
        Path file = write("Mixed.cs", String.join("\n",
                "_context.Orders.Add(order);",
                "await http.GetAsync(url);"));

        WorkflowGraph graph = apiOnly.scanFile(file);

        assertThat(graph.getNodes()).extracting(WorkflowNode::getType).containsExactly(WorkflowType.API_CALL);
    }

    @Test
    void scanFile_readsLatin1Sources() throws Exception {
        Path file = repo.resolve("Legacy.cs");
        Files.write(file, "// Café orders\nvar items = _context.Items.ToList();\n"
                .getBytes(StandardCharsets.ISO_8859_1));

        WorkflowGraph graph = scanner.scanFile(file);

        assertThat(node(graph, file, "db_read", 2).getTableName()).isEqualTo("Items");
    }

    @Test
    void extractHttpMethod_defaultsToHttp() {
        assertThat(CSharpScanner.extractHttpMethod("await client.DeleteAsync(uri);")).isEqualTo("DELETE");
        assertThat(CSharpScanner.extractHttpMethod("await client.SendAsync(request);")).isEqualTo("HTTP");
    }

    @Test
    void canScan_acceptsCSharpOnly() {
        assertThat(scanner.canScan(Path.of("src/Orders/OrderService.cs"))).isTrue();
        assertThat(scanner.canScan(Path.of("src/app.ts"))).isFalse();
    }
}
