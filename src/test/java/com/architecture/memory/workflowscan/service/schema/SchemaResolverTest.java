package com.architecture.memory.workflowscan.service.schema;

import com.architecture.memory.workflowscan.model.SchemaRegistry;
import com.architecture.memory.workflowscan.model.SchemaSource;
import com.architecture.memory.workflowscan.model.TableSchema;
import com.architecture.memory.workflowscan.service.scanner.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaResolverTest {

    private static final String CONTEXT = String.join("\n",
            "public class ShopContext : DbContext",
            "{",
            "    public ShopContext(DbContextOptions options) : base(options) { }",
            "    public DbSet<Order> Orders { get; set; }",
            "    public DbSet<Customer> Customers { get; set; }",
            "}",
            "public class Unrelated",
            "{",
            "    public DbSet<Ghost> Ghosts { get; set; }",
            "}");

    private static final String ENTITIES = String.join("\n",
            "[Table(\"orders\")]",
            "public class Order",
            "{",
            "    public int Id { get; set; }",
            "    public decimal Total { get; set; }",
            "}",
            "public class Customer",
            "{",
            "    public int Id { get; set; }",
            "    public string Email { get; set; }",
            "}",
            "public class Money",
            "{",
            "    public decimal Amount { get; set; }",
            "    public string Currency { get; set; }",
            "}");

    @TempDir
    Path repo;

    private final SchemaResolver resolver = new SchemaResolver();

    @Test
    void detectDbSets_readsOnlyInsideDbContextBody() {
        List<TableSchema> schemas = resolver.detectDbSets(SourceFile.of("ShopContext.cs", CONTEXT));

        assertThat(schemas).extracting(TableSchema::getEntityName).containsExactly("Order", "Customer");
        assertThat(schemas).extracting(TableSchema::getTableName).containsExactly("Orders", "Customers");
        assertThat(schemas).allSatisfy(schema -> assertThat(schema.getSource()).isEqualTo(SchemaSource.DB_SET));
    }

    @Test
    void detectEntityClasses_usesTableAttributeAndEntityHeuristic() {
        List<TableSchema> schemas = resolver.detectEntityClasses(SourceFile.of("Entities.cs", ENTITIES));

        assertThat(schemas).extracting(TableSchema::getEntityName).containsExactly("Order", "Customer");
        TableSchema order = schemas.get(0);
        assertThat(order.getTableName()).isEqualTo("orders");
        assertThat(order.getSource()).isEqualTo(SchemaSource.TABLE_ATTRIBUTE);
        assertThat(order.getProperties()).containsExactly("Id", "Total");
        assertThat(schemas.get(1).getSource()).isEqualTo(SchemaSource.CLASS_NAME);
        assertThat(schemas.get(1).getMetadata()).containsEntry("has_table_attribute", false);
    }

    @Test
    void resolve_prefersTableAttributeOverDbSetName() throws Exception {
        Path context = Files.writeString(repo.resolve("ShopContext.cs"), CONTEXT);
        Path entities = Files.writeString(repo.resolve("Entities.cs"), ENTITIES);
        List<String> warnings = new ArrayList<>();

        SchemaRegistry registry = resolver.resolve(List.of(context, entities), 100, 100, warnings);

        assertThat(warnings).isEmpty();
        assertThat(registry.resolveTableName("Orders")).isEqualTo("orders");
        assertThat(registry.resolveTableName("Order")).isEqualTo("orders");
        assertThat(registry.resolveTableName("Customers")).isEqualTo("Customers");
        assertThat(registry.resolveTableName("Unknown")).isEqualTo("Unknown");
    }

    @Test
    void resolve_recordsCapsAndUnreadableFilesAsWarnings() throws Exception {
        Path context = Files.writeString(repo.resolve("ShopContext.cs"), CONTEXT);
        Path missing = repo.resolve("Missing.cs");
        Path entities = Files.writeString(repo.resolve("Entities.cs"), ENTITIES);
        List<String> warnings = new ArrayList<>();

        SchemaRegistry registry = resolver.resolve(List.of(missing, context, entities), 2, 1, warnings);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(warnings).hasSize(2);
        assertThat(warnings.get(0)).startsWith("Schema detection failed for " + missing);
        assertThat(warnings.get(1)).isEqualTo("Schema limit reached (1); further schemas ignored");
    }

    @Test
    void resolve_stopsAtFileLimit() throws Exception {
        Path first = Files.writeString(repo.resolve("A.cs"), CONTEXT);
        Path second = Files.writeString(repo.resolve("B.cs"), ENTITIES);
        List<String> warnings = new ArrayList<>();

        SchemaRegistry registry = resolver.resolve(List.of(first, second), 1, 100, warnings);

        assertThat(registry.size()).isEqualTo(2);
        assertThat(warnings).containsExactly("Schema file limit reached (1); 1 backend files not examined");
    }

    @Test
    void looksLikeEntity_needsCommonPropertyOrThreeProperties() {
        assertThat(SchemaResolver.looksLikeEntity(List.of("Id"))).isFalse();
        assertThat(SchemaResolver.looksLikeEntity(List.of("Amount", "Currency"))).isFalse();
        assertThat(SchemaResolver.looksLikeEntity(List.of("Id", "Email"))).isTrue();
        assertThat(SchemaResolver.looksLikeEntity(List.of("A", "B", "C"))).isTrue();
    }
}
