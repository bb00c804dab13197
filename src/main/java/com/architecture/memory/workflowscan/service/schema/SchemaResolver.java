package com.architecture.memory.workflowscan.service.schema;

import com.architecture.memory.workflowscan.exception.SourceReadException;
import com.architecture.memory.workflowscan.model.SchemaRegistry;
import com.architecture.memory.workflowscan.model.SchemaSource;
import com.architecture.memory.workflowscan.model.TableSchema;
import com.architecture.memory.workflowscan.service.scanner.SourceFile;
import com.architecture.memory.workflowscan.service.scanner.SourceFileReader;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Schema pre-pass over C# backend files. Finds Entity Framework {@code DbSet} declarations and
 * entity classes and registers their table names so the scanners can resolve entity references.
 */
@Slf4j
public class SchemaResolver {

    private static final Pattern DB_CONTEXT_CLASS = Pattern.compile("class\\s+\\w+\\s*:\\s*DbContext");
    private static final Pattern DB_SET = Pattern.compile("DbSet<(\\w+)>\\s+(\\w+)");
    private static final Pattern TABLE_ATTRIBUTE = Pattern.compile("\\[Table\\(\"([^\"]+)\"");
    private static final Pattern CLASS_DECLARATION = Pattern.compile("class\\s+(\\w+)");
    private static final Pattern AUTO_PROPERTY = Pattern.compile("public\\s+\\w+\\??(\\[\\])?\\s+(\\w+)\\s*\\{\\s*get;");

    private static final Set<String> COMMON_ENTITY_PROPERTIES =
            Set.of("Id", "ID", "Name", "CreatedAt", "UpdatedAt", "Created", "Modified");

    /**
     * Build a registry from {@code backendFiles}, examining at most {@code maxFiles} files and
     * registering at most {@code maxSchemas} schemas. Per-file failures and cap hits are appended
     * to {@code warnings}; the pass itself never fails.
     */
    public SchemaRegistry resolve(List<Path> backendFiles, int maxFiles, int maxSchemas, List<String> warnings) {
        SchemaRegistry registry = new SchemaRegistry();
        int examined = 0;
        for (Path file : backendFiles) {
            if (examined >= maxFiles) {
                String warning = "Schema file limit reached (" + maxFiles + "); "
                        + (backendFiles.size() - examined) + " backend files not examined";
                log.warn(warning);
                warnings.add(warning);
                break;
            }
            examined++;
            List<TableSchema> schemas;
            try {
                schemas = detectSchemas(file);
            } catch (SourceReadException | RuntimeException e) {
                String warning = "Schema detection failed for " + file + ": " + e.getMessage();
                log.warn(warning);
                warnings.add(warning);
                continue;
            }
            for (TableSchema schema : schemas) {
                if (registry.size() >= maxSchemas) {
                    String warning = "Schema limit reached (" + maxSchemas + "); further schemas ignored";
                    log.warn(warning);
                    warnings.add(warning);
                    return registry;
                }
                registry.register(schema);
            }
        }
        log.info("Schema pass examined {} files, registered {} schemas", examined, registry.size());
        return registry;
    }

    public List<TableSchema> detectSchemas(Path file) throws SourceReadException {
        SourceFile source = SourceFileReader.read(file);
        List<TableSchema> schemas = new ArrayList<>(detectDbSets(source));
        schemas.addAll(detectEntityClasses(source));
        return schemas;
    }

    /**
     * DbSet properties declared inside a {@code DbContext} subclass body. The table name is the
     * property name.
     */
    List<TableSchema> detectDbSets(SourceFile source) {
        List<TableSchema> schemas = new ArrayList<>();
        boolean inContext = false;
        boolean opened = false;
        int depth = 0;
        for (int n = 1; n <= source.lineCount(); n++) {
            String line = source.line(n);
            if (!inContext) {
                if (!DB_CONTEXT_CLASS.matcher(line).find()) continue;
                inContext = true;
                opened = false;
                depth = 0;
            } else {
                Matcher dbSet = DB_SET.matcher(line);
                if (dbSet.find()) {
                    schemas.add(TableSchema.builder()
                            .entityName(dbSet.group(1))
                            .tableName(dbSet.group(2))
                            .dbsetName(dbSet.group(2))
                            .filePath(source.getPath())
                            .lineNumber(n)
                            .source(SchemaSource.DB_SET)
                            .meta("detected_from", "DbSet")
                            .build());
                }
            }
            for (char c : line.toCharArray()) {
                if (c == '{') {
                    depth++;
                    opened = true;
                } else if (c == '}') {
                    depth--;
                }
            }
            if (opened && depth <= 0) {
                inContext = false;
            }
        }
        return schemas;
    }

    /**
     * Classes whose auto-properties look like a persisted entity. {@code [Table("x")]} on the class
     * names the table; otherwise the class name is used.
     */
    List<TableSchema> detectEntityClasses(SourceFile source) {
        List<TableSchema> schemas = new ArrayList<>();
        String pendingAttribute = null;
        String currentClass = null;
        String currentAttribute = null;
        int currentLine = 0;
        List<String> properties = new ArrayList<>();

        for (int n = 1; n <= source.lineCount(); n++) {
            String line = source.line(n);
            Matcher table = TABLE_ATTRIBUTE.matcher(line);
            if (table.find()) {
                pendingAttribute = table.group(1);
            }
            Matcher declaration = CLASS_DECLARATION.matcher(line);
            if (declaration.find()) {
                addIfEntity(schemas, source, currentClass, currentAttribute, currentLine, properties);
                currentClass = declaration.group(1);
                currentAttribute = pendingAttribute;
                currentLine = n;
                properties = new ArrayList<>();
                pendingAttribute = null;
            }
            if (currentClass != null) {
                Matcher property = AUTO_PROPERTY.matcher(line);
                if (property.find()) {
                    properties.add(property.group(2));
                }
            }
        }
        addIfEntity(schemas, source, currentClass, currentAttribute, currentLine, properties);
        return schemas;
    }

    private static void addIfEntity(List<TableSchema> schemas, SourceFile source, String className,
                                    String tableAttribute, int line, List<String> properties) {
        if (className == null || !looksLikeEntity(properties)) return;
        schemas.add(TableSchema.builder()
                .entityName(className)
                .tableName(tableAttribute != null ? tableAttribute : className)
                .filePath(source.getPath())
                .lineNumber(line)
                .source(tableAttribute != null ? SchemaSource.TABLE_ATTRIBUTE : SchemaSource.CLASS_NAME)
                .properties(properties)
                .meta("has_table_attribute", tableAttribute != null)
                .build());
    }

    static boolean looksLikeEntity(List<String> properties) {
        if (properties.size() < 2) return false;
        return properties.size() >= 3 || properties.stream().anyMatch(COMMON_ENTITY_PROPERTIES::contains);
    }
}
