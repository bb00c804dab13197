package com.architecture.memory.workflowscan.service.scanner;

import com.architecture.memory.workflowscan.model.DetectionCategory;
import com.architecture.memory.workflowscan.model.DetectionToggles;
import com.architecture.memory.workflowscan.model.SchemaRegistry;
import com.architecture.memory.workflowscan.model.WorkflowNode;
import com.architecture.memory.workflowscan.model.WorkflowType;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.architecture.memory.workflowscan.service.scanner.DetectionPattern.of;

/**
 * Scanner for C# backends: Entity Framework, ADO.NET, HttpClient, file I/O, Service Bus and RabbitMQ.
 */
public class CSharpScanner extends AbstractPatternScanner {

    static final String SERVICE_BUS = "Azure Service Bus";
    static final String RABBITMQ = "RabbitMQ";

    private static final List<PatternGroup> GROUPS = List.of(
            PatternGroup.of("db_read", DetectionCategory.DATABASE,
                    of("\\.Where\\s*\\("),
                    of("\\.Select\\s*\\("),
                    of("\\.FirstOrDefault\\s*\\("),
                    of("\\.ToList\\s*\\("),
                    of("\\.Include\\s*\\("),
                    of("\\.FromSql")),
            PatternGroup.of("db_write", DetectionCategory.DATABASE,
                    of("\\.Add\\s*\\("),
                    of("\\.Update\\s*\\("),
                    of("\\.Remove\\s*\\("),
                    of("\\.SaveChanges"),
                    of("\\.SaveChangesAsync")),
            PatternGroup.of("sql", DetectionCategory.DATABASE,
                    of("SqlCommand|SqlDataAdapter|ExecuteReader|ExecuteScalar")),
            PatternGroup.of("api", DetectionCategory.API_CALLS,
                    of("HttpClient"),
                    of("\\.GetAsync\\s*\\("),
                    of("\\.PostAsync\\s*\\("),
                    of("\\.PutAsync\\s*\\("),
                    of("\\.DeleteAsync\\s*\\("),
                    of("\\.SendAsync\\s*\\(")),
            PatternGroup.of("file", DetectionCategory.FILE_IO,
                    of("File\\.ReadAllText"),
                    of("File\\.WriteAllText"),
                    of("File\\.ReadAllLines"),
                    of("File\\.WriteAllLines"),
                    of("StreamReader"),
                    of("StreamWriter"),
                    of("FileStream")),
            PatternGroup.of("msg", DetectionCategory.MESSAGE_QUEUES,
                    of("ServiceBusSender", SERVICE_BUS),
                    of("ServiceBusReceiver", SERVICE_BUS),
                    of("SendMessageAsync", SERVICE_BUS),
                    of("ReceiveMessageAsync", SERVICE_BUS),
                    of("\\.BasicPublish\\s*\\(", RABBITMQ),
                    of("\\.BasicConsume\\s*\\(", RABBITMQ),
                    of("QueueDeclare", RABBITMQ))
    );

    private static final Pattern ENTITY_ACCESS = Pattern.compile("DbSet<(\\w+)>|_context\\.(\\w+)|_db\\.(\\w+)");
    private static final Pattern VAR_MEMBER_ACCESS = Pattern.compile("var\\s+\\w+\\s*=\\s*\\w+\\.(\\w+)");
    private static final int ENTITY_LOOKBACK_LINES = 5;

    // DbContext members that are not entity sets
    private static final Set<String> CONTEXT_MEMBERS = Set.of(
            "SaveChanges", "SaveChangesAsync", "Database", "Set", "Entry", "ChangeTracker", "Model");

    private static final Pattern SQL_LITERAL =
            Pattern.compile("\"(SELECT|INSERT|UPDATE|DELETE).*?\"", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern URL_LITERAL = Pattern.compile("\"(https?://[^\"]+|/[^\"]*)\"");
    private static final Pattern NEARBY_URL_LITERAL = Pattern.compile("\"(https?://[^\"]+|/api/[^\"]*)\"");
    private static final Map<String, Pattern> HTTP_METHODS = httpMethodPatterns();
    private static final Pattern FILE_NAME_LITERAL = Pattern.compile("\"([^\"]*\\.[a-zA-Z]{2,4})\"");
    private static final Pattern QUEUE_DECLARATION =
            Pattern.compile("queueName\\s*=\\s*\"([^\"]+)\"|CreateQueue\\(\"([^\"]+)\"");
    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\"([^\"]+)\"");

    public CSharpScanner(DetectionToggles toggles) {
        super(toggles);
    }

    public CSharpScanner() {
        this(DetectionToggles.allEnabled());
    }

    @Override
    public String getName() {
        return "csharp";
    }

    @Override
    public boolean canScan(Path file) {
        return lowerName(file).endsWith(".cs");
    }

    @Override
    protected List<PatternGroup> patternGroups() {
        return GROUPS;
    }

    @Override
    protected WorkflowNode createNode(SourceFile file, PatternGroup group, DetectionPattern pattern,
                                      Matcher matcher, int lineNumber, SchemaRegistry registry) {
        String line = file.line(lineNumber);
        switch (group.getCategory()) {
            case "db_read": {
                String table = extractTableName(file, lineNumber, registry);
                return baseNode(file, "db_read", lineNumber, WorkflowType.DATABASE_READ,
                        "DB Query: " + (table != null ? table : "Unknown"))
                        .description("Database query operation")
                        .tableName(table)
                        .meta("pattern", pattern.getRegex().pattern())
                        .build();
            }
            case "db_write": {
                String table = extractTableName(file, lineNumber, registry);
                return baseNode(file, "db_write", lineNumber, WorkflowType.DATABASE_WRITE,
                        "DB Write: " + (table != null ? table : "Unknown"))
                        .description("Database write operation")
                        .tableName(table)
                        .meta("pattern", pattern.getRegex().pattern())
                        .build();
            }
            case "sql":
                return baseNode(file, "sql", lineNumber, WorkflowType.DATABASE_READ, "SQL Query")
                        .description("Raw SQL query execution")
                        .query(extractSqlQuery(file, lineNumber))
                        .build();
            case "api": {
                String method = extractHttpMethod(line);
                return baseNode(file, "api", lineNumber, WorkflowType.API_CALL, "API Call: " + method)
                        .description("HTTP API call")
                        .endpoint(extractEndpoint(file, lineNumber))
                        .method(method)
                        .build();
            }
            case "file": {
                boolean read = line.contains("Read");
                return baseNode(file, "file", lineNumber,
                        read ? WorkflowType.FILE_READ : WorkflowType.FILE_WRITE,
                        read ? "File Read" : "File Write")
                        .description(read ? "File read operation" : "File write operation")
                        .filePath(firstCapture(FILE_NAME_LITERAL, line))
                        .build();
            }
            case "msg":
                return messageNode(file, pattern.getLabel(), lineNumber);
            default:
                return null;
        }
    }

    private WorkflowNode messageNode(SourceFile file, String platform, int lineNumber) {
        String line = file.line(lineNumber);
        boolean rabbit = RABBITMQ.equals(platform);
        boolean send = rabbit ? line.contains("Publish") : line.contains("Send");
        String name;
        if (rabbit) {
            name = send ? "Message Publish" : "Message Consume";
        } else {
            name = send ? "Message Send" : "Message Receive";
        }
        return baseNode(file, "msg", lineNumber,
                send ? WorkflowType.MESSAGE_SEND : WorkflowType.MESSAGE_RECEIVE, name)
                .description(platform + " message operation")
                .queueName(extractQueueName(file, lineNumber))
                .meta("platform", platform)
                .build();
    }

    /**
     * Entity named on the line ({@code DbSet<X>}, {@code _context.X}, {@code _db.X}) or, failing
     * that, the member read into a {@code var} in the lines above; mapped through the registry.
     */
    String extractTableName(SourceFile file, int lineNumber, SchemaRegistry registry) {
        String entity = null;
        Matcher matcher = ENTITY_ACCESS.matcher(file.line(lineNumber));
        while (entity == null && matcher.find()) {
            String candidate = matcher.group(1) != null ? matcher.group(1)
                    : matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
            if (!CONTEXT_MEMBERS.contains(candidate)) {
                entity = candidate;
            }
        }
        for (int n = lineNumber - 1; entity == null && n >= Math.max(1, lineNumber - ENTITY_LOOKBACK_LINES); n--) {
            Matcher var = VAR_MEMBER_ACCESS.matcher(file.line(n));
            if (var.find() && !CONTEXT_MEMBERS.contains(var.group(1))) {
                entity = var.group(1);
            }
        }
        if (entity == null || registry == null) {
            return entity;
        }
        return registry.resolveTableName(entity);
    }

    private String extractSqlQuery(SourceFile file, int lineNumber) {
        Matcher m = SQL_LITERAL.matcher(file.range(lineNumber - 2, lineNumber + 3));
        return m.find() ? m.group() : null;
    }

    private String extractEndpoint(SourceFile file, int lineNumber) {
        String onLine = firstCapture(URL_LITERAL, file.line(lineNumber));
        if (onLine != null) return onLine;
        for (int n = Math.max(1, lineNumber - 3); n <= lineNumber; n++) {
            String nearby = firstCapture(NEARBY_URL_LITERAL, file.line(n));
            if (nearby != null) return nearby;
        }
        return null;
    }

    static String extractHttpMethod(String line) {
        for (Map.Entry<String, Pattern> method : HTTP_METHODS.entrySet()) {
            if (method.getValue().matcher(line).find()) {
                return method.getKey();
            }
        }
        return "HTTP";
    }

    private static Map<String, Pattern> httpMethodPatterns() {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (String method : List.of("GET", "POST", "PUT", "DELETE", "PATCH")) {
            patterns.put(method, Pattern.compile(method + "Async|\\." + method + "\\(", Pattern.CASE_INSENSITIVE));
        }
        return patterns;
    }

    private String extractQueueName(SourceFile file, int lineNumber) {
        String onLine = firstCapture(DOUBLE_QUOTED, file.line(lineNumber));
        if (onLine != null) return onLine;
        for (int n = Math.max(1, lineNumber - ENTITY_LOOKBACK_LINES); n <= lineNumber; n++) {
            String declared = firstCapture(QUEUE_DECLARATION, file.line(n));
            if (declared != null) return declared;
        }
        return null;
    }
}
