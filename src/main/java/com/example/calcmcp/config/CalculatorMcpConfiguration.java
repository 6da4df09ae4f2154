package com.example.calcmcp.config;

import com.example.calcmcp.history.History;
import com.example.calcmcp.model.CalculationResult;
import com.example.calcmcp.model.HistoryLog;
import com.example.calcmcp.model.Operation;
import com.example.calcmcp.service.CalculationException;
import com.example.calcmcp.service.Calculator;
import com.example.calcmcp.service.HistoryService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.modelcontextprotocol.common.McpTransportContext;
import io.modelcontextprotocol.server.McpStatelessServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;
import java.util.function.IntBinaryOperator;
import java.util.stream.Stream;

/**
 * Calculator MCP surface.
 *
 * <p>Every arithmetic tool appends one record to the history the calculator
 * is currently bound to. Histories are named; {@code switchHistory} rebinds
 * the calculator and creates the target on first use.
 *
 * <p>Transport context headers consumed:
 * <ul>
 *   <li>{@code X-Client-ID}      — calling agent, for log attribution</li>
 *   <li>{@code X-Correlation-ID} — distributed trace propagation</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class CalculatorMcpConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CalculatorMcpConfiguration.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // =========================================================================
    // TOOL ANNOTATION PRESETS
    // =========================================================================

    private static final McpSchema.ToolAnnotations READ_ONLY =
            new McpSchema.ToolAnnotations(null, true, false, true, false, false);

    /** Appends to a history; never removes anything. */
    private static final McpSchema.ToolAnnotations APPENDS =
            new McpSchema.ToolAnnotations(null, false, false, false, false, false);

    private static final McpSchema.ToolAnnotations REBINDS =
            new McpSchema.ToolAnnotations(null, false, false, true, false, false);

    private static final int DEFAULT_COUNT = 10;

    // =========================================================================
    // TOOLS
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncToolSpecification> allTools(
            Calculator calculator,
            HistoryService histories) {
        return Stream.of(
                arithmeticTools(calculator, histories),
                historyTools(histories)
        ).flatMap(List::stream).toList();
    }

    // ------------------------------------------------------------------ arithmetic

    private List<McpStatelessServerFeatures.SyncToolSpecification> arithmeticTools(
            Calculator calculator, HistoryService histories) {
        return List.of(
            arithmeticTool(Operation.ADD, "Add",
                "Add two 32-bit integers. Records \"a + b = result\" in the active history.",
                calculator::add, histories),
            arithmeticTool(Operation.SUBTRACT, "Subtract",
                "Subtract b from a. Records \"a - b = result\" in the active history.",
                calculator::subtract, histories),
            arithmeticTool(Operation.MULTIPLY, "Multiply",
                "Multiply two 32-bit integers. Fails instead of wrapping when the product overflows.",
                calculator::multiply, histories),
            arithmeticTool(Operation.DIVIDE, "Divide",
                "Integer division truncating toward zero (7 / 2 = 3, -7 / 2 = -3). " +
                "Division by zero is reported as an error and nothing is recorded.",
                calculator::divide, histories)
        );
    }

    private McpStatelessServerFeatures.SyncToolSpecification arithmeticTool(
            Operation op, String title, String description,
            IntBinaryOperator fn, HistoryService histories) {
        String name = op.name().toLowerCase(Locale.ROOT);
        return tool(name, title, description, APPENDS,
            schema(Map.of(
                "a", prop("integer", "Left operand"),
                "b", prop("integer", "Right operand")),
                List.of("a", "b")),
            (ctx, req) -> {
                try {
                    int a = requiredInt(req, "a");
                    int b = requiredInt(req, "b");
                    logCtx(ctx, name, a + " " + op.symbol() + " " + b);
                    int result = fn.applyAsInt(a, b);
                    CalculationResult view = new CalculationResult(op, a, b, result,
                            op.format(a, b, result), histories.currentName().orElse(null));
                    return ok(toJson(view), view);
                } catch (CalculationException e) {
                    log.warn("tool={} rejected: kind={} {}", name, e.getKind(), e.getMessage());
                    return err(e.getKind() + ": " + e.getMessage());
                } catch (IllegalArgumentException e) {
                    log.warn("tool={} invalid arguments: {}", name, e.getMessage());
                    return err(e.getMessage());
                }
            });
    }

    // ------------------------------------------------------------------ history

    private List<McpStatelessServerFeatures.SyncToolSpecification> historyTools(HistoryService histories) {
        return List.of(

            tool("getLastOperations",
                "Get Last Operations",
                "Most recent operation records, oldest first. Defaults to the history the calculator " +
                "is currently recording into and to the last " + DEFAULT_COUNT + " records.",
                READ_ONLY,
                schema(Map.of(
                    "count",       prop("integer", "How many records to return, default " + DEFAULT_COUNT),
                    "historyName", prop("string", "Named history to read, default the active one")),
                    List.of()),
                (ctx, req) -> {
                    String name = str(req, "historyName");
                    logCtx(ctx, "getLastOperations", name);
                    try {
                        int count = intArg(req, "count", DEFAULT_COUNT);
                        History target = name == null ? histories.current() : histories.require(name);
                        List<String> records = target.getLastOperations(count);
                        String text = target.size() == 0 ? "No operations recorded yet" : toJson(records);
                        return ok(text, Map.of("records", records));
                    } catch (IllegalArgumentException e) {
                        log.warn("tool=getLastOperations invalid arguments: {}", e.getMessage());
                        return err(e.getMessage());
                    }
                }),

            tool("switchHistory",
                "Switch History",
                "Record all later operations into the named history, creating it if it does not exist. " +
                "Earlier histories keep their records and stay readable by name.",
                REBINDS,
                schema(Map.of("historyName", prop("string", "Target history name, e.g. 'session-2'")),
                       List.of("historyName")),
                (ctx, req) -> {
                    String name = str(req, "historyName");
                    logCtx(ctx, "switchHistory", name);
                    try {
                        HistoryLog view = histories.switchTo(name);
                        return ok(toJson(view), view);
                    } catch (IllegalArgumentException e) {
                        return err(e.getMessage());
                    }
                }),

            tool("listHistories",
                "List Histories",
                "All named histories with their record counts, capacity (0 = unbounded) and which one is active.",
                READ_ONLY,
                schema(Map.of(), List.of()),
                (ctx, req) -> {
                    logCtx(ctx, "listHistories", null);
                    List<HistoryLog> all = histories.findAll();
                    return ok(toJson(all), Map.of("histories", all));
                })
        );
    }

    // =========================================================================
    // STATIC RESOURCES
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncResourceSpecification> staticResources(
            HistoryService histories) {
        return List.of(

            resource("calc://history/current",
                "Active History",
                "Every record in the history the calculator is currently recording into, oldest first.",
                "application/json",
                (ctx, req) -> {
                    History current = histories.current();
                    return jsonResource(req.uri(), toJson(current.getLastOperations(current.size())));
                }),

            resource("calc://operations",
                "Operation Catalog",
                "Supported operations, record format and arithmetic error policy.",
                "application/json",
                (ctx, req) -> jsonResource(req.uri(), toJson(operationCatalog())))
        );
    }

    // =========================================================================
    // RESOURCE TEMPLATES
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncResourceTemplateSpecification> resourceTemplates(
            HistoryService histories) {
        return List.of(

            template("history://{historyName}/entries",
                "History Entries",
                "Every record in a named history, oldest first.",
                "application/json",
                (ctx, req) -> {
                    History h = histories.require(seg(req.uri(), "history://", "/entries"));
                    return jsonResource(req.uri(), toJson(h.getLastOperations(h.size())));
                })
        );
    }

    // =========================================================================
    // PROMPTS
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncPromptSpecification> prompts(HistoryService histories) {
        return List.of(

            prompt("summarize-recent-calculations",
                "Summarise the most recent calculations recorded in a history.",
                List.of(
                    arg("historyName", "History to summarise, default the active one", false),
                    arg("count",       "How many records to include, default " + DEFAULT_COUNT, false)),
                (ctx, req) -> {
                    String name = str(req.arguments(), "historyName");
                    int count = promptIntArg(req.arguments(), "count", DEFAULT_COUNT);
                    // same resolution as getLastOperations: unknown or blank names are rejected
                    History target = name == null ? histories.current() : histories.require(name);
                    String label = name != null ? name.trim() : histories.currentName().orElse("active");
                    List<String> records = target.getLastOperations(count);
                    return promptResult("Recent calculations in " + label,
                        """
                        You are reviewing a calculator's operation log.
                        Summarise what the user has been computing.

                        ## History
                        %s

                        ## Records (oldest first)
                        %s

                        ## Your Response Should:
                        - Group related calculations and state the final values reached
                        - Point out any result that looks like a mistake (e.g. truncated division)
                        - Keep it to a short paragraph
                        """.formatted(label, toJson(records)));
                })
        );
    }

    // =========================================================================
    // COMPLETIONS
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncCompletionSpecification> completions(HistoryService histories) {
        return List.of(
            new McpStatelessServerFeatures.SyncCompletionSpecification(
                new McpSchema.PromptReference("summarize-recent-calculations"),
                (McpTransportContext ctx, McpSchema.CompleteRequest req) -> {
                    if (!"historyName".equals(req.argument().name())) return emptyCompletion();
                    return historyNameCompletion(histories, req.argument().value());
                })
        );
    }

    // =========================================================================
    // BUILDER HELPERS
    // =========================================================================

    @FunctionalInterface
    interface ToolHandler {
        McpSchema.CallToolResult handle(McpTransportContext ctx, McpSchema.CallToolRequest req);
    }

    private McpStatelessServerFeatures.SyncToolSpecification tool(
            String name, String title, String description,
            McpSchema.ToolAnnotations annotations, McpSchema.JsonSchema inputSchema,
            ToolHandler handler) {
        return McpStatelessServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name(name).title(title).description(description)
                        .inputSchema(inputSchema).annotations(annotations).build())
                .callHandler(handler::handle)
                .build();
    }

    private McpStatelessServerFeatures.SyncResourceSpecification resource(
            String uri, String name, String description, String mimeType,
            java.util.function.BiFunction<McpTransportContext, McpSchema.ReadResourceRequest,
                    McpSchema.ReadResourceResult> handler) {
        return new McpStatelessServerFeatures.SyncResourceSpecification(
                McpSchema.Resource.builder().uri(uri).name(name).description(description).mimeType(mimeType).build(),
                handler);
    }

    private McpStatelessServerFeatures.SyncResourceTemplateSpecification template(
            String uriTemplate, String name, String description, String mimeType,
            java.util.function.BiFunction<McpTransportContext, McpSchema.ReadResourceRequest,
                    McpSchema.ReadResourceResult> handler) {
        return new McpStatelessServerFeatures.SyncResourceTemplateSpecification(
                McpSchema.ResourceTemplate.builder()
                        .uriTemplate(uriTemplate).name(name).description(description).mimeType(mimeType).build(),
                handler);
    }

    private McpStatelessServerFeatures.SyncPromptSpecification prompt(
            String name, String description, List<McpSchema.PromptArgument> args,
            java.util.function.BiFunction<McpTransportContext, McpSchema.GetPromptRequest,
                    McpSchema.GetPromptResult> handler) {
        return new McpStatelessServerFeatures.SyncPromptSpecification(
                new McpSchema.Prompt(name, description, args), handler);
    }

    private static McpSchema.PromptArgument arg(String name, String description, boolean required) {
        return new McpSchema.PromptArgument(name, description, required);
    }

    private static McpSchema.GetPromptResult promptResult(String description, String text) {
        return new McpSchema.GetPromptResult(description,
                List.of(new McpSchema.PromptMessage(McpSchema.Role.USER, new McpSchema.TextContent(text))));
    }

    // =========================================================================
    // CALL RESULT HELPERS
    // =========================================================================

    private McpSchema.CallToolResult ok(String text, Object structured) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), false, structured, null);
    }

    private static McpSchema.CallToolResult err(String message) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(message)), true);
    }

    private McpSchema.ReadResourceResult jsonResource(String uri, String json) {
        return new McpSchema.ReadResourceResult(
                List.of(new McpSchema.TextResourceContents(uri, "application/json", json)));
    }

    // =========================================================================
    // COMPLETION HELPERS
    // =========================================================================

    private McpSchema.CompleteResult historyNameCompletion(HistoryService histories, String partial) {
        String prefix = partial == null ? "" : partial.toLowerCase(Locale.ROOT);
        List<String> s = histories.findAll().stream()
                .map(HistoryLog::name)
                .filter(n -> n.toLowerCase(Locale.ROOT).startsWith(prefix))
                .limit(5).toList();
        return new McpSchema.CompleteResult(new McpSchema.CompleteResult.CompleteCompletion(s, s.size(), false));
    }

    private static McpSchema.CompleteResult emptyCompletion() {
        return new McpSchema.CompleteResult(
                new McpSchema.CompleteResult.CompleteCompletion(List.of(), 0, false));
    }

    // =========================================================================
    // SCHEMA HELPERS
    // =========================================================================

    private static McpSchema.JsonSchema schema(Map<String, Object> properties, List<String> required) {
        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    private static Map<String, Object> prop(String type, String description) {
        return Map.of("type", type, "description", description);
    }

    // =========================================================================
    // ARGUMENT EXTRACTION HELPERS
    // =========================================================================

    private static String str(McpSchema.CallToolRequest req, String key) {
        return str(req.arguments(), key);
    }

    private static String str(Map<String, Object> args, String key) {
        if (args == null) return null;
        Object v = args.get(key);
        return v instanceof String s ? s : null;
    }

    private static int intArg(McpSchema.CallToolRequest req, String key, int def) {
        Object v = req.arguments() == null ? null : req.arguments().get(key);
        return v == null ? def : exactInt(key, v);
    }

    /** Prompt arguments arrive as strings. */
    private static int promptIntArg(Map<String, Object> args, String key, int def) {
        Object v = args == null ? null : args.get(key);
        if (v == null) return def;
        if (v instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Argument '" + key + "' must be an integer, got: " + s, e);
            }
        }
        return exactInt(key, v);
    }

    static int requiredInt(McpSchema.CallToolRequest req, String key) {
        Object v = req.arguments() == null ? null : req.arguments().get(key);
        if (v == null) {
            throw new IllegalArgumentException("Missing required integer argument '" + key + "'");
        }
        return exactInt(key, v);
    }

    /** Whole numbers inside the int range only; never truncates or wraps. */
    private static int exactInt(String key, Object v) {
        if (!(v instanceof Number n)) {
            throw new IllegalArgumentException("Argument '" + key + "' must be an integer, got: " + v);
        }
        BigDecimal exact = n instanceof BigDecimal d ? d
                         : n instanceof BigInteger i ? new BigDecimal(i)
                         : n instanceof Double || n instanceof Float ? BigDecimal.valueOf(n.doubleValue())
                         : BigDecimal.valueOf(n.longValue());
        try {
            return exact.intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "Argument '" + key + "' must be a whole number within 32-bit range, got: " + v, e);
        }
    }

    /** Extracts the variable segment from a resolved URI template. */
    private static String seg(String uri, String prefix, String suffix) {
        String after = uri.startsWith(prefix) ? uri.substring(prefix.length()) : uri;
        return !suffix.isEmpty() && after.contains(suffix)
                ? after.substring(0, after.indexOf(suffix)) : after;
    }

    private void logCtx(McpTransportContext ctx, String tool, String subject) {
        String client = ctx.get("X-Client-ID")      instanceof String c ? c : "unknown";
        String corr   = ctx.get("X-Correlation-ID") instanceof String c ? c : "-";
        log.info("[client={}] [corr={}] tool={} subject={}", client, corr, tool, subject);
    }

    private String toJson(Object obj) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            return obj.toString();
        }
    }

    // =========================================================================
    // STATIC KNOWLEDGE BUILDERS
    // =========================================================================

    private static Map<String, Object> operationCatalog() {
        List<Map<String, Object>> ops = Arrays.stream(Operation.values())
                .map(op -> Map.<String, Object>of(
                        "tool",    op.name().toLowerCase(Locale.ROOT),
                        "symbol",  op.symbol(),
                        "example", op.format(7, -2, switch (op) {
                            case ADD -> 5;
                            case SUBTRACT -> 9;
                            case MULTIPLY -> -14;
                            case DIVIDE -> -3;
                        })))
                .toList();
        Map<String, Object> catalog = new LinkedHashMap<>();
        catalog.put("operandType",  "32-bit signed integer");
        catalog.put("recordFormat", "<a> <symbol> <b> = <result>");
        catalog.put("operations",   ops);
        catalog.put("errors", Map.of(
                "DIVISION_BY_ZERO",    "divide with b = 0; nothing is recorded",
                "ARITHMETIC_OVERFLOW", "result outside the 32-bit range; nothing is recorded"));
        return catalog;
    }
}
