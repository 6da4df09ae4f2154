package com.example.calcmcp.config;

import com.example.calcmcp.history.InMemoryHistory;
import com.example.calcmcp.model.CalculationResult;
import com.example.calcmcp.model.HistoryLog;
import com.example.calcmcp.model.Operation;
import com.example.calcmcp.service.HistoryService;
import com.example.calcmcp.service.SimpleCalculator;
import io.modelcontextprotocol.common.McpTransportContext;
import io.modelcontextprotocol.server.McpStatelessServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CalculatorMcpConfigurationTest {

    private final CalculatorMcpConfiguration config = new CalculatorMcpConfiguration();
    private InMemoryHistory initial;
    private HistoryService histories;
    private List<McpStatelessServerFeatures.SyncToolSpecification> tools;

    @BeforeEach
    void setUp() {
        initial = new InMemoryHistory();
        SimpleCalculator calculator = new SimpleCalculator(initial);
        histories = new HistoryService(calculator, new HistoryProperties("default", 0));
        tools = config.allTools(calculator, histories);
    }

    @Test
    @DisplayName("every calculator and history operation is published as a tool")
    void registersAllTools() {
        assertThat(tools).extracting(t -> t.tool().name()).containsExactly(
                "add", "subtract", "multiply", "divide",
                "getLastOperations", "switchHistory", "listHistories");
    }

    @Test
    @DisplayName("add returns the structured result and records it")
    void add_recordsAndReturnsResult() {
        McpSchema.CallToolResult result = call("add", Map.of("a", 2, "b", 3));

        assertFalse(result.isError());
        CalculationResult payload = assertInstanceOf(CalculationResult.class, result.structuredContent());
        assertEquals(Operation.ADD, payload.operation());
        assertEquals(5, payload.result());
        assertEquals("2 + 3 = 5", payload.record());
        assertEquals("default", payload.historyName());
        assertEquals(List.of("2 + 3 = 5"), initial.getLastOperations(10));
        assertThat(text(result)).contains("\"record\" : \"2 + 3 = 5\"");
    }

    @Test
    void divide_truncatesTowardZero() {
        McpSchema.CallToolResult result = call("divide", Map.of("a", -7, "b", 2));

        assertFalse(result.isError());
        assertEquals(-3, ((CalculationResult) result.structuredContent()).result());
        assertEquals(List.of("-7 / 2 = -3"), initial.getLastOperations(10));
    }

    @Test
    @DisplayName("division by zero is an error result and records nothing")
    void divide_byZero_isErrorResult() {
        McpSchema.CallToolResult result = call("divide", Map.of("a", 10, "b", 0));

        assertTrue(result.isError());
        assertEquals("DIVISION_BY_ZERO: Division by zero: 10 / 0", text(result));
        assertEquals(0, initial.size());
    }

    @Test
    void multiply_overflow_isErrorResult() {
        McpSchema.CallToolResult result = call("multiply", Map.of("a", Integer.MAX_VALUE, "b", 2));

        assertTrue(result.isError());
        assertThat(text(result)).startsWith("ARITHMETIC_OVERFLOW");
    }

    @Test
    @DisplayName("operands must be present, integral and within int range")
    void invalidOperands_areErrorResults() {
        assertTrue(call("add", Map.of("a", 1)).isError());
        assertTrue(call("add", Map.of("a", "one", "b", 2)).isError());
        assertTrue(call("add", Map.of("a", 1.5, "b", 2)).isError());
        assertTrue(call("add", Map.of("a", 3_000_000_000L, "b", 2)).isError());
        assertEquals(0, initial.size());
    }

    @Test
    @DisplayName("whole-valued doubles are accepted as operands")
    void wholeDoubleOperand_accepted() {
        McpSchema.CallToolResult result = call("subtract", Map.of("a", 10.0, "b", -3));

        assertFalse(result.isError());
        assertEquals(List.of("10 - -3 = 13"), initial.getLastOperations(1));
    }

    @Test
    void getLastOperations_readsActiveHistory() {
        call("add", Map.of("a", 1, "b", 2));
        call("multiply", Map.of("a", 3, "b", 4));
        call("divide", Map.of("a", 12, "b", 2));

        McpSchema.CallToolResult result = call("getLastOperations", Map.of("count", 2));

        assertFalse(result.isError());
        assertEquals(Map.of("records", List.of("3 * 4 = 12", "12 / 2 = 6")), result.structuredContent());
    }

    @Test
    void getLastOperations_emptyHistory() {
        McpSchema.CallToolResult result = call("getLastOperations", Map.of());

        assertFalse(result.isError());
        assertEquals("No operations recorded yet", text(result));
        assertEquals(Map.of("records", List.of()), result.structuredContent());
    }

    @Test
    @DisplayName("count 0 on a non-empty history is an empty list, not 'nothing recorded'")
    void getLastOperations_zeroCount() {
        call("add", Map.of("a", 1, "b", 1));
        call("add", Map.of("a", 2, "b", 2));

        McpSchema.CallToolResult result = call("getLastOperations", Map.of("count", 0));

        assertFalse(result.isError());
        assertNotEquals("No operations recorded yet", text(result));
        assertEquals(Map.of("records", List.of()), result.structuredContent());
    }

    @Test
    @DisplayName("count must be a whole number within int range")
    void getLastOperations_invalidCount_isErrorResult() {
        call("add", Map.of("a", 1, "b", 1));
        call("add", Map.of("a", 2, "b", 2));

        McpSchema.CallToolResult wrapsToOne = call("getLastOperations", Map.of("count", 4_294_967_297L));
        McpSchema.CallToolResult wrapsNegative = call("getLastOperations", Map.of("count", 3_000_000_000L));
        McpSchema.CallToolResult fractional = call("getLastOperations", Map.of("count", 1.9));
        McpSchema.CallToolResult notANumber = call("getLastOperations", Map.of("count", "two"));

        assertTrue(wrapsToOne.isError());
        assertThat(text(wrapsToOne)).contains("'count'");
        assertTrue(wrapsNegative.isError());
        assertTrue(fractional.isError());
        assertTrue(notANumber.isError());
    }

    @Test
    void getLastOperations_wholeDoubleCount_accepted() {
        call("add", Map.of("a", 1, "b", 1));
        call("add", Map.of("a", 2, "b", 2));

        McpSchema.CallToolResult result = call("getLastOperations", Map.of("count", 1.0));

        assertEquals(Map.of("records", List.of("2 + 2 = 4")), result.structuredContent());
    }

    @Test
    void getLastOperations_blankHistoryName_isErrorResult() {
        assertTrue(call("getLastOperations", Map.of("historyName", " ")).isError());
    }

    @Test
    void getLastOperations_unknownHistory_isErrorResult() {
        McpSchema.CallToolResult result = call("getLastOperations", Map.of("historyName", "nope"));

        assertTrue(result.isError());
        assertEquals("History not found: nope", text(result));
    }

    @Test
    @DisplayName("switchHistory sends later operations to the named history")
    void switchHistory_rebinds() {
        call("add", Map.of("a", 1, "b", 1));

        McpSchema.CallToolResult switched = call("switchHistory", Map.of("historyName", "second"));
        call("add", Map.of("a", 2, "b", 2));

        assertFalse(switched.isError());
        assertEquals("second", ((HistoryLog) switched.structuredContent()).name());
        assertEquals(List.of("1 + 1 = 2"), initial.getLastOperations(10));
        assertEquals(List.of("2 + 2 = 4"), histories.require("second").getLastOperations(10));

        McpSchema.CallToolResult fromDefault =
                call("getLastOperations", Map.of("historyName", "default"));
        assertEquals(Map.of("records", List.of("1 + 1 = 2")), fromDefault.structuredContent());
    }

    @Test
    void switchHistory_missingName_isErrorResult() {
        assertTrue(call("switchHistory", Map.of()).isError());
    }

    @Test
    void listHistories_describesRegistry() {
        call("switchHistory", Map.of("historyName", "second"));

        McpSchema.CallToolResult result = call("listHistories", Map.of());

        @SuppressWarnings("unchecked")
        List<HistoryLog> all = ((Map<String, List<HistoryLog>>) result.structuredContent()).get("histories");
        assertThat(all).extracting(HistoryLog::name).containsExactly("default", "second");
        assertThat(text(result)).contains("\"createdAt\" : \"");
    }

    // ========== Resources ==========

    @Test
    @DisplayName("calc://history/current lists every record of the active history")
    void currentHistoryResource() {
        call("add", Map.of("a", 1, "b", 2));
        call("switchHistory", Map.of("historyName", "second"));
        call("multiply", Map.of("a", 3, "b", 4));

        String json = readResource("calc://history/current");

        assertThat(json).contains("3 * 4 = 12").doesNotContain("1 + 2 = 3");
    }

    @Test
    void operationsCatalogResource() {
        String json = readResource("calc://operations");

        assertThat(json)
                .contains("\"recordFormat\" : \"<a> <symbol> <b> = <result>\"")
                .contains("7 / -2 = -3")
                .contains("7 - -2 = 9")
                .contains("DIVISION_BY_ZERO")
                .contains("ARITHMETIC_OVERFLOW");
    }

    @Test
    @DisplayName("history://{name}/entries reads a named history")
    void historyEntriesTemplate() {
        call("add", Map.of("a", 1, "b", 2));
        call("switchHistory", Map.of("historyName", "second"));

        String json = readTemplate("history://default/entries");

        assertThat(json).contains("1 + 2 = 3");
    }

    @Test
    void historyEntriesTemplate_unknownName() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> readTemplate("history://missing/entries"));
        assertEquals("History not found: missing", e.getMessage());
    }

    // ========== Prompts ==========

    @Test
    @DisplayName("prompt without historyName summarises the active history")
    void summarizePrompt_activeHistory() {
        call("add", Map.of("a", 1, "b", 2));
        call("divide", Map.of("a", 7, "b", 2));

        McpSchema.GetPromptResult result = getPrompt(Map.of("count", "1"));

        assertEquals("Recent calculations in default", result.description());
        assertThat(promptText(result)).contains("7 / 2 = 3").doesNotContain("1 + 2 = 3");
    }

    @Test
    @DisplayName("prompt with historyName summarises that history")
    void summarizePrompt_namedHistory() {
        call("add", Map.of("a", 1, "b", 2));
        call("switchHistory", Map.of("historyName", "second"));
        call("subtract", Map.of("a", 5, "b", 8));

        McpSchema.GetPromptResult result = getPrompt(Map.of("historyName", "default"));

        assertEquals("Recent calculations in default", result.description());
        assertThat(promptText(result)).contains("1 + 2 = 3").doesNotContain("5 - 8 = -3");
    }

    @Test
    @DisplayName("prompt rejects unknown and blank history names like the tools do")
    void summarizePrompt_invalidHistoryName() {
        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
                () -> getPrompt(Map.of("historyName", "nope")));
        assertEquals("History not found: nope", unknown.getMessage());
        assertThrows(IllegalArgumentException.class, () -> getPrompt(Map.of("historyName", "  ")));
        assertThrows(IllegalArgumentException.class, () -> getPrompt(Map.of("count", "lots")));
    }

    // ========== Completions ==========

    @Test
    @DisplayName("historyName completion filters by prefix and returns at most 5")
    void historyNameCompletion() {
        for (int i = 1; i <= 7; i++) {
            call("switchHistory", Map.of("historyName", "session-" + i));
        }

        List<String> sessions = complete("historyName", "SESS");
        List<String> defaults = complete("historyName", "de");

        assertEquals(5, sessions.size());
        assertThat(sessions).allMatch(n -> n.startsWith("session-"));
        assertEquals(List.of("default"), defaults);
    }

    @Test
    void completion_otherArgument_isEmpty() {
        assertTrue(complete("count", "1").isEmpty());
    }

    private McpSchema.CallToolResult call(String name, Map<String, Object> args) {
        McpStatelessServerFeatures.SyncToolSpecification spec = tools.stream()
                .filter(t -> t.tool().name().equals(name))
                .findFirst()
                .orElseThrow();
        return spec.callHandler().apply(McpTransportContext.EMPTY,
                new McpSchema.CallToolRequest(name, new HashMap<>(args)));
    }

    private String readResource(String uri) {
        McpStatelessServerFeatures.SyncResourceSpecification spec = config.staticResources(histories).stream()
                .filter(r -> r.resource().uri().equals(uri))
                .findFirst()
                .orElseThrow();
        return resourceText(spec.readHandler().apply(McpTransportContext.EMPTY, new McpSchema.ReadResourceRequest(uri)));
    }

    private String readTemplate(String uri) {
        McpStatelessServerFeatures.SyncResourceTemplateSpecification spec =
                config.resourceTemplates(histories).get(0);
        return resourceText(spec.readHandler().apply(McpTransportContext.EMPTY, new McpSchema.ReadResourceRequest(uri)));
    }

    private McpSchema.GetPromptResult getPrompt(Map<String, Object> args) {
        McpStatelessServerFeatures.SyncPromptSpecification spec = config.prompts(histories).get(0);
        return spec.promptHandler().apply(McpTransportContext.EMPTY,
                new McpSchema.GetPromptRequest("summarize-recent-calculations", new HashMap<>(args)));
    }

    private List<String> complete(String argument, String partial) {
        McpStatelessServerFeatures.SyncCompletionSpecification spec = config.completions(histories).get(0);
        McpSchema.CompleteRequest req = new McpSchema.CompleteRequest(
                new McpSchema.PromptReference("summarize-recent-calculations"),
                new McpSchema.CompleteRequest.CompleteArgument(argument, partial));
        return spec.completionHandler().apply(McpTransportContext.EMPTY, req).completion().values();
    }

    private static String resourceText(McpSchema.ReadResourceResult result) {
        return ((McpSchema.TextResourceContents) result.contents().get(0)).text();
    }

    private static String promptText(McpSchema.GetPromptResult result) {
        return ((McpSchema.TextContent) result.messages().get(0).content()).text();
    }

    private static String text(McpSchema.CallToolResult result) {
        return ((McpSchema.TextContent) result.content().get(0)).text();
    }
}
