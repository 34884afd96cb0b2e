package me.golemcore.courseqa.domain.system.toolloop;

import me.golemcore.courseqa.domain.model.ContentBlock;
import me.golemcore.courseqa.domain.model.LlmRequest;
import me.golemcore.courseqa.domain.model.LlmResponse;
import me.golemcore.courseqa.domain.model.Message;
import me.golemcore.courseqa.domain.model.StopReason;
import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.domain.service.ToolDispatcher;
import me.golemcore.courseqa.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolLoopSystemTest {

    private static final String INSTRUCTIONS = "You answer questions about courses.";
    private static final String QUERY = "What is covered in lesson 1?";
    private static final String SEARCH = "search_course_content";
    private static final String OUTLINE = "get_course_outline";
    private static final String FINAL_ANSWER = "Lesson 1 covers the basics.";

    private static final List<ToolDefinition> TOOLS = List.of(
            ToolDefinition.builder().name(SEARCH).description("search").inputSchema(Map.of("type", "object"))
                    .build(),
            ToolDefinition.builder().name(OUTLINE).description("outline").inputSchema(Map.of("type", "object"))
                    .build());

    @Mock
    private LlmPort llmPort;

    @Mock
    private ToolDispatcher dispatcher;

    private DefaultToolLoopSystem system;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        system = newSystem(2);
    }

    private DefaultToolLoopSystem newSystem(int maxRounds) {
        return new DefaultToolLoopSystem(llmPort, new ToolRoundExecutor(), new SystemPrompt(INSTRUCTIONS),
                maxRounds);
    }

    private static CompletableFuture<LlmResponse> textResponse(String text) {
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .stopReason(StopReason.TERMINAL)
                .content(List.of(new ContentBlock.Text(text)))
                .build());
    }

    private static CompletableFuture<LlmResponse> toolUseResponse(ContentBlock... blocks) {
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .stopReason(StopReason.TOOL_USE)
                .content(List.of(blocks))
                .build());
    }

    private static ContentBlock.ToolUse searchCall(String id, String query) {
        return new ContentBlock.ToolUse(id, SEARCH, Map.of("query", query));
    }

    private List<LlmRequest> captureRequests(int expectedCalls) {
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(expectedCalls)).chat(captor.capture());
        return captor.getAllValues();
    }

    // ===== direct answers =====

    @Test
    void shouldReturnDirectAnswerWithSingleCall() {
        when(llmPort.chat(any())).thenReturn(textResponse("Paris"));

        ToolLoopTurnResult result = system.processTurn(QUERY, null, null, null);

        assertEquals("Paris", result.answer());
        assertEquals(1, result.llmCalls());
        assertEquals(0, result.toolExecutions());
        assertFalse(result.toolFailure());

        LlmRequest request = captureRequests(1).get(0);
        assertEquals(INSTRUCTIONS, request.getSystemPrompt());
        assertEquals(1, request.getMessages().size());
        Message first = request.getMessages().get(0);
        assertTrue(first.isUserMessage());
        assertEquals(List.of(new ContentBlock.Text(QUERY)), first.getContent());
        assertFalse(request.hasTools());
        assertEquals(LlmRequest.ToolChoice.NONE, request.getToolChoice());
    }

    @Test
    void shouldAppendHistoryToSystemPrompt() {
        when(llmPort.chat(any())).thenReturn(textResponse("ok"));

        system.generate(QUERY, "User: hi\nAssistant: hello", null, null);

        LlmRequest request = captureRequests(1).get(0);
        assertEquals(INSTRUCTIONS + "\n\nPrevious conversation:\nUser: hi\nAssistant: hello",
                request.getSystemPrompt());
    }

    @Test
    void shouldIgnoreBlankHistory() {
        when(llmPort.chat(any())).thenReturn(textResponse("ok"));

        system.generate(QUERY, "  ", null, null);

        assertEquals(INSTRUCTIONS, captureRequests(1).get(0).getSystemPrompt());
    }

    @Test
    void shouldOfferToolsWithAutoChoiceOnFirstCall() {
        when(llmPort.chat(any())).thenReturn(textResponse("General knowledge answer"));

        String answer = system.generate(QUERY, null, TOOLS, dispatcher);

        assertEquals("General knowledge answer", answer);
        LlmRequest request = captureRequests(1).get(0);
        assertEquals(TOOLS, request.getTools());
        assertEquals(LlmRequest.ToolChoice.AUTO, request.getToolChoice());
        verify(dispatcher, never()).execute(any(), any());
    }

    @Test
    void shouldNotOfferToolsWhenDefinitionListEmpty() {
        when(llmPort.chat(any())).thenReturn(textResponse("ok"));

        system.generate(QUERY, null, List.of(), dispatcher);

        assertFalse(captureRequests(1).get(0).hasTools());
    }

    // ===== tool rounds =====

    @Test
    void shouldExecuteToolAndSendResultBack() {
        ContentBlock.ToolUse call = searchCall("toolu_1", "lesson 1");
        when(llmPort.chat(any()))
                .thenReturn(toolUseResponse(new ContentBlock.Text("Let me search."), call))
                .thenReturn(textResponse(FINAL_ANSWER));
        when(dispatcher.execute(SEARCH, Map.of("query", "lesson 1"))).thenReturn("[Intro - Lesson 1]\ncontent");

        ToolLoopTurnResult result = system.processTurn(QUERY, null, TOOLS, dispatcher);

        assertEquals(FINAL_ANSWER, result.answer());
        assertEquals(2, result.llmCalls());
        assertEquals(1, result.toolExecutions());
        assertFalse(result.toolFailure());

        LlmRequest followUp = captureRequests(2).get(1);
        List<Message> messages = followUp.getMessages();
        assertEquals(3, messages.size());
        assertTrue(messages.get(1).isAssistantMessage());
        assertEquals(List.of(new ContentBlock.Text("Let me search."), call), messages.get(1).getContent());
        assertTrue(messages.get(2).isUserMessage());
        assertEquals(List.of(ContentBlock.ToolResult.success("toolu_1", "[Intro - Lesson 1]\ncontent")),
                messages.get(2).getContent());
    }

    @Test
    void shouldKeepToolsOnFollowUpWhileRoundsRemain() {
        when(llmPort.chat(any()))
                .thenReturn(toolUseResponse(searchCall("t1", "a")))
                .thenReturn(textResponse(FINAL_ANSWER));
        when(dispatcher.execute(any(), anyMap())).thenReturn("result");

        system.generate(QUERY, null, TOOLS, dispatcher);

        LlmRequest followUp = captureRequests(2).get(1);
        assertEquals(TOOLS, followUp.getTools());
        assertEquals(LlmRequest.ToolChoice.AUTO, followUp.getToolChoice());
    }

    @Test
    void shouldDropToolsAfterLastAllowedRound() {
        when(llmPort.chat(any()))
                .thenReturn(toolUseResponse(new ContentBlock.ToolUse("t1", OUTLINE, Map.of("course_name", "MCP"))))
                .thenReturn(toolUseResponse(searchCall("t2", "b")))
                .thenReturn(textResponse(FINAL_ANSWER));
        when(dispatcher.execute(any(), anyMap())).thenReturn("result");

        ToolLoopTurnResult result = system.processTurn(QUERY, null, TOOLS, dispatcher);

        assertEquals(FINAL_ANSWER, result.answer());
        assertEquals(3, result.llmCalls());
        assertEquals(2, result.toolExecutions());

        List<LlmRequest> requests = captureRequests(3);
        assertTrue(requests.get(0).hasTools());
        assertTrue(requests.get(1).hasTools());
        assertFalse(requests.get(2).hasTools());
        assertEquals(LlmRequest.ToolChoice.NONE, requests.get(2).getToolChoice());
        assertEquals(5, requests.get(2).getMessages().size());
    }

    @Test
    void shouldStopAfterRoundBudgetAndFallBackWhenNoText() {
        when(llmPort.chat(any()))
                .thenReturn(toolUseResponse(searchCall("t1", "a")))
                .thenReturn(toolUseResponse(searchCall("t2", "b")))
                .thenReturn(toolUseResponse(searchCall("t3", "c")));
        when(dispatcher.execute(any(), anyMap())).thenReturn("result");

        ToolLoopTurnResult result = system.processTurn(QUERY, null, TOOLS, dispatcher);

        assertEquals(DefaultToolLoopSystem.FALLBACK_ANSWER, result.answer());
        assertEquals(3, result.llmCalls());
        assertEquals(2, result.toolExecutions());
        verify(dispatcher, times(2)).execute(eq(SEARCH), anyMap());
    }

    @Test
    void shouldHonourCustomRoundBudget() {
        system = newSystem(1);
        when(llmPort.chat(any()))
                .thenReturn(toolUseResponse(searchCall("t1", "a")))
                .thenReturn(toolUseResponse(searchCall("t2", "b")));
        when(dispatcher.execute(any(), anyMap())).thenReturn("result");

        ToolLoopTurnResult result = system.processTurn(QUERY, null, TOOLS, dispatcher);

        assertEquals(2, result.llmCalls());
        assertEquals(1, result.toolExecutions());
        assertFalse(captureRequests(2).get(1).hasTools());
    }

    @Test
    void shouldNeverExecuteToolsWithZeroRounds() {
        system = newSystem(0);
        when(llmPort.chat(any())).thenReturn(toolUseResponse(new ContentBlock.Text("partial"),
                searchCall("t1", "a")));

        ToolLoopTurnResult result = system.processTurn(QUERY, null, TOOLS, dispatcher);

        assertEquals("partial", result.answer());
        assertEquals(1, result.llmCalls());
        verify(dispatcher, never()).execute(any(), any());
    }

    @Test
    void shouldRejectNegativeRoundBudget() {
        assertThrows(IllegalArgumentException.class, () -> newSystem(-1));
    }

    @Test
    void shouldCombineSeveralToolResultsIntoOneMessage() {
        when(llmPort.chat(any()))
                .thenReturn(toolUseResponse(searchCall("t1", "a"), searchCall("t2", "b")))
                .thenReturn(textResponse(FINAL_ANSWER));
        when(dispatcher.execute(SEARCH, Map.of("query", "a"))).thenReturn("first");
        when(dispatcher.execute(SEARCH, Map.of("query", "b"))).thenReturn("second");

        ToolLoopTurnResult result = system.processTurn(QUERY, null, TOOLS, dispatcher);

        assertEquals(2, result.toolExecutions());
        Message toolResults = captureRequests(2).get(1).getMessages().get(2);
        assertEquals(List.of(
                ContentBlock.ToolResult.success("t1", "first"),
                ContentBlock.ToolResult.success("t2", "second")), toolResults.getContent());
    }

    // ===== tool failures =====

    @Test
    void shouldFinalizeWithoutToolsAfterToolFailure() {
        when(llmPort.chat(any()))
                .thenReturn(toolUseResponse(searchCall("t1", "a")))
                .thenReturn(toolUseResponse(searchCall("t2", "b")));
        when(dispatcher.execute(any(), anyMap())).thenThrow(new IllegalStateException("DB down"));

        ToolLoopTurnResult result = system.processTurn(QUERY, null, TOOLS, dispatcher);

        assertEquals(DefaultToolLoopSystem.FALLBACK_ANSWER, result.answer());
        assertEquals(2, result.llmCalls());
        assertEquals(1, result.toolExecutions());
        assertTrue(result.toolFailure());

        LlmRequest followUp = captureRequests(2).get(1);
        assertFalse(followUp.hasTools());
        assertEquals(List.of(ContentBlock.ToolResult.failure("t1", "Error executing tool: DB down")),
                followUp.getMessages().get(2).getContent());
    }

    @Test
    void shouldSkipRemainingCallsInFailedRound() {
        when(llmPort.chat(any()))
                .thenReturn(toolUseResponse(searchCall("t1", "a"), searchCall("t2", "b")))
                .thenReturn(textResponse("Sorry, the search failed."));
        when(dispatcher.execute(SEARCH, Map.of("query", "a"))).thenThrow(new IllegalArgumentException("bad"));

        ToolLoopTurnResult result = system.processTurn(QUERY, null, TOOLS, dispatcher);

        assertEquals("Sorry, the search failed.", result.answer());
        verify(dispatcher, never()).execute(SEARCH, Map.of("query", "b"));
        Message toolResults = captureRequests(2).get(1).getMessages().get(2);
        assertEquals(1, toolResults.getContent().size());
    }

    @Test
    void shouldNotFlagUnknownToolAsFailure() {
        ToolDispatcher emptyDispatcher = new ToolDispatcher();
        when(llmPort.chat(any()))
                .thenReturn(toolUseResponse(new ContentBlock.ToolUse("t1", "missing_tool", Map.of())))
                .thenReturn(textResponse(FINAL_ANSWER));

        ToolLoopTurnResult result = system.processTurn(QUERY, null, TOOLS, emptyDispatcher);

        assertEquals(FINAL_ANSWER, result.answer());
        assertFalse(result.toolFailure());
        LlmRequest followUp = captureRequests(2).get(1);
        assertTrue(followUp.hasTools());
        assertEquals(List.of(ContentBlock.ToolResult.success("t1", "Tool 'missing_tool' not found")),
                followUp.getMessages().get(2).getContent());
    }

    // ===== termination edge cases =====

    @Test
    void shouldNotExecuteToolsWithoutDispatcher() {
        when(llmPort.chat(any())).thenReturn(toolUseResponse(new ContentBlock.Text("I would search"),
                searchCall("t1", "a")));

        ToolLoopTurnResult result = system.processTurn(QUERY, null, TOOLS, null);

        assertEquals("I would search", result.answer());
        assertEquals(1, result.llmCalls());
    }

    @Test
    void shouldFallBackWhenFinalTextEmpty() {
        when(llmPort.chat(any())).thenReturn(textResponse(""));

        assertEquals(DefaultToolLoopSystem.FALLBACK_ANSWER, system.generate(QUERY, null, null, null));
    }

    @Test
    void shouldFallBackWhenLlmReturnsNull() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(null));

        assertEquals(DefaultToolLoopSystem.FALLBACK_ANSWER, system.generate(QUERY, null, TOOLS, dispatcher));
    }

    @Test
    void shouldNotContinueOnOtherStopReason() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(LlmResponse.builder()
                .stopReason(StopReason.OTHER)
                .content(List.of(new ContentBlock.Text("truncated"), searchCall("t1", "a")))
                .build()));

        ToolLoopTurnResult result = system.processTurn(QUERY, null, TOOLS, dispatcher);

        assertEquals("truncated", result.answer());
        verify(dispatcher, never()).execute(any(), any());
    }

    // ===== LLM failures =====

    @Test
    void shouldPropagateAsyncLlmFailureUnchanged() {
        IllegalStateException failure = new IllegalStateException("API down");
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(failure));

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> system.generate(QUERY, null, TOOLS, dispatcher));
        assertSame(failure, thrown);
    }

    @Test
    void shouldPropagateLlmFailureDuringFollowUp() {
        RuntimeException failure = new RuntimeException("overloaded");
        when(llmPort.chat(any()))
                .thenReturn(toolUseResponse(searchCall("t1", "a")))
                .thenReturn(CompletableFuture.failedFuture(failure));
        when(dispatcher.execute(any(), anyMap())).thenReturn("result");

        RuntimeException thrown = assertThrows(RuntimeException.class,
                () -> system.generate(QUERY, null, TOOLS, dispatcher));
        assertSame(failure, thrown);
    }
}
