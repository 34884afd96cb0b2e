package me.golemcore.courseqa.domain.system.toolloop;

import me.golemcore.courseqa.domain.model.LlmRequest;
import me.golemcore.courseqa.domain.model.LlmResponse;
import me.golemcore.courseqa.domain.model.Message;
import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.domain.service.ToolDispatcher;
import me.golemcore.courseqa.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Tool loop orchestrator (single-turn internal loop).
 *
 * <p>
 * Contract: 1) LLM returns tool-use requests, 2) tools executed, 3) LLM called
 * again with the results, repeated for at most {@code maxRounds} rounds. The
 * request that follows the last allowed round never offers tools, so the LLM
 * has to answer. A round in which a tool throws is reported to the LLM as an
 * error result and ends the loop after exactly one more tool-less call.
 *
 * <p>
 * LLM failures are not caught: they propagate to the caller unchanged. Holds no
 * per-turn state in fields, so one instance serves concurrent turns.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    public static final String FALLBACK_ANSWER = "I'm sorry, I wasn't able to generate a response. Please try again.";

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private final LlmPort llmPort;
    private final ToolRoundExecutor toolRoundExecutor;
    private final SystemPrompt systemPrompt;
    private final int maxRounds;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolRoundExecutor toolRoundExecutor, SystemPrompt systemPrompt,
            int maxRounds) {
        if (maxRounds < 0) {
            throw new IllegalArgumentException("maxRounds must not be negative: " + maxRounds);
        }
        this.llmPort = llmPort;
        this.toolRoundExecutor = toolRoundExecutor;
        this.systemPrompt = systemPrompt;
        this.maxRounds = maxRounds;
    }

    @Override
    public ToolLoopTurnResult processTurn(String query, String history, List<ToolDefinition> tools,
            ToolDispatcher dispatcher) {
        String system = systemPrompt.render(history);
        boolean offerTools = tools != null && !tools.isEmpty();

        List<Message> messages = new ArrayList<>();
        messages.add(Message.user(query));

        // 1) Initial LLM call
        LlmResponse response = callLlm(buildRequest(system, messages, offerTools ? tools : null));
        int llmCalls = 1;
        int toolExecutions = 0;
        boolean toolFailure = false;

        for (int round = 0; round < maxRounds; round++) {
            if (response == null || !response.isToolUse() || dispatcher == null) {
                break;
            }

            // 2) Echo the assistant turn, then execute its tool requests
            messages.add(Message.assistant(response.getContent()));
            ToolRoundOutcome outcome = toolRoundExecutor.execute(response.getToolUses(), dispatcher);
            toolExecutions += outcome.executions();
            if (!outcome.results().isEmpty()) {
                messages.add(Message.toolResults(outcome.results()));
            }
            toolFailure = outcome.failed();

            // 3) Follow-up call; the last allowed round and failed rounds get no tools
            boolean moreRoundsAllowed = round < maxRounds - 1;
            boolean toolsOnFollowUp = offerTools && !outcome.failed() && moreRoundsAllowed;
            log.debug("[ToolLoop] round {} executed {} tool(s), failed={}, tools on follow-up={}",
                    round, outcome.executions(), outcome.failed(), toolsOnFollowUp);

            response = callLlm(buildRequest(system, messages, toolsOnFollowUp ? tools : null));
            llmCalls++;

            if (outcome.failed()) {
                break;
            }
        }

        String answer = extractAnswer(response);
        log.debug("[ToolLoop] turn finished: model={}, llmCalls={}, toolExecutions={}, toolFailure={}",
                response != null ? response.getModel() : null, llmCalls, toolExecutions, toolFailure);
        return new ToolLoopTurnResult(answer, llmCalls, toolExecutions, toolFailure);
    }

    private LlmRequest buildRequest(String system, List<Message> messages, List<ToolDefinition> tools) {
        LlmRequest.LlmRequestBuilder builder = LlmRequest.builder()
                .systemPrompt(system)
                .messages(List.copyOf(messages));
        if (tools != null) {
            builder.tools(List.copyOf(tools)).toolChoice(LlmRequest.ToolChoice.AUTO);
        }
        return builder.build();
    }

    private LlmResponse callLlm(LlmRequest request) {
        try {
            return llmPort.chat(request).join();
        } catch (CompletionException e) {
            // Surface the provider's own exception rather than the future wrapper
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private String extractAnswer(LlmResponse response) {
        if (response == null) {
            return FALLBACK_ANSWER;
        }
        return response.getFirstText()
                .filter(text -> !text.isEmpty())
                .orElseGet(() -> {
                    log.warn("[ToolLoop] Final response has no text (stopReason={})",
                            response.getStopReason());
                    return FALLBACK_ANSWER;
                });
    }
}
