package me.golemcore.courseqa.domain.system.toolloop;

import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.domain.service.ToolDispatcher;

import java.util.List;

/**
 * Executes the LLM -> tools -> LLM exchange for a single question.
 *
 * <p>
 * The exchange is bounded: at most {@code maxRounds} tool rounds run before the
 * LLM is forced to answer without tools.
 */
public interface ToolLoopSystem {

    /**
     * Runs one turn and reports how it went.
     *
     * @param query
     *            question sent as the first user message
     * @param history
     *            formatted previous conversation, or {@code null}
     * @param tools
     *            definitions offered to the LLM, or {@code null} for none
     * @param dispatcher
     *            executes requested tools, or {@code null} to disable tool use
     */
    ToolLoopTurnResult processTurn(String query, String history, List<ToolDefinition> tools,
            ToolDispatcher dispatcher);

    /**
     * Runs one turn and returns only the answer text.
     */
    default String generate(String query, String history, List<ToolDefinition> tools, ToolDispatcher dispatcher) {
        return processTurn(query, history, tools, dispatcher).answer();
    }
}
