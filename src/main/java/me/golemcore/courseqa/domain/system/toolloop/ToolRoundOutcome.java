package me.golemcore.courseqa.domain.system.toolloop;

import me.golemcore.courseqa.domain.model.ContentBlock;

import java.util.List;

/**
 * Results collected while executing the tool requests of one LLM response.
 *
 * @param results
 *            one result per attempted tool call, in request order
 * @param executions
 *            number of tool calls attempted
 * @param failed
 *            whether the round stopped on a tool exception
 */
public record ToolRoundOutcome(List<ContentBlock.ToolResult> results, int executions, boolean failed) {

    public ToolRoundOutcome {
        results = List.copyOf(results);
    }
}
