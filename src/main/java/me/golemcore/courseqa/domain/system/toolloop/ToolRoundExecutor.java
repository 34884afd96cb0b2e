package me.golemcore.courseqa.domain.system.toolloop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.model.ContentBlock;
import me.golemcore.courseqa.domain.service.ToolDispatcher;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes the tool requests of one LLM response through a
 * {@link ToolDispatcher}.
 *
 * <p>
 * Requests run sequentially in the order the LLM issued them. The first tool
 * that throws ends the round: its error becomes the last result and the
 * remaining requests are not attempted.
 */
@Slf4j
public class ToolRoundExecutor {

    static final String ERROR_PREFIX = "Error executing tool: ";

    public ToolRoundOutcome execute(List<ContentBlock.ToolUse> toolUses, ToolDispatcher dispatcher) {
        List<ContentBlock.ToolResult> results = new ArrayList<>();
        int executions = 0;

        for (ContentBlock.ToolUse toolUse : toolUses) {
            executions++;
            try {
                String output = dispatcher.execute(toolUse.name(), toolUse.input());
                results.add(ContentBlock.ToolResult.success(toolUse.id(), output));
            } catch (Exception e) {
                log.warn("[ToolLoop] Tool '{}' failed: {}", toolUse.name(), e.getMessage());
                results.add(ContentBlock.ToolResult.failure(toolUse.id(), ERROR_PREFIX + describe(e)));
                return new ToolRoundOutcome(results, executions, true);
            }
        }

        return new ToolRoundOutcome(results, executions, false);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
