package me.golemcore.courseqa.domain.system.toolloop;

/**
 * Outcome of one tool-loop turn.
 *
 * @param answer
 *            text returned to the caller, never {@code null}
 * @param llmCalls
 *            number of LLM requests issued
 * @param toolExecutions
 *            number of tool executions attempted, including failed ones
 * @param toolFailure
 *            whether a tool round ended on an execution error
 */
public record ToolLoopTurnResult(String answer, int llmCalls, int toolExecutions, boolean toolFailure) {
}
