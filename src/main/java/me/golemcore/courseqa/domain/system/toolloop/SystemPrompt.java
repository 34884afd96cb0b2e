package me.golemcore.courseqa.domain.system.toolloop;

/**
 * Fixed assistant instructions, created once at startup.
 *
 * @param instructions
 *            base instruction text sent as the system prompt
 */
public record SystemPrompt(String instructions) {

    private static final String HISTORY_HEADER = "\n\nPrevious conversation:\n";

    public SystemPrompt {
        if (instructions == null || instructions.isBlank()) {
            throw new IllegalArgumentException("System prompt instructions must not be blank");
        }
    }

    /**
     * Returns the instructions, followed by the previous conversation when one
     * is given.
     */
    public String render(String history) {
        if (history == null || history.isBlank()) {
            return instructions;
        }
        return instructions + HISTORY_HEADER + history;
    }
}
