package com.careercraft.agent.exception;

/**
 * Maps a caught failure onto the assistant-authored text the user sees.
 * Raw exception messages only reach the user for validation problems.
 */
public final class AgentErrorMessages {

    public static final String GENERIC =
            "I encountered an unexpected error while processing your request.";

    private AgentErrorMessages() {
    }

    public static String forException(Throwable error) {
        String text;
        if (error instanceof ToolArgumentException || error instanceof MissingUserIdException) {
            text = "I encountered a validation error: " + error.getMessage() + ".";
        } else if (error instanceof OperationTimeoutException timeout) {
            text = String.format("The %s operation took too long (over %d seconds).",
                    timeout.getOperation(), timeout.getTimeout().toSeconds());
        } else if (error instanceof LlmInvocationException) {
            text = "I'm having trouble connecting to the AI service.";
        } else if (error instanceof AgentException) {
            text = "I encountered an error: " + error.getMessage() + ".";
        } else {
            text = GENERIC;
        }
        return text + " Please try again.";
    }
}
