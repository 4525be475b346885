package com.careercraft.agent.control;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a governor check. When {@link #isExceeded()} the reason names the
 * ceiling that was hit and the suggestion tells the user how to proceed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LoopLimitCheck {

    public enum Ceiling { AGENT_SWITCHES, TOOL_CALLS_PER_AGENT, CLARIFICATION_ROUNDS }

    private static final LoopLimitCheck WITHIN_LIMITS = new LoopLimitCheck(false, null, null, null);

    boolean exceeded;
    Ceiling ceiling;
    String reason;
    String suggestion;

    public static LoopLimitCheck withinLimits() {
        return WITHIN_LIMITS;
    }

    public static LoopLimitCheck exceeded(Ceiling ceiling, String reason, String suggestion) {
        return new LoopLimitCheck(true, ceiling, reason, suggestion);
    }

    /** User-facing text: reason followed by suggestion */
    public String message() {
        return exceeded ? reason + ". " + suggestion : "";
    }
}
