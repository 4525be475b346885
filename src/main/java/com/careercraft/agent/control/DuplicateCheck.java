package com.careercraft.agent.control;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DuplicateCheck {

    private static final DuplicateCheck NOT_DUPLICATE = new DuplicateCheck(false, null, null);

    boolean duplicate;
    /** The earlier action this call repeats */
    CompletedAction previous;
    String reason;

    public static DuplicateCheck notDuplicate() {
        return NOT_DUPLICATE;
    }

    public static DuplicateCheck duplicateOf(CompletedAction previous, String reason) {
        return new DuplicateCheck(true, previous, reason);
    }
}
