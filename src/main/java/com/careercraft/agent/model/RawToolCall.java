package com.careercraft.agent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tool call exactly as the model client handed it over, before validation.
 * Any field may be missing; {@code args} may be a map, a JSON string, or junk.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawToolCall {

    private String name;
    private Object args;
    private String id;
    private String type;
}
