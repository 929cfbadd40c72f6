package com.vidnyan.causeway.domain.intervention;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A do-operation on one graph node.
 * Serialized with a {@code type} discriminator: {@code hard} or {@code soft}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = HardIntervention.class, name = "hard"),
    @JsonSubTypes.Type(value = SoftIntervention.class, name = "soft")
})
public interface Intervention {

    String node();

    /**
     * Assignment-style rendering, e.g. {@code x := 5} or {@code x := x * 1.5}.
     */
    String describe();
}
