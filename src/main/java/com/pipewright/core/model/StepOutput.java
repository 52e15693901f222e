package com.pipewright.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.io.Serializable;

/**
 * Step-specific output recorded on a {@link WorkRecord}.
 * <p>
 * Serialized with a {@code kind} discriminator so the stored JSON stays
 * self-describing across releases.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PlanOutput.class, name = "plan"),
        @JsonSubTypes.Type(value = ValidateOutput.class, name = "validate"),
        @JsonSubTypes.Type(value = CheckOutput.class, name = "check"),
        @JsonSubTypes.Type(value = ReviewOutput.class, name = "review"),
        @JsonSubTypes.Type(value = DocumentOutput.class, name = "document"),
        @JsonSubTypes.Type(value = ShipOutput.class, name = "ship"),
        @JsonSubTypes.Type(value = CleanupOutput.class, name = "cleanup"),
        @JsonSubTypes.Type(value = VerifyOutput.class, name = "verify")
})
public interface StepOutput extends Serializable {
}
