package com.flowledger.model.step;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Appends a message to the observability sink. No other side effect.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class LogMessageStep implements Step {

    @JsonProperty("message")
    private final String message;

    @JsonCreator
    public LogMessageStep(@JsonProperty("message") String message) {
        this.message = message;
    }

    @Override
    public StepType getType() {
        return StepType.LOG_MESSAGE;
    }
}
