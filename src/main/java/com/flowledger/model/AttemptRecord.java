package com.flowledger.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One attempt boundary as handed to the run ledger: the attempt row to append
 * plus the run state it moves the run into. Both are written as one unit.
 */
@Value
@Builder
public class AttemptRecord {

    int attemptNumber;
    AttemptStatus status;
    String errorMessage;
    @Builder.Default
    List<StepTrace> stepTrace = List.of();
    Instant executedAt;

    /** RUNNING when another attempt follows. */
    RunStatus runStatus;
    String deadLetterReason;
}
