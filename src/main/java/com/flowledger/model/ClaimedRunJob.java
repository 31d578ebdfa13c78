package com.flowledger.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/** What a worker gets back from a claim: enough to load the run and finish the job. */
@Getter
@AllArgsConstructor
@ToString
public class ClaimedRunJob {
    private final UUID jobId;
    private final String tenantId;
    private final UUID runId;
    private final String leaseToken;
}
