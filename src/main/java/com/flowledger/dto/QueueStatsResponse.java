package com.flowledger.dto;

import lombok.*;

/** Per-tenant job counts for the QUEUED execution mode. */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class QueueStatsResponse {
    private long pending;
    private long leased;
    private long expiredLeases;
    private long completed;
    private long failed;
}
