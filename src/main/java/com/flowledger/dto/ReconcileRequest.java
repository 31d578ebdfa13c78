package com.flowledger.dto;

import lombok.*;

/**
 * Optional body of POST /workflows/runs/{runId}/abandon.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ReconcileRequest {
    private String reason;
}
