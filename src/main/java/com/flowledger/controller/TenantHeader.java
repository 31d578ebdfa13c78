package com.flowledger.controller;

import com.flowledger.exception.MissingTenantException;

/**
 * Every endpoint is tenant-scoped through the X-Tenant-Id header, set by the
 * gateway after authentication. Authorization happens before this service.
 */
final class TenantHeader {

    static final String NAME = "X-Tenant-Id";

    private TenantHeader() {
    }

    static String require(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new MissingTenantException();
        }
        return tenantId.trim();
    }
}
