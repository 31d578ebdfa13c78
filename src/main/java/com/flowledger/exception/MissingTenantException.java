package com.flowledger.exception;

public class MissingTenantException extends RuntimeException {

    public MissingTenantException() {
        super("Missing X-Tenant-Id header");
    }
}
