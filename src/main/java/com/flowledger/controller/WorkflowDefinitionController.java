package com.flowledger.controller;

import com.flowledger.dto.DefinitionRequest;
import com.flowledger.dto.DefinitionResponse;
import com.flowledger.service.WorkflowDefinitionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/workflows/definitions")
@RequiredArgsConstructor
public class WorkflowDefinitionController {

    private final WorkflowDefinitionService definitionService;

    @PutMapping("/{logicalName}")
    public ResponseEntity<DefinitionResponse> save(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId,
            @PathVariable String logicalName,
            @Valid @RequestBody DefinitionRequest request) {
        return ResponseEntity.ok(definitionService.save(TenantHeader.require(tenantId), logicalName, request));
    }

    @GetMapping
    public ResponseEntity<List<DefinitionResponse>> list(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId) {
        return ResponseEntity.ok(definitionService.list(TenantHeader.require(tenantId)));
    }

    @GetMapping("/{logicalName}")
    public ResponseEntity<DefinitionResponse> get(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId,
            @PathVariable String logicalName) {
        return ResponseEntity.ok(definitionService.get(TenantHeader.require(tenantId), logicalName));
    }

    @PatchMapping("/{logicalName}/toggle")
    public ResponseEntity<DefinitionResponse> toggle(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId,
            @PathVariable String logicalName) {
        return ResponseEntity.ok(definitionService.toggle(TenantHeader.require(tenantId), logicalName));
    }

    @DeleteMapping("/{logicalName}")
    public ResponseEntity<Void> delete(
            @RequestHeader(value = TenantHeader.NAME, required = false) String tenantId,
            @PathVariable String logicalName) {
        definitionService.delete(TenantHeader.require(tenantId), logicalName);
        return ResponseEntity.noContent().build();
    }
}
