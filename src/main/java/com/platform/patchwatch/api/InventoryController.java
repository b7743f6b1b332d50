package com.platform.patchwatch.api;

import com.platform.patchwatch.inventory.InventoryService;
import com.platform.patchwatch.model.HostSelection;
import com.platform.patchwatch.model.HostView;
import com.platform.patchwatch.model.OperationReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for fleet operations. Each call blocks until every selected host
 * has a result.
 */
@Slf4j
@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryService inventoryService;

    @GetMapping("/hosts")
    public ResponseEntity<List<HostView>> getHosts() {
        return ResponseEntity.ok(inventoryService.hosts());
    }

    @GetMapping("/hosts/{name}")
    public ResponseEntity<HostView> getHost(@PathVariable String name) {
        return ResponseEntity.ok(inventoryService.host(name));
    }

    @PostMapping("/discover")
    public ResponseEntity<OperationReport> discover(@Valid @RequestBody(required = false) HostSelectionRequest request) {
        return ResponseEntity.ok(inventoryService.discover(selection(request)));
    }

    @PostMapping("/refresh")
    public ResponseEntity<OperationReport> refresh(@Valid @RequestBody(required = false) HostSelectionRequest request) {
        boolean sync = request != null && request.sync();
        return ResponseEntity.ok(inventoryService.refresh(selection(request), sync));
    }

    @PostMapping("/ping")
    public ResponseEntity<OperationReport> ping(@Valid @RequestBody(required = false) HostSelectionRequest request) {
        return ResponseEntity.ok(inventoryService.ping(selection(request)));
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        int cancelled = inventoryService.cancel();
        log.info("Cancel requested via API, {} operation(s) affected", cancelled);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    private static HostSelection selection(HostSelectionRequest request) {
        return request == null ? HostSelection.allHosts() : request.toSelection();
    }
}
