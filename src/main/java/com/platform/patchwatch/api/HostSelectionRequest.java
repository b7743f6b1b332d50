package com.platform.patchwatch.api;

import com.platform.patchwatch.model.HostSelection;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Body of the operation endpoints. No hosts means every host.
 */
public record HostSelectionRequest(List<@NotBlank String> hosts, boolean sync) {

    public HostSelection toSelection() {
        return HostSelection.of(hosts);
    }
}
