package com.platform.patchwatch.api;

import com.platform.patchwatch.provider.ProviderInfo;
import com.platform.patchwatch.provider.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * What each provider runs under sudo, for preparing sudoers on managed hosts.
 */
@RestController
@RequestMapping("/api/providers")
@RequiredArgsConstructor
public class ProviderController {

    private final ProviderRegistry providerRegistry;

    @GetMapping
    public ResponseEntity<List<ProviderInfo>> getProviders() {
        return ResponseEntity.ok(providerRegistry.describe());
    }
}
