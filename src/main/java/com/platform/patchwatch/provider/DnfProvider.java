package com.platform.patchwatch.provider;

import org.springframework.stereotype.Component;

@Component
public class DnfProvider extends RpmPackageProvider {

    public DnfProvider() {
        super("dnf");
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.DNF;
    }
}
