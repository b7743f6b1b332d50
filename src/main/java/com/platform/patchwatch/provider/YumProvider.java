package com.platform.patchwatch.provider;

import org.springframework.stereotype.Component;

@Component
public class YumProvider extends RpmPackageProvider {

    public YumProvider() {
        super("yum");
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.YUM;
    }
}
