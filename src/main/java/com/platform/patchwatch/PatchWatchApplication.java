package com.platform.patchwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Patch status aggregation for SSH-managed Unix hosts.
 */
@SpringBootApplication
public class PatchWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatchWatchApplication.class, args);
    }
}
