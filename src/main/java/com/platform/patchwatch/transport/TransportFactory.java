package com.platform.patchwatch.transport;

import com.platform.patchwatch.model.HostView;

import java.time.Duration;

/**
 * Opens remote sessions. Implementations verify reachability and credentials on open.
 */
public interface TransportFactory {

    /**
     * @throws com.platform.patchwatch.error.ConnectionException when the host cannot be reached in time
     * @throws com.platform.patchwatch.error.AuthenticationException when credentials are rejected
     */
    TransportSession open(HostView host, Duration connectTimeout, Duration commandTimeout);

    /**
     * Sessions currently open across all callers.
     */
    int openSessions();
}
