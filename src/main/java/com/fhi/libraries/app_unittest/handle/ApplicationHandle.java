package com.fhi.libraries.app_unittest.handle;

import java.util.Map;

/**
 * A constructed, configured instance of the application under test.
 *
 * <p>The harness treats it as opaque and only relies on the three capabilities below.
 * Whoever provisions a handle disposes of it.</p>
 *
 * @param <C> the type of simulated client this application opens
 */
public interface ApplicationHandle<C extends ClientHandle>
{
    /** Configuration key of the address a live endpoint binds to. */
    String CONFIG_HOST = "HOST";

    /** Configuration key of the port a live endpoint binds to. */
    String CONFIG_PORT = "PORT";

    /**
     * Opens a simulated client bound to this application. The client is open on return
     * and released by {@link ClientHandle#close()}.
     *
     * @param useCookies whether the client keeps cookies between requests
     * @param options    additional client construction options, never null
     */
    C openClient(boolean useCookies, Map<String, Object> options);

    /**
     * Serves the application on {@code host:port} with automatic reload disabled.
     * Blocks for as long as the application serves.
     */
    void serve(String host, int port);

    /**
     * Returns the application configuration. May contain {@link #CONFIG_HOST} and
     * {@link #CONFIG_PORT}.
     */
    Map<String, Object> getConfig();
}
