package com.fhi.libraries.app_unittest.live;

import java.time.Duration;
import java.util.Map;

import com.fhi.libraries.app_unittest.config.HarnessProperties;
import com.fhi.libraries.app_unittest.handle.ApplicationHandle;

import lombok.Getter;


/**
 * Where a live endpoint listens and how long to wait for it.
 * Built once per suite and held for its lifetime.
 */
@Getter
public class SuiteConfig
{
    private static final String WILDCARD_ADDRESS = "0.0.0.0";
    private static final String LOOPBACK_ADDRESS = "127.0.0.1";

    private final String   host;
    private final int      port;
    private final Duration readinessTimeout;
    private final Duration pollInterval;

    public SuiteConfig(String host, int port, Duration readinessTimeout, Duration pollInterval)
    {   this.host             = host;
        this.port             = port;
        this.readinessTimeout = readinessTimeout;
        this.pollInterval     = pollInterval;
    }

    /**
     * Reads {@code HOST} and {@code PORT} from the application configuration, falling back
     * to the {@code live.*} harness properties.
     *
     * @param readinessTimeout null for the configured default
     */
    public static SuiteConfig from(ApplicationHandle<?> app, Duration readinessTimeout)
    {
        HarnessProperties.Live defaults = HarnessProperties.get().getLive();
        Map<String, Object> config = app.getConfig();

        Object host = config == null ? null : config.get(ApplicationHandle.CONFIG_HOST);
        Object port = config == null ? null : config.get(ApplicationHandle.CONFIG_PORT);

        return new SuiteConfig(host == null ? defaults.getHost() : host.toString(),
                               port == null ? defaults.getPort() : toPort(port),
                               readinessTimeout == null ? defaults.getReadinessTimeout() : readinessTimeout,
                               defaults.getPollInterval());
    }

    /**
     * Base URL tests use to reach the endpoint, {@code http://{host}:{port}}.
     */
    public String serverUrl()
    {   return "http://" + connectHost() + ":" + port;
    }

    /**
     * The address clients connect to; loopback when the server binds every interface.
     */
    public String connectHost()
    {   return WILDCARD_ADDRESS.equals(host) ? LOOPBACK_ADDRESS : host;
    }

    public String address()
    {   return host + ":" + port;
    }

    private static int toPort(Object value)
    {
        if (value instanceof Number) return ((Number) value).intValue();
        try
        {   return Integer.parseInt(value.toString().trim());
        }
        catch (NumberFormatException e)
        {   throw new IllegalArgumentException("Configuration key " + ApplicationHandle.CONFIG_PORT
                                               + " is not a port number: " + value, e);
        }
    }

    @Override
    public String toString()
    {   return "SuiteConfig{" + address() + ", readinessTimeout=" + readinessTimeout + "}";
    }
}
