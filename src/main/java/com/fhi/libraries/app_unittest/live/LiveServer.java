package com.fhi.libraries.app_unittest.live;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fhi.libraries.app_unittest.exception.UsageException;
import com.fhi.libraries.app_unittest.handle.ApplicationHandle;

import lombok.extern.slf4j.Slf4j;


/**
 * An application served on a background daemon thread.
 *
 * <p>Servers are process-scoped: one per {@code host:port}, kept in a registry and never
 * stopped (the JVM reclaims the thread and socket on exit). A suite asking for an address
 * that already serves the same application reuses the server; asking for it with another
 * application is a {@link UsageException}. A server whose thread has ended is replaced.</p>
 */
@Slf4j
public final class LiveServer
{
    private static final Map<String, LiveServer> REGISTRY = new HashMap<>();

    private final ApplicationHandle<?> app;
    private final SuiteConfig          config;
    private final Thread               thread;
    private final AtomicBoolean        ready = new AtomicBoolean();

    private volatile boolean   running = true;
    private volatile Throwable failure;


    private LiveServer(ApplicationHandle<?> app, SuiteConfig config)
    {   this.app    = app;
        this.config = config;
        this.thread = new Thread(this::serve, "live-endpoint-" + config.address());
        this.thread.setDaemon(true);
    }

    /**
     * Returns the server for {@code config}'s address, starting one if there is none.
     *
     * @throws UsageException if the address already serves a different application
     */
    public static LiveServer obtain(ApplicationHandle<?> app, SuiteConfig config)
    {
        synchronized (REGISTRY)
        {   LiveServer existing = REGISTRY.get(config.address());
            if (existing != null && existing.isRunning())
            {   if (existing.app != app) throw UsageException.addressInUse(config.getHost(), config.getPort());
                log.debug("Reusing live endpoint {}", config.address());
                return existing;
            }

            LiveServer server = new LiveServer(app, config);
            REGISTRY.put(config.address(), server);
            server.thread.start();
            log.info("Started live endpoint {} on thread '{}'", config.serverUrl(), server.thread.getName());
            return server;
        }
    }

    /**
     * Blocks until the server accepts connections. Only the first call probes.
     *
     * @throws com.fhi.libraries.app_unittest.exception.ReadinessTimeoutException if it does not in time
     */
    public void awaitReady(ReadinessProbe probe)
    {
        if (ready.get()) return;
        probe.await(this);
        if (ready.compareAndSet(false, true))
        {   log.info("Live endpoint {} is ready", config.serverUrl());
        }
    }

    public ApplicationHandle<?> getApp()
    {   return app;
    }

    public SuiteConfig getConfig()
    {   return config;
    }

    public boolean isRunning()
    {   return running;
    }

    /**
     * What the serving thread died of; null while running or after a normal return.
     */
    public Throwable getFailure()
    {   return failure;
    }

    private void serve()
    {
        try
        {   app.serve(config.getHost(), config.getPort());
            log.info("Live endpoint {} stopped serving", config.address());
        }
        catch (Throwable t)
        {   failure = t;
            log.warn("Live endpoint {} failed: {}", config.address(), t.toString());
        }
        finally
        {   running = false;
        }
    }
}
