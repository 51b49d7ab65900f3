package com.fhi.libraries.app_unittest.live;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

import com.fhi.libraries.app_unittest.exception.ReadinessTimeoutException;

import lombok.extern.slf4j.Slf4j;


/**
 * Waits until a live endpoint accepts TCP connections.
 *
 * <p>Opens raw connections, closing each one right away, until one succeeds or the
 * readiness timeout elapses. Stops early if the server it waits for has already died.</p>
 */
@Slf4j
public class ReadinessProbe
{
    private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(1);

    private final SuiteConfig config;

    public ReadinessProbe(SuiteConfig config)
    {   this.config = config;
    }

    /**
     * @throws ReadinessTimeoutException if nothing accepted a connection in time, or
     *         {@code server} stopped before it did
     */
    public void await(LiveServer server)
    {
        String host     = config.connectHost();
        int    port     = config.getPort();
        long   deadline = System.nanoTime() + config.getReadinessTimeout().toNanos();
        int    attempts = 0;
        IOException lastFailure = null;

        while (true)
        {   if (server != null && !server.isRunning())
            {   throw ReadinessTimeoutException.serverFailed(config.getHost(), port, server.getFailure());
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0)
            {   throw ReadinessTimeoutException.timedOut(config.getHost(), port, config.getReadinessTimeout(), lastFailure);
            }

            attempts++;
            lastFailure = tryConnect(host, port, connectTimeoutMillis(remaining));
            if (lastFailure == null)
            {   log.debug("{}:{} accepted a connection after {} attempt(s)", host, port, attempts);
                return;
            }

            sleep(Math.min(config.getPollInterval().toNanos(), Math.max(0, deadline - System.nanoTime())));
        }
    }

    /**
     * @return null if the connection was accepted, the failure otherwise
     */
    private static IOException tryConnect(String host, int port, int timeoutMillis)
    {
        try (Socket socket = new Socket())
        {   socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            return null;
        }
        catch (IOException e)
        {   return e;
        }
    }

    private static int connectTimeoutMillis(long remainingNanos)
    {   long millis = Math.min(Duration.ofNanos(remainingNanos).toMillis(), MAX_CONNECT_TIMEOUT.toMillis());
        return (int) Math.max(1, millis);
    }

    private static void sleep(long nanos)
    {
        if (nanos <= 0) return;
        try
        {   Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
        }
        catch (InterruptedException e)
        {   Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the live endpoint", e);
        }
    }
}
