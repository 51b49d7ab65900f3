package com.fhi.libraries.app_unittest.testsupport;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import com.fhi.libraries.app_unittest.handle.ApplicationHandle;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory application for harness tests.
 *
 * <p>Every call is written to an {@link EventLog}. {@link #serve} really listens on the
 * given address and accepts (and immediately closes) connections until {@link #close()}.</p>
 */
@Slf4j
@Getter
@Setter
public class FakeApplication implements ApplicationHandle<FakeClient>, AutoCloseable
{
    private final String              name;
    private final EventLog            events;
    private final Map<String, Object> config        = new LinkedHashMap<>();
    private final AtomicInteger       clientCounter = new AtomicInteger();

    /** Thrown by {@link #openClient} when set. */
    private RuntimeException openClientFailure;
    /** Thrown by {@link #serve} instead of listening, when set. */
    private RuntimeException serveFailure;
    /** When true, {@link #serve} blocks without ever opening a socket. */
    private boolean          neverListen;

    private volatile ServerSocket serverSocket;
    private volatile boolean      closed;


    public FakeApplication(String name, EventLog events)
    {   this.name   = name;
        this.events = events;
    }

    public FakeApplication(String name)
    {   this(name, new EventLog());
    }

    public FakeApplication withConfig(String key, Object value)
    {   config.put(key, value);
        return this;
    }

    @Override
    public FakeClient openClient(boolean useCookies, Map<String, Object> options)
    {
        if (openClientFailure != null) throw openClientFailure;
        FakeClient client = new FakeClient(this, clientCounter.incrementAndGet(), useCookies, options);
        events.add("client" + client.getId() + ".open");
        return client;
    }

    @Override
    public void serve(String host, int port)
    {
        events.add("serve " + host + ":" + port);
        if (serveFailure != null) throw serveFailure;
        if (neverListen)
        {   sleepUntilClosed();
            return;
        }

        try (ServerSocket socket = new ServerSocket(port, 50, InetAddress.getByName(host)))
        {   serverSocket = socket;
            while (!closed)
            {   try (Socket accepted = socket.accept())
                {   log.trace("{} accepted {}", name, accepted.getRemoteSocketAddress());
                }
            }
        }
        catch (IOException e)
        {   if (!closed) throw new IllegalStateException(name + " could not serve on " + host + ":" + port, e);
        }
    }

    @Override
    public Map<String, Object> getConfig()
    {   return config;
    }

    @Override
    public void close()
    {
        closed = true;
        events.add(name + ".close");
        ServerSocket socket = serverSocket;
        if (socket != null)
        {   try
            {   socket.close();
            }
            catch (IOException e)
            {   log.debug("Closing server socket of {}: {}", name, e.toString());
            }
        }
    }

    private void sleepUntilClosed()
    {
        while (!closed)
        {   try
            {   Thread.sleep(20);
            }
            catch (InterruptedException e)
            {   Thread.currentThread().interrupt();
                return;
            }
        }
    }

    @Override
    public String toString()
    {   return "FakeApplication[" + name + "]";
    }
}
