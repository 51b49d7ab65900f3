package com.fhi.libraries.app_unittest.spring;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;

import org.springframework.boot.ApplicationContextFactory;
import org.springframework.boot.Banner;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.mock.web.MockServletContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.context.WebApplicationContext;
import org.springframework.web.context.support.GenericWebApplicationContext;

import com.fhi.libraries.app_unittest.config.HarnessProperties;
import com.fhi.libraries.app_unittest.handle.ApplicationHandle;
import com.fhi.libraries.app_unittest.provision.ResourceConstructor;

import lombok.extern.slf4j.Slf4j;


/**
 * A Spring Boot application as seen by the harness.
 *
 * <p>Two contexts can exist, both started lazily:</p>
 * <ul>
 *   <li>the mock context, refreshed by the first {@link #openClient} on a mock servlet
 *       context (no server, no socket); clients are {@link MockMvcClient}s over it;</li>
 *   <li>the served context, started by {@link #serve} on an embedded server.</li>
 * </ul>
 *
 * <p>Properties given to the builder are passed as command line arguments, so they win
 * over the application's own {@code application.properties}.</p>
 */
@Slf4j
public class SpringApplicationHandle implements ApplicationHandle<MockMvcClient>, AutoCloseable
{
    private final Class<?>[]          sources;
    private final Map<String, String> properties;
    private final Map<String, Object> config;

    private ConfigurableApplicationContext          mockContext;
    private MockMvc                                 mockMvc;
    private volatile ConfigurableApplicationContext servedContext;
    private volatile boolean                        closed;


    private SpringApplicationHandle(Builder builder, Map<String, String> extraProperties)
    {
        this.sources    = builder.sources.clone();
        this.properties = new LinkedHashMap<>(builder.properties);
        this.properties.putAll(extraProperties);

        Map<String, Object> cfg = new LinkedHashMap<>(this.properties);
        if (builder.host != null) cfg.put(CONFIG_HOST, builder.host);
        if (builder.port != null) cfg.put(CONFIG_PORT, builder.port);
        this.config = Collections.unmodifiableMap(cfg);
    }

    public static Builder builder(Class<?>... sources)
    {   return new Builder(sources);
    }


    // -----------------------------------------
    // ApplicationHandle
    // -----------------------------------------

    @Override
    public MockMvcClient openClient(boolean useCookies, Map<String, Object> options)
    {   return new MockMvcClient(mockMvc(), useCookies, options);
    }

    /**
     * Starts the application on an embedded server bound to {@code host:port} and blocks
     * until its context is closed, e.g. by {@link #close()}.
     */
    @Override
    public void serve(String host, int port)
    {
        requireOpen();
        List<String> args = commandLine();
        args.add("--server.address=" + host);
        args.add("--server.port=" + port);
        args.add("--spring.devtools.restart.enabled=false");

        log.info("Serving {} on {}:{}", describe(), host, port);
        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(sources)
                .bannerMode(Banner.Mode.OFF)
                .run(args.toArray(new String[0]));
        servedContext = ctx;

        CountDownLatch stopped = new CountDownLatch(1);
        ctx.addApplicationListener(event ->
        {   if (event instanceof ContextClosedEvent) stopped.countDown();
        });
        if (closed) ctx.close();
        if (!ctx.isActive()) return;

        try
        {   stopped.await();
        }
        catch (InterruptedException e)
        {   Thread.currentThread().interrupt();
            log.debug("Serving thread of {} interrupted", describe());
        }
    }

    @Override
    public Map<String, Object> getConfig()
    {   return config;
    }


    // -----------------------------------------
    // Spring access
    // -----------------------------------------

    /**
     * The mock context, refreshed on first use.
     */
    public synchronized ConfigurableApplicationContext getApplicationContext()
    {
        requireOpen();
        if (mockContext == null)
        {   log.debug("Refreshing mock context of {}", describe());
            mockContext = new SpringApplicationBuilder(sources)
                    .bannerMode(Banner.Mode.OFF)
                    .contextFactory(ApplicationContextFactory.of(
                            () -> new GenericWebApplicationContext(new MockServletContext())))
                    .run(commandLine().toArray(new String[0]));
        }
        return mockContext;
    }

    public <T> T getBean(Class<T> type)
    {   return getApplicationContext().getBean(type);
    }

    /**
     * The value of {@code key} as the application sees it.
     */
    public String getProperty(String key)
    {   return getApplicationContext().getEnvironment().getProperty(key);
    }

    public boolean isClosed()
    {   return closed;
    }

    /**
     * Closes the served context, if any, then the mock context.
     */
    @Override
    public synchronized void close()
    {
        if (closed) return;
        closed = true;

        ConfigurableApplicationContext served = servedContext;
        if (served != null) served.close();
        if (mockContext != null) mockContext.close();
        log.debug("Closed {}", describe());
    }

    @Override
    public String toString()
    {   return "SpringApplicationHandle" + describe();
    }


    private synchronized MockMvc mockMvc()
    {
        if (mockMvc == null)
        {   mockMvc = MockMvcBuilders.webAppContextSetup((WebApplicationContext) getApplicationContext()).build();
        }
        return mockMvc;
    }

    private List<String> commandLine()
    {
        List<String> args = new ArrayList<>();
        properties.forEach((key, value) -> args.add("--" + key + "=" + value));
        return args;
    }

    private void requireOpen()
    {   if (closed) throw new IllegalStateException(this + " has been closed");
    }

    private String describe()
    {   return Arrays.stream(sources).map(Class::getSimpleName).toList().toString();
    }


    /**
     * Collects what is needed to build a {@link SpringApplicationHandle}.
     */
    public static final class Builder
    {
        private final Class<?>[]          sources;
        private final Map<String, String> properties = new LinkedHashMap<>();
        private String  host;
        private Integer port;
        private boolean isolateDataDirectory;
        private String  dataDirectoryProperty;

        private Builder(Class<?>... sources)
        {
            if (sources == null || sources.length == 0) throw new IllegalArgumentException("At least one source class is required");
            this.sources = sources.clone();

            HarnessProperties.App defaults = HarnessProperties.get().getApp();
            this.isolateDataDirectory  = defaults.isIsolateDataDirectory();
            this.dataDirectoryProperty = defaults.getDataDirectoryProperty();
        }

        public Builder property(String key, Object value)
        {   properties.put(Objects.requireNonNull(key, "key"), String.valueOf(value));
            return this;
        }

        /**
         * Address {@code HOST} a live endpoint binds to.
         */
        public Builder host(String host)
        {   this.host = host;
            return this;
        }

        /**
         * Port {@code PORT} a live endpoint binds to.
         */
        public Builder port(int port)
        {   this.port = port;
            return this;
        }

        /**
         * Gives each handle built by {@link #constructor()} its own temporary directory,
         * exposed to the application as {@code propertyName} and deleted after the test.
         */
        public Builder isolatedDataDirectory(String propertyName)
        {   this.isolateDataDirectory  = true;
            this.dataDirectoryProperty = Objects.requireNonNull(propertyName, "propertyName");
            return this;
        }

        public Builder sharedDataDirectory()
        {   this.isolateDataDirectory = false;
            return this;
        }

        public SpringApplicationHandle build()
        {   return new SpringApplicationHandle(this, Map.of());
        }

        /**
         * A constructor building one handle per call.
         *
         * <p>Plain (closing the handle is the teardown hook), or generator-shaped when data
         * directories are isolated: create the directory, yield the handle, then close the
         * handle and delete the directory.</p>
         */
        public ResourceConstructor<SpringApplicationHandle> constructor()
        {
            if (!isolateDataDirectory)
            {   return ResourceConstructor.of(this::build, SpringApplicationHandle::close);
            }

            String property = dataDirectoryProperty;
            return ResourceConstructor.generating(out ->
            {   Path dataDir = Files.createTempDirectory("app-unittest-");
                log.debug("Isolated data directory {} exposed as '{}'", dataDir, property);
                SpringApplicationHandle handle = new SpringApplicationHandle(this, Map.of(property, dataDir.toString()));
                try
                {   out.accept(handle);
                }
                finally
                {   handle.close();
                    deleteQuietly(dataDir);
                }
            });
        }

        private static void deleteQuietly(Path dir)
        {
            try
            {   FileSystemUtils.deleteRecursively(dir);
            }
            catch (IOException e)
            {   log.warn("Could not delete data directory {}: {}", dir, e.toString());
            }
        }
    }
}
