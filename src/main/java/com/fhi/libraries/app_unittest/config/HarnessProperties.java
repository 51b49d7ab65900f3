package com.fhi.libraries.app_unittest.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;


/**
 * Harness-wide configuration, read once per process from a YAML file on the classpath.
 *
 * <p>The resource name is {@value #DEFAULT_RESOURCE}, or whatever the system property
 * {@value #RESOURCE_PROPERTY} names. A missing resource means all defaults:</p>
 * <pre>
 * client:
 *   use-cookies: true
 * live:
 *   host: 127.0.0.1
 *   port: 5000
 *   readiness-timeout: PT10S
 *   poll-interval: PT0.05S
 * app:
 *   isolate-data-directory: false
 *   data-directory-property: app.data-dir
 * </pre>
 */
@Slf4j
@Getter
@Setter
public class HarnessProperties
{
    public static final String DEFAULT_RESOURCE  = "app-unittest.yaml";
    public static final String RESOURCE_PROPERTY = "app-unittest.config";

    private static volatile HarnessProperties instance;

    private Client client = new Client();
    private Live   live   = new Live();
    private App    app    = new App();


    @Getter
    @Setter
    public static class Client
    {
        /**
         * Whether simulated clients keep cookies (and the session) between requests.
         */
        private boolean useCookies = true;
    }

    @Getter
    @Setter
    public static class Live
    {
        /** Used when the application configuration has no {@code HOST}. */
        private String   host             = "127.0.0.1";
        /** Used when the application configuration has no {@code PORT}. */
        private int      port             = 5000;
        private Duration readinessTimeout = Duration.ofSeconds(10);
        private Duration pollInterval     = Duration.ofMillis(50);
    }

    @Getter
    @Setter
    public static class App
    {
        /**
         * If true, application constructors built by the Spring adapter give every
         * handle its own temporary data directory, deleted after the test.
         */
        private boolean isolateDataDirectory  = false;
        private String  dataDirectoryProperty = "app.data-dir";
    }


    /**
     * Returns the process-wide properties, loading them on first use.
     */
    public static HarnessProperties get()
    {
        HarnessProperties current = instance;
        if (current == null)
        {   synchronized (HarnessProperties.class)
            {   current = instance;
                if (current == null)
                {   current = load(System.getProperty(RESOURCE_PROPERTY, DEFAULT_RESOURCE));
                    instance = current;
                }
            }
        }
        return current;
    }

    /**
     * Loads properties from the given classpath resource, falling back to defaults when
     * the resource does not exist.
     *
     * @throws IllegalStateException if the resource exists but cannot be parsed
     */
    public static HarnessProperties load(String resourceName)
    {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = HarnessProperties.class.getClassLoader();

        try (InputStream is = cl.getResourceAsStream(resourceName))
        {   if (is == null)
            {   log.debug("No harness configuration '{}' on the classpath, using defaults", resourceName);
                return new HarnessProperties();
            }
            HarnessProperties loaded = yamlMapper().readValue(is, HarnessProperties.class);
            log.debug("Loaded harness configuration from '{}'", resourceName);
            return loaded;
        }
        catch (IOException e)
        {   throw new IllegalStateException("While trying to read harness configuration from " + resourceName, e);
        }
    }

    private static ObjectMapper yamlMapper()
    {
        return new ObjectMapper(new YAMLFactory())
                .configure(JsonParser.Feature.ALLOW_COMMENTS, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setPropertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
                .registerModule(new JavaTimeModule());
    }
}
