package com.fhi.libraries.app_unittest.live;

import java.time.Duration;
import java.util.List;

import com.fhi.libraries.app_unittest.cases.LiveTestCase;
import com.fhi.libraries.app_unittest.handle.ApplicationHandle;
import com.fhi.libraries.app_unittest.harness.SuiteEntry;
import com.fhi.libraries.app_unittest.harness.Test;
import com.fhi.libraries.app_unittest.harness.TestResult;
import com.fhi.libraries.app_unittest.harness.TestSuite;

import lombok.extern.slf4j.Slf4j;


/**
 * A suite whose tests talk to one application served on a real socket.
 *
 * <p>Running it:</p>
 * <ol>
 *   <li>starts (or reuses) the {@link LiveServer} for the configured address;</li>
 *   <li>waits until the endpoint accepts connections, failing the whole suite with a
 *       {@link com.fhi.libraries.app_unittest.exception.ReadinessTimeoutException}
 *       before any test runs if it does not;</li>
 *   <li>sets the server URL and application on every {@link LiveTestCase}, including
 *       those of nested suites;</li>
 *   <li>runs the tests in order, like any suite.</li>
 * </ol>
 */
@Slf4j
public class LiveEndpointSuite extends TestSuite
{
    private final ApplicationHandle<?> app;
    private final SuiteConfig          config;


    public LiveEndpointSuite(ApplicationHandle<?> app)
    {   this(app, (Duration) null, List.of());
    }

    /**
     * @param readinessTimeout null for the configured {@code live.readiness-timeout}
     */
    public LiveEndpointSuite(ApplicationHandle<?> app, Duration readinessTimeout, Iterable<? extends Test> tests)
    {   this(app, SuiteConfig.from(app, readinessTimeout), tests);
    }

    public LiveEndpointSuite(ApplicationHandle<?> app, SuiteConfig config, Iterable<? extends Test> tests)
    {   super(tests);
        this.app    = app;
        this.config = config;
    }

    public ApplicationHandle<?> getApp()
    {   return app;
    }

    public SuiteConfig getConfig()
    {   return config;
    }

    @Override
    public void run(TestResult result)
    {   prepare();
        super.run(result);
    }

    @Override
    public void debug() throws Throwable
    {   prepare();
        super.debug();
    }

    private void prepare()
    {
        LiveServer server = LiveServer.obtain(app, config);
        server.awaitReady(new ReadinessProbe(config));

        int injected = inject(this);
        log.debug("Injected {} into {} live test case(s)", config.serverUrl(), injected);
    }

    private int inject(TestSuite suite)
    {
        int count = 0;
        for (SuiteEntry entry : suite.getEntries())
        {   if (entry.isGroup())
            {   count += inject(entry.asGroup());
            }
            else if (entry.getTest() instanceof LiveTestCase)
            {   ((LiveTestCase) entry.getTest()).injectLiveEndpoint(config.serverUrl(), app);
                count++;
            }
        }
        return count;
    }
}
