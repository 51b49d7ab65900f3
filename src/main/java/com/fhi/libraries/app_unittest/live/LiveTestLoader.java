package com.fhi.libraries.app_unittest.live;

import java.time.Duration;
import java.util.List;

import com.fhi.libraries.app_unittest.handle.ApplicationHandle;
import com.fhi.libraries.app_unittest.harness.Test;
import com.fhi.libraries.app_unittest.harness.TestLoader;
import com.fhi.libraries.app_unittest.harness.TestSuite;


/**
 * A {@link TestLoader} producing {@link LiveEndpointSuite}s bound to one application.
 */
public class LiveTestLoader extends TestLoader
{
    private final ApplicationHandle<?> app;
    private final Duration             readinessTimeout;

    public LiveTestLoader(ApplicationHandle<?> app)
    {   this(app, null);
    }

    /**
     * @param readinessTimeout null for the configured {@code live.readiness-timeout}
     */
    public LiveTestLoader(ApplicationHandle<?> app, Duration readinessTimeout)
    {   this.app              = app;
        this.readinessTimeout = readinessTimeout;
    }

    @Override
    protected TestSuite createSuite(List<Test> tests)
    {   return new LiveEndpointSuite(app, readinessTimeout, tests);
    }
}
