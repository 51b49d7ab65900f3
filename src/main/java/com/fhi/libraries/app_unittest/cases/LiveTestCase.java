package com.fhi.libraries.app_unittest.cases;

import com.fhi.libraries.app_unittest.exception.UsageException;
import com.fhi.libraries.app_unittest.handle.ApplicationHandle;
import com.fhi.libraries.app_unittest.harness.TestCase;


/**
 * A test case issuing real network requests against an application served by a
 * {@link com.fhi.libraries.app_unittest.live.LiveEndpointSuite}.
 *
 * <p>Nothing is injected as a parameter; the suite sets the server URL and the shared
 * application on each case before running it. Reading either outside such a suite is a
 * {@link UsageException}.</p>
 */
public abstract class LiveTestCase extends TestCase
{
    private String                 serverUrl;
    private ApplicationHandle<?>   app;

    /**
     * Base URL of the live endpoint, e.g. {@code http://127.0.0.1:5000}.
     */
    public String getServerUrl()
    {   if (serverUrl == null) throw UsageException.notInjected("serverUrl", getClass());
        return serverUrl;
    }

    public ApplicationHandle<?> getApp()
    {   if (app == null) throw UsageException.notInjected("app", getClass());
        return app;
    }

    public boolean isInjected()
    {   return serverUrl != null;
    }

    /**
     * Called by the suite once its server is ready.
     */
    public void injectLiveEndpoint(String serverUrl, ApplicationHandle<?> app)
    {   this.serverUrl = serverUrl;
        this.app       = app;
    }
}
