package com.fhi.libraries.app_unittest.cases;

import java.util.Map;

import com.fhi.libraries.app_unittest.exception.UsageException;
import com.fhi.libraries.app_unittest.handle.ApplicationHandle;
import com.fhi.libraries.app_unittest.handle.ClientHandle;
import com.fhi.libraries.app_unittest.harness.Binding;
import com.fhi.libraries.app_unittest.harness.MethodOverrideScope;
import com.fhi.libraries.app_unittest.harness.TestCase;
import com.fhi.libraries.app_unittest.harness.TestResult;
import com.fhi.libraries.app_unittest.provision.Provision;
import com.fhi.libraries.app_unittest.provision.ResourceProvisioner;


/**
 * A test case bound to one application, getting a fresh client on it for every test.
 *
 * <p>The application is fixed at construction, typically by a no-arg constructor of the
 * concrete class calling {@code super(app)} with a shared handle. Each test opens a client
 * with {@link #useCookies()} and {@link #clientOptions()} and closes it afterwards, so
 * cookies and session state never leak from one test into the next.</p>
 *
 * @param <C> type of the injected client
 */
public abstract class ClientTestCase<C extends ClientHandle> extends TestCase
{
    private final ApplicationHandle<? extends C> app;

    /**
     * @throws UsageException if {@code app} is null
     */
    protected ClientTestCase(ApplicationHandle<? extends C> app)
    {
        if (app == null) throw UsageException.missingApplication(getClass());
        this.app = app;
    }

    public ApplicationHandle<? extends C> getApplication()
    {   return app;
    }

    /**
     * Whether clients keep cookies between requests; defaults to {@code client.use-cookies}.
     */
    protected boolean useCookies()
    {   return CaseSupport.defaultUseCookies();
    }

    protected Map<String, Object> clientOptions()
    {   return Map.of();
    }

    protected void setUp(C client) throws Exception
    {
    }

    protected void tearDown(C client) throws Exception
    {
    }

    protected ResourceProvisioner provisioner()
    {   return CaseSupport.DEFAULT_PROVISIONER;
    }

    @Override
    protected final int resourceArity()
    {   return 1;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected Binding createSetUpBinding()
    {   return Binding.of("setUp", 1, args -> setUp((C) args[0]));
    }

    @Override
    @SuppressWarnings("unchecked")
    protected Binding createTearDownBinding()
    {   return Binding.of("tearDown", 1, args -> tearDown((C) args[0]));
    }

    @Override
    public void run(TestResult result)
    {
        Provision<C> client = openClient();
        MethodOverrideScope.run(this, result, client, client.resource());
    }

    @Override
    public void debug() throws Throwable
    {
        Provision<C> client = openClient();
        MethodOverrideScope.debug(this, client, client.resource());
    }

    private Provision<C> openClient()
    {
        Class<C> clientType = CaseSupport.typeArgument(getClass(), ClientTestCase.class, 0);
        return provisioner().provision(
                CaseSupport.clientConstructor(app, useCookies(), clientOptions()), clientType);
    }
}
