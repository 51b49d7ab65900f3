package com.fhi.libraries.app_unittest.cases;

import java.util.Map;

import com.fhi.libraries.app_unittest.exception.UsageException;
import com.fhi.libraries.app_unittest.handle.ApplicationHandle;
import com.fhi.libraries.app_unittest.handle.ClientHandle;
import com.fhi.libraries.app_unittest.harness.Binding;
import com.fhi.libraries.app_unittest.harness.MethodOverrideScope;
import com.fhi.libraries.app_unittest.harness.TestCase;
import com.fhi.libraries.app_unittest.harness.TestResult;
import com.fhi.libraries.app_unittest.provision.Disposer;
import com.fhi.libraries.app_unittest.provision.Provision;
import com.fhi.libraries.app_unittest.provision.ResourceConstructor;
import com.fhi.libraries.app_unittest.provision.ResourceProvisioner;

import lombok.extern.slf4j.Slf4j;


/**
 * A test case getting both a fresh application and a client on it for every test.
 *
 * <p>Test methods take {@code (A app, C client)}. The application is provisioned first,
 * then the client is opened on it; if opening the client fails, the application is
 * disposed before the error propagates. Teardown is always client first, then
 * application.</p>
 *
 * @param <A> type of the injected application
 * @param <C> type of the injected client
 */
@Slf4j
public abstract class AppClientTestCase<A extends ApplicationHandle<? extends C>, C extends ClientHandle> extends TestCase
{
    protected abstract ResourceConstructor<? extends A> createApp();

    protected boolean useCookies()
    {   return CaseSupport.defaultUseCookies();
    }

    protected Map<String, Object> clientOptions()
    {   return Map.of();
    }

    protected void setUp(A app, C client) throws Exception
    {
    }

    protected void tearDown(A app, C client) throws Exception
    {
    }

    protected ResourceProvisioner provisioner()
    {   return CaseSupport.DEFAULT_PROVISIONER;
    }

    @Override
    protected final int resourceArity()
    {   return 2;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected Binding createSetUpBinding()
    {   return Binding.of("setUp", 2, args -> setUp((A) args[0], (C) args[1]));
    }

    @Override
    @SuppressWarnings("unchecked")
    protected Binding createTearDownBinding()
    {   return Binding.of("tearDown", 2, args -> tearDown((A) args[0], (C) args[1]));
    }

    @Override
    public void run(TestResult result)
    {
        Provision<A> app    = provisionApp();
        Provision<C> client = openClient(app);
        MethodOverrideScope.run(this, result, Disposer.inOrder(client, app), app.resource(), client.resource());
    }

    @Override
    public void debug() throws Throwable
    {
        Provision<A> app    = provisionApp();
        Provision<C> client = openClient(app);
        MethodOverrideScope.debug(this, Disposer.inOrder(client, app), app.resource(), client.resource());
    }

    private Provision<A> provisionApp()
    {
        ResourceConstructor<? extends A> constructor = createApp();
        if (constructor == null) throw UsageException.missingConstructor(getClass());

        Class<A> appType = CaseSupport.typeArgument(getClass(), AppClientTestCase.class, 0);
        return provisioner().provision(constructor, appType);
    }

    private Provision<C> openClient(Provision<A> app)
    {
        Class<C> clientType = CaseSupport.typeArgument(getClass(), AppClientTestCase.class, 1);
        try
        {   return provisioner().provision(
                    CaseSupport.clientConstructor(app.resource(), useCookies(), clientOptions()), clientType);
        }
        catch (RuntimeException e)
        {   log.debug("{}: client could not be opened, disposing the application", this);
            throw CaseSupport.releaseAfterFailure(e, app);
        }
    }
}
