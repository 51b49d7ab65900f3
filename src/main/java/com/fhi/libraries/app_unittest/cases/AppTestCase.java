package com.fhi.libraries.app_unittest.cases;

import com.fhi.libraries.app_unittest.exception.UsageException;
import com.fhi.libraries.app_unittest.handle.ApplicationHandle;
import com.fhi.libraries.app_unittest.harness.Binding;
import com.fhi.libraries.app_unittest.harness.MethodOverrideScope;
import com.fhi.libraries.app_unittest.harness.TestCase;
import com.fhi.libraries.app_unittest.harness.TestResult;
import com.fhi.libraries.app_unittest.provision.Provision;
import com.fhi.libraries.app_unittest.provision.ResourceConstructor;
import com.fhi.libraries.app_unittest.provision.ResourceProvisioner;

import lombok.extern.slf4j.Slf4j;


/**
 * A test case that gets a freshly constructed application for every test.
 *
 * <p>Authors implement {@link #createApp()} and write test methods taking the application
 * as their only parameter:</p>
 * <pre>
 * public class GreetingTest extends AppTestCase&lt;SpringApplicationHandle&gt;
 * {
 *     protected ResourceConstructor&lt;SpringApplicationHandle&gt; createApp()
 *     {   return SpringApplicationHandle.builder(GreetingApplication.class).build().constructor();
 *     }
 *
 *     public void testConfig(SpringApplicationHandle app)
 *     {   assertEquals("hello", app.getConfig().get("greeting"));
 *     }
 * }
 * </pre>
 *
 * <p>The application is provisioned before setUp and disposed after tearDown, whatever the
 * outcome. A failing constructor propagates out of {@code run} before anything is rebound.</p>
 *
 * @param <A> type of the injected application
 */
@Slf4j
public abstract class AppTestCase<A extends ApplicationHandle<?>> extends TestCase
{
    /**
     * The constructor producing the application of each test, plain or generator-shaped.
     */
    protected abstract ResourceConstructor<? extends A> createApp();

    protected void setUp(A app) throws Exception
    {
    }

    protected void tearDown(A app) throws Exception
    {
    }

    /**
     * Provisioner used for the application; tests may supply one that records its calls.
     */
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
    {   return Binding.of("setUp", 1, args -> setUp((A) args[0]));
    }

    @Override
    @SuppressWarnings("unchecked")
    protected Binding createTearDownBinding()
    {   return Binding.of("tearDown", 1, args -> tearDown((A) args[0]));
    }

    @Override
    public void run(TestResult result)
    {
        Provision<A> app = provisionApp();
        MethodOverrideScope.run(this, result, app, app.resource());
    }

    @Override
    public void debug() throws Throwable
    {
        Provision<A> app = provisionApp();
        MethodOverrideScope.debug(this, app, app.resource());
    }

    private Provision<A> provisionApp()
    {
        ResourceConstructor<? extends A> constructor = createApp();
        if (constructor == null) throw UsageException.missingConstructor(getClass());

        Class<A> appType = CaseSupport.typeArgument(getClass(), AppTestCase.class, 0);
        log.debug("{}: provisioning application from a {} constructor", this, constructor.shape());
        return provisioner().provision(constructor, appType);
    }
}
