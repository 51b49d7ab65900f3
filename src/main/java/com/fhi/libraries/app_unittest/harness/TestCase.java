package com.fhi.libraries.app_unittest.harness;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Collection;
import java.util.Map;

import org.junit.jupiter.api.Assertions;

import com.fhi.libraries.app_unittest.exception.UsageException;

import lombok.extern.slf4j.Slf4j;


/**
 * One test method of a test class, with its setUp and tearDown.
 *
 * <p>An instance is created per test method and named with {@link #setName(String)}
 * (which {@link TestLoader} does). The three steps are held as {@link Binding}s; the
 * host primitives {@link #run(TestResult)} and {@link #debug()} execute whatever the
 * bindings currently are. Subclasses that inject resources declare how many with
 * {@link #resourceArity()} and run their tests through {@link MethodOverrideScope},
 * which binds the resources for exactly one invocation.</p>
 *
 * <p>A case is either IDLE (bindings are the originals) or ACTIVE (one test in flight,
 * bindings pre-applied with its resources). It is not thread-safe.</p>
 */
@Slf4j
public abstract class TestCase implements Test
{
    private enum State { IDLE, ACTIVE }

    private String   name;
    private Bindings bindings;
    private State    state = State.IDLE;


    protected TestCase()
    {
    }

    public String getName()
    {   return name;
    }

    /**
     * Selects the test method this instance runs.
     *
     * @throws UsageException if the class has no such method taking {@link #resourceArity()} parameters
     */
    public void setName(String name)
    {
        if (state == State.ACTIVE) throw UsageException.reentrantRun(getClass(), this.name);

        Method method = TestMethods.find(getClass(), name, resourceArity());
        if (method == null) throw UsageException.missingTestMethod(name, resourceArity(), getClass());

        this.bindings = new Bindings(createSetUpBinding(),
                                     Binding.of(name, resourceArity(), args -> invoke(method, args)),
                                     createTearDownBinding());
        this.name = name;
    }


    // -----------------------------------------
    // Steps, overridden by authors and variants
    // -----------------------------------------

    /**
     * Number of resources injected as leading parameters of setUp, the test method and tearDown.
     */
    protected int resourceArity()
    {   return 0;
    }

    protected void setUp() throws Exception
    {
    }

    protected void tearDown() throws Exception
    {
    }

    /**
     * The original setUp binding. Variants injecting resources return one of arity
     * {@link #resourceArity()} calling their setUp overload.
     */
    protected Binding createSetUpBinding()
    {   return Binding.of("setUp", 0, args -> setUp());
    }

    protected Binding createTearDownBinding()
    {   return Binding.of("tearDown", 0, args -> tearDown());
    }

    public Binding getSetUpBinding()
    {   return requireBindings().setUp;
    }

    public Binding getTestMethodBinding()
    {   return requireBindings().testMethod;
    }

    public Binding getTearDownBinding()
    {   return requireBindings().tearDown;
    }

    /**
     * True while a test of this case is in flight inside a {@link MethodOverrideScope}.
     */
    public boolean isActive()
    {   return state == State.ACTIVE;
    }


    // -----------------------------------------
    // Host primitives
    // -----------------------------------------

    @Override
    public int countTestCases()
    {   return 1;
    }

    @Override
    public void run(TestResult result)
    {   runWithCurrentBindings(result);
    }

    @Override
    public void debug() throws Throwable
    {   debugWithCurrentBindings();
    }

    /**
     * setUp, test, tearDown through the current bindings. A failing setUp ends the test
     * (the body and tearDown are not run). Exactly one outcome is recorded per test; a
     * tearDown failure after a failed body is attached to the first failure as suppressed.
     */
    final void runWithCurrentBindings(TestResult result)
    {
        Bindings current = requireBindings();
        current.requireComplete();

        result.startTest(this);
        try
        {   try
            {   current.setUp.call();
            }
            catch (Throwable t)
            {   record(result, t);
                return;
            }

            Throwable failure = null;
            try
            {   current.testMethod.call();
            }
            catch (Throwable t)
            {   failure = t;
            }

            try
            {   current.tearDown.call();
            }
            catch (Throwable t)
            {   if (failure == null) failure = t;
                else                 failure.addSuppressed(t);
            }

            if (failure == null) result.addSuccess(this);
            else                 record(result, failure);
        }
        finally
        {   result.stopTest(this);
        }
    }

    final void debugWithCurrentBindings() throws Throwable
    {
        Bindings current = requireBindings();
        current.requireComplete();

        current.setUp.call();
        current.testMethod.call();
        current.tearDown.call();
    }

    private void record(TestResult result, Throwable t)
    {
        log.debug("{} ended with {}", this, t.toString());
        if (t instanceof SkipTestException)
        {   result.addSkip(this, t.getMessage());
        }
        else if (t instanceof AssertionError)
        {   result.addFailure(this, t);
        }
        else
        {   result.addError(this, t);
        }
    }

    private void invoke(Method method, Object[] args) throws Throwable
    {
        try
        {   method.invoke(this, args);
        }
        catch (InvocationTargetException e)
        {   throw e.getCause();
        }
    }


    // -----------------------------------------
    // Scope hooks, used by MethodOverrideScope
    // -----------------------------------------

    Bindings currentBindings()
    {   return requireBindings();
    }

    void activate(Bindings bound)
    {
        if (state == State.ACTIVE) throw UsageException.reentrantRun(getClass(), name);
        state    = State.ACTIVE;
        bindings = bound;
        log.debug("{} bound to {}", this, bound);
    }

    void restore(Bindings originals)
    {
        bindings = originals;
        state    = State.IDLE;
        log.debug("{} restored to its original bindings", this);
    }

    private Bindings requireBindings()
    {   if (bindings == null) throw UsageException.missingTestName(getClass());
        return bindings;
    }


    // -----------------------------------------
    // Assertion helpers
    // -----------------------------------------

    protected void assertTrue(boolean condition)                       { Assertions.assertTrue(condition); }
    protected void assertTrue(boolean condition, String message)       { Assertions.assertTrue(condition, message); }
    protected void assertFalse(boolean condition)                      { Assertions.assertFalse(condition); }
    protected void assertEquals(Object expected, Object actual)        { Assertions.assertEquals(expected, actual); }
    protected void assertNotEquals(Object unexpected, Object actual)   { Assertions.assertNotEquals(unexpected, actual); }
    protected void assertSame(Object expected, Object actual)          { Assertions.assertSame(expected, actual); }
    protected void assertNotNull(Object actual)                        { Assertions.assertNotNull(actual); }
    protected void assertNull(Object actual)                           { Assertions.assertNull(actual); }

    /**
     * Asserts that {@code container} (a String, Collection or Map keys) contains {@code member}.
     */
    protected void assertIn(Object member, Object container)
    {
        boolean found;
        if (container instanceof CharSequence)
        {   found = container.toString().contains(String.valueOf(member));
        }
        else if (container instanceof Collection)
        {   found = ((Collection<?>) container).contains(member);
        }
        else if (container instanceof Map)
        {   found = ((Map<?, ?>) container).containsKey(member);
        }
        else
        {   throw new IllegalArgumentException("Cannot look for members in " + container);
        }
        if (!found) Assertions.fail(member + " not found in " + container);
    }

    protected void fail(String message)
    {   Assertions.fail(message);
    }

    /**
     * Ends the current test as skipped.
     */
    protected void skipTest(String reason)
    {   throw new SkipTestException(reason);
    }

    @Override
    public String toString()
    {   return name + "(" + getClass().getName() + ")";
    }


    /**
     * The three steps of a test case, as one value.
     */
    static final class Bindings
    {
        final Binding setUp;
        final Binding testMethod;
        final Binding tearDown;

        Bindings(Binding setUp, Binding testMethod, Binding tearDown)
        {   this.setUp      = setUp;
            this.testMethod = testMethod;
            this.tearDown   = tearDown;
        }

        Bindings partial(Object... resources)
        {   return new Bindings(setUp.partial(resources), testMethod.partial(resources), tearDown.partial(resources));
        }

        void requireComplete()
        {   setUp.requireComplete();
            testMethod.requireComplete();
            tearDown.requireComplete();
        }

        @Override
        public String toString()
        {   return "[" + setUp + ", " + testMethod + ", " + tearDown + "]";
        }
    }
}
