package com.fhi.libraries.app_unittest.harness;

import com.fhi.libraries.app_unittest.exception.UsageException;
import com.fhi.libraries.app_unittest.provision.Disposer;

import lombok.extern.slf4j.Slf4j;


/**
 * Runs one test of a {@link TestCase} with resources injected as the leading parameters of
 * its setUp, test method and tearDown.
 *
 * <ol>
 *   <li>capture the current bindings of the case;</li>
 *   <li>rebind all three to partials pre-applied with the resources, so the host primitive
 *       can keep calling them without arguments;</li>
 *   <li>invoke the host primitive once: {@link TestCase#run(TestResult)}-style (failures
 *       recorded) or {@link TestCase#debug()}-style (failures thrown);</li>
 *   <li>whatever happened: dispose the resources, then restore the captured bindings.
 *       A disposal failure is thrown only after the bindings are back.</li>
 * </ol>
 *
 * <p>Resources are expected to be provisioned by the caller before calling in, so that a
 * failing constructor leaves the case untouched.</p>
 */
@Slf4j
public final class MethodOverrideScope
{
    @FunctionalInterface
    private interface Execution
    {
        void execute() throws Throwable;
    }

    private MethodOverrideScope()
    {
    }

    /**
     * Runs the current test of {@code testCase} into {@code result}.
     *
     * @param disposer releases the resources; runs before the bindings are restored
     * @throws RuntimeException whatever the disposer throws, e.g. a
     *         {@link com.fhi.libraries.app_unittest.exception.ContractViolationException}
     */
    public static void run(TestCase testCase, TestResult result, Disposer disposer, Object... resources)
    {
        try
        {   withResources(testCase, disposer, resources, () -> testCase.runWithCurrentBindings(result));
        }
        catch (RuntimeException | Error e)
        {   throw e;
        }
        catch (Throwable t)
        {   // runWithCurrentBindings records failures, nothing checked gets here
            throw new IllegalStateException(t);
        }
    }

    /**
     * Runs the current test of {@code testCase}, throwing its first failure.
     * If disposal fails as well, the disposal failure is attached as suppressed.
     */
    public static void debug(TestCase testCase, Disposer disposer, Object... resources) throws Throwable
    {   withResources(testCase, disposer, resources, testCase::debugWithCurrentBindings);
    }


    private static void withResources(TestCase testCase, Disposer disposer, Object[] resources, Execution execution) throws Throwable
    {
        TestCase.Bindings originals;
        try
        {   originals = testCase.currentBindings();
            if (testCase.isActive()) throw UsageException.reentrantRun(testCase.getClass(), testCase.getName());
            testCase.activate(originals.partial(resources));
        }
        catch (RuntimeException e)
        {   // the case was never rebound, only the resources need releasing
            try
            {   disposer.dispose();
            }
            catch (RuntimeException disposalFailure)
            {   e.addSuppressed(disposalFailure);
            }
            throw e;
        }

        Throwable primary = null;
        try
        {   execution.execute();
        }
        catch (Throwable t)
        {   primary = t;
            throw t;
        }
        finally
        {   RuntimeException disposalFailure = null;
            try
            {   disposer.dispose();
            }
            catch (RuntimeException e)
            {   disposalFailure = e;
            }
            finally
            {   testCase.restore(originals);
            }

            if (disposalFailure != null)
            {   if (primary != null)
                {   log.warn("Disposal of {} failed after the test itself failed: {}", testCase, disposalFailure.toString());
                    primary.addSuppressed(disposalFailure);
                }
                else
                {   throw disposalFailure;
                }
            }
        }
    }
}
