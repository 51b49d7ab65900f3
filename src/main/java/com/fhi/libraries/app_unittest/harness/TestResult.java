package com.fhi.libraries.app_unittest.harness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result sink: collects the outcome of every test run through it.
 *
 * <p>With {@code failFast} on, the first failure or error asks the running suite to stop.
 * Not thread-safe; tests run one after the other.</p>
 */
public class TestResult
{
    private final List<TestOutcome> outcomes = new ArrayList<>();

    private int              testsRun;
    private boolean          failFast;
    private volatile boolean shouldStop;


    public void startTest(Test test)
    {   testsRun++;
    }

    public void stopTest(Test test)
    {
    }

    public void addSuccess(Test test)
    {   outcomes.add(new TestOutcome(test, TestOutcome.Kind.SUCCESS, null, null));
    }

    public void addFailure(Test test, Throwable failure)
    {   outcomes.add(new TestOutcome(test, TestOutcome.Kind.FAILURE, failure, null));
        if (failFast) stop();
    }

    public void addError(Test test, Throwable error)
    {   outcomes.add(new TestOutcome(test, TestOutcome.Kind.ERROR, error, null));
        if (failFast) stop();
    }

    public void addSkip(Test test, String reason)
    {   outcomes.add(new TestOutcome(test, TestOutcome.Kind.SKIP, null, reason));
    }

    /**
     * Asks the running suite to stop before its next test.
     */
    public void stop()
    {   shouldStop = true;
    }

    public boolean shouldStop()
    {   return shouldStop;
    }

    public boolean isFailFast()
    {   return failFast;
    }

    public void setFailFast(boolean failFast)
    {   this.failFast = failFast;
    }

    public int getTestsRun()
    {   return testsRun;
    }

    public List<TestOutcome> getOutcomes()
    {   return Collections.unmodifiableList(outcomes);
    }

    public List<TestOutcome> getSuccesses()  { return ofKind(TestOutcome.Kind.SUCCESS); }
    public List<TestOutcome> getFailures()   { return ofKind(TestOutcome.Kind.FAILURE); }
    public List<TestOutcome> getErrors()     { return ofKind(TestOutcome.Kind.ERROR); }
    public List<TestOutcome> getSkipped()    { return ofKind(TestOutcome.Kind.SKIP); }

    /**
     * True when no test failed or raised an error.
     */
    public boolean wasSuccessful()
    {   return getFailures().isEmpty() && getErrors().isEmpty();
    }

    private List<TestOutcome> ofKind(TestOutcome.Kind kind)
    {   return outcomes.stream()
                       .filter(o -> o.getKind() == kind)
                       .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString()
    {   return String.format("TestResult[run=%d, failures=%d, errors=%d, skipped=%d]",
                             testsRun, getFailures().size(), getErrors().size(), getSkipped().size());
    }
}
