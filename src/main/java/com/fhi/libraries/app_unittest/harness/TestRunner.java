package com.fhi.libraries.app_unittest.harness;

import lombok.extern.slf4j.Slf4j;


/**
 * Runs a test or suite and logs its progress and summary.
 */
@Slf4j
public class TestRunner
{
    private final boolean failFast;
    private final boolean verbose;

    public TestRunner()
    {   this(false, true);
    }

    /**
     * @param failFast stop at the first failure or error
     * @param verbose  log one line per test instead of failures only
     */
    public TestRunner(boolean failFast, boolean verbose)
    {   this.failFast = failFast;
        this.verbose  = verbose;
    }

    public TestResult run(Test test)
    {
        TestResult result = new LoggingTestResult(verbose);
        result.setFailFast(failFast);

        long t0 = System.nanoTime();
        test.run(result);
        long tookMs = (System.nanoTime() - t0) / 1_000_000L;

        log.info("Ran {} test(s) in {} ms", result.getTestsRun(), tookMs);
        if (result.wasSuccessful())
        {   log.info("OK{}", result.getSkipped().isEmpty() ? "" : " (skipped=" + result.getSkipped().size() + ")");
        }
        else
        {   log.warn("FAILED (failures={}, errors={}, skipped={})",
                     result.getFailures().size(), result.getErrors().size(), result.getSkipped().size());
        }
        return result;
    }


    private static final class LoggingTestResult extends TestResult
    {
        private final boolean verbose;

        LoggingTestResult(boolean verbose)
        {   this.verbose = verbose;
        }

        @Override
        public void addSuccess(Test test)
        {   super.addSuccess(test);
            if (verbose) log.info("{} ... ok", test);
        }

        @Override
        public void addFailure(Test test, Throwable failure)
        {   super.addFailure(test, failure);
            log.warn("{} ... FAIL", test, failure);
        }

        @Override
        public void addError(Test test, Throwable error)
        {   super.addError(test, error);
            log.warn("{} ... ERROR", test, error);
        }

        @Override
        public void addSkip(Test test, String reason)
        {   super.addSkip(test, reason);
            if (verbose) log.info("{} ... skipped '{}'", test, reason);
        }
    }
}
