package com.fhi.libraries.app_unittest.harness;

import lombok.Getter;

/**
 * What happened to one test.
 */
@Getter
public class TestOutcome
{
    public enum Kind
    {
        SUCCESS,
        /** An assertion of the test failed. */
        FAILURE,
        /** The test raised something other than an assertion failure. */
        ERROR,
        SKIP
    }

    private final Test      test;
    private final Kind      kind;
    private final Throwable throwable;
    private final String    reason;

    TestOutcome(Test test, Kind kind, Throwable throwable, String reason)
    {   this.test      = test;
        this.kind      = kind;
        this.throwable = throwable;
        this.reason    = reason;
    }

    @Override
    public String toString()
    {
        return switch (kind)
        {
            case SUCCESS        -> test + " ... ok";
            case SKIP           -> test + " ... skipped '" + reason + "'";
            case FAILURE, ERROR -> test + " ... " + kind + ": " + throwable;
        };
    }
}
