package com.fhi.libraries.app_unittest.harness;

/**
 * Thrown from setUp or a test body to mark the test as skipped.
 */
public class SkipTestException extends RuntimeException
{
    public SkipTestException(String reason)
    {   super(reason);
    }
}
