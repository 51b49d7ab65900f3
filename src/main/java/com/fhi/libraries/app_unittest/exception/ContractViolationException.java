package com.fhi.libraries.app_unittest.exception;

/**
 * A generator-shaped resource constructor yielded more than one resource.
 *
 * <p>Surfaces from disposal, after the test case bindings have been restored, and is
 * never confused with an assertion failure of the test body.</p>
 */
public class ContractViolationException extends HarnessException
{
    public ContractViolationException(Cause causeEnum, String message)
    {   super(causeEnum, message, null);
    }

    public static ContractViolationException multipleYields(Object secondValue)
    {   return new ContractViolationException(Cause.MULTIPLE_YIELDS,
                                              Cause.MULTIPLE_YIELDS.format(secondValue));
    }
}
