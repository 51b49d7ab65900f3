package com.fhi.libraries.app_unittest.exception;

import java.util.Collection;

/**
 * A test case, suite or resource was used in a way the harness does not support.
 *
 * <p>Raised eagerly, at construction time or before any test body runs, never recorded
 * as a test failure.</p>
 */
public class UsageException extends HarnessException
{
    public UsageException(Cause causeEnum, String message)
    {   super(causeEnum, message, null);
    }

    public UsageException(Cause causeEnum, String message, Throwable cause)
    {   super(causeEnum, message, cause);
    }


    // -----------------------------------------
    // Static factory methods
    // -----------------------------------------

    public static UsageException missingApplication(Class<?> testCaseClass)
    {   return new UsageException(Cause.MISSING_APPLICATION,
                                  Cause.MISSING_APPLICATION.format(testCaseClass.getSimpleName()));
    }

    public static UsageException missingConstructor(Class<?> testCaseClass)
    {   return new UsageException(Cause.MISSING_CONSTRUCTOR,
                                  Cause.MISSING_CONSTRUCTOR.format(testCaseClass.getSimpleName()));
    }

    public static UsageException missingTestMethod(String methodName, int arity, Class<?> testCaseClass)
    {   return new UsageException(Cause.MISSING_TEST_METHOD,
                                  Cause.MISSING_TEST_METHOD.format(methodName, arity, testCaseClass.getName()));
    }

    public static UsageException missingTestName(Class<?> testCaseClass)
    {   return new UsageException(Cause.MISSING_TEST_NAME,
                                  Cause.MISSING_TEST_NAME.format(testCaseClass.getName()));
    }

    public static UsageException incompleteBinding(String bindingName, int arity, int supplied)
    {   return new UsageException(Cause.INCOMPLETE_BINDING,
                                  Cause.INCOMPLETE_BINDING.format(bindingName, arity, supplied));
    }

    public static UsageException reentrantRun(Class<?> testCaseClass, String testName)
    {   return new UsageException(Cause.REENTRANT_RUN,
                                  Cause.REENTRANT_RUN.format(testCaseClass.getSimpleName(), testName));
    }

    public static UsageException notInjected(String property, Class<?> testCaseClass)
    {   return new UsageException(Cause.NOT_INJECTED,
                                  Cause.NOT_INJECTED.format(property, testCaseClass.getSimpleName()));
    }

    public static UsageException notProvisioned(Object state)
    {   return new UsageException(Cause.NOT_PROVISIONED,
                                  Cause.NOT_PROVISIONED.format(state));
    }

    public static UsageException alreadyDisposed()
    {   return new UsageException(Cause.ALREADY_DISPOSED,
                                  Cause.ALREADY_DISPOSED.format());
    }

    public static UsageException noYield()
    {   return new UsageException(Cause.NO_YIELD,
                                  Cause.NO_YIELD.format());
    }

    public static UsageException unknownClientOption(String option, Collection<String> supported)
    {   return new UsageException(Cause.UNKNOWN_CLIENT_OPTION,
                                  Cause.UNKNOWN_CLIENT_OPTION.format(option, supported));
    }

    public static UsageException clientClosed()
    {   return new UsageException(Cause.CLIENT_CLOSED,
                                  Cause.CLIENT_CLOSED.format());
    }

    public static UsageException addressInUse(String host, int port)
    {   return new UsageException(Cause.ADDRESS_IN_USE,
                                  Cause.ADDRESS_IN_USE.format(host, port));
    }

    /**
     * @param cause pass null if no Throwable cause.
     */
    public static UsageException notATestCase(Class<?> candidate, Throwable cause)
    {   return new UsageException(Cause.NOT_A_TEST_CASE,
                                  Cause.NOT_A_TEST_CASE.format(candidate.getName()),
                                  cause);
    }
}
