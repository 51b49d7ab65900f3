package com.fhi.libraries.app_unittest.exception;

/**
 * A resource constructor produced a value that is not of the type the test case declares.
 */
public class TypeMismatchException extends HarnessException
{
    public TypeMismatchException(Cause causeEnum, String message)
    {   super(causeEnum, message, null);
    }

    public static TypeMismatchException of(Class<?> expected, Object actual)
    {   String actualShape = actual == null ? "null" : actual.getClass().getName();
        return new TypeMismatchException(Cause.TYPE_MISMATCH,
                                         Cause.TYPE_MISMATCH.format(expected.getName(), actualShape));
    }
}
