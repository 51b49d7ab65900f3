package com.fhi.libraries.app_unittest.exception;

/**
 * Wraps a checked exception thrown while creating or cleaning up a resource.
 * Unchecked exceptions and errors are propagated as they are.
 */
public class ResourceLifecycleException extends HarnessException
{
    public ResourceLifecycleException(Cause causeEnum, String message, Throwable cause)
    {   super(causeEnum, message, cause);
    }

    /**
     * @param phase what was going on, e.g. {@code "creation"} or {@code "cleanup"}
     */
    public static ResourceLifecycleException failed(String phase, Throwable cause)
    {   return new ResourceLifecycleException(Cause.RESOURCE_FAILED,
                                              Cause.RESOURCE_FAILED.format(phase),
                                              cause);
    }
}
