package com.fhi.libraries.app_unittest.exception;

import java.time.Duration;

/**
 * A live endpoint did not start accepting connections in time. Fatal for the whole suite:
 * none of its tests run.
 */
public class ReadinessTimeoutException extends HarnessException
{
    public ReadinessTimeoutException(Cause causeEnum, String message, Throwable cause)
    {   super(causeEnum, message, cause);
    }

    /**
     * @param lastAttempt the last failed connection attempt, pass null if none was made.
     */
    public static ReadinessTimeoutException timedOut(String host, int port, Duration timeout, Throwable lastAttempt)
    {   return new ReadinessTimeoutException(Cause.READINESS_TIMEOUT,
                                             Cause.READINESS_TIMEOUT.format(host, port, timeout),
                                             lastAttempt);
    }

    /**
     * @param serverFailure what the serving thread died of, pass null if it returned normally.
     */
    public static ReadinessTimeoutException serverFailed(String host, int port, Throwable serverFailure)
    {   return new ReadinessTimeoutException(Cause.SERVER_FAILED,
                                             Cause.SERVER_FAILED.format(host, port),
                                             serverFailure);
    }
}
