package com.fhi.libraries.app_unittest.exception;

/**
 * Base of every error raised by the harness itself, as opposed to failures raised by
 * the code under test.
 *
 * <p>Each instance carries a {@link Cause} that names the broken rule. Subclasses split
 * the causes into the families callers need to tell apart:</p>
 * <ul>
 *   <li>{@link UsageException}: a test case or suite is misconfigured;</li>
 *   <li>{@link ContractViolationException}: a generator-shaped constructor yielded more than once;</li>
 *   <li>{@link ReadinessTimeoutException}: a live endpoint never accepted a connection;</li>
 *   <li>{@link TypeMismatchException}: a constructor produced a value of the wrong type;</li>
 *   <li>{@link ResourceLifecycleException}: a resource factory or cleanup failed with a checked exception.</li>
 * </ul>
 */
public abstract class HarnessException extends RuntimeException
{
    /**
     * Enum representing the specific rule that was broken.
     */
    public enum Cause
    {
        MISSING_APPLICATION   ("%s needs an application bound at construction time, got null"),
        MISSING_CONSTRUCTOR   ("%s.createApp() returned no application constructor"),
        MISSING_TEST_METHOD   ("No test method '%s' taking %d parameter(s) in %s"),
        MISSING_TEST_NAME     ("Test case %s has no test method name; call setName(...) before running it"),
        INCOMPLETE_BINDING    ("Binding '%s' expects %d argument(s) but %d were supplied"),
        REENTRANT_RUN         ("Test case %s is already running '%s'; a case runs one test at a time"),
        NOT_INJECTED          ("'%s' has not been injected into %s; run it inside a LiveEndpointSuite"),
        NOT_PROVISIONED       ("Resource was disposed before it was provisioned (state %s)"),
        ALREADY_DISPOSED      ("Resource has already been disposed"),
        NO_YIELD              ("Generator-shaped constructor finished without yielding a resource"),
        UNKNOWN_CLIENT_OPTION ("Unknown client option '%s' (supported: %s)"),
        CLIENT_CLOSED         ("Client has been closed; it was scoped to a single test"),
        ADDRESS_IN_USE        ("Live endpoint %s:%d already serves another application"),
        NOT_A_TEST_CASE       ("%s is not a concrete TestCase subclass with a no-arg constructor"),
        MULTIPLE_YIELDS       ("Generator-shaped constructor yielded a second value (%s); exactly one yield is supported"),
        READINESS_TIMEOUT     ("Live endpoint %s:%d did not accept a connection within %s"),
        SERVER_FAILED         ("Live endpoint %s:%d stopped before accepting a connection"),
        TYPE_MISMATCH         ("Expected a constructor producing %s but it produced %s"),
        RESOURCE_FAILED       ("Resource %s failed");

        private final String messageTemplate;

        Cause(String messageTemplate)
        {   this.messageTemplate = messageTemplate;
        }

        public String format(Object... args)
        {   return String.format(messageTemplate, args);
        }

        public String getMessageTemplate()
        {   return messageTemplate;
        }

        public String getCode()
        {   return this.name();
        }
    }

    private final Cause causeEnum;

    protected HarnessException(Cause causeEnum, String message, Throwable cause)
    {   super(message, cause);
        this.causeEnum = causeEnum;
    }

    /**
     * Returns the rule that was broken.
     */
    public Cause getCauseEnum()
    {   return causeEnum;
    }

    /**
     * Returns the exception message followed, if present, by the message of its cause:
     * <pre>
     * UsageException: Main error message | Caused by: CauseClass: Cause message
     * </pre>
     */
    @Override
    public String toString()
    {
        String errMsg = String.format("%s: %s", this.getClass().getSimpleName(), this.getMessage());

        Throwable cause = getCause();
        if (     cause != null && cause.getMessage() != null
              && !cause.getMessage().isBlank())
        {   errMsg += String.format(" | Caused by: %s: %s", cause.getClass().getSimpleName(), cause.getMessage());
        }
        return errMsg;
    }
}
