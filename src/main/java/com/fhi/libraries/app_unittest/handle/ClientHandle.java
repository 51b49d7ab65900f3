package com.fhi.libraries.app_unittest.handle;

/**
 * A simulated request-issuing client, bound to one application and scoped to one test.
 */
public interface ClientHandle extends AutoCloseable
{
    boolean isClosed();

    /**
     * Releases the client. Calling it twice is harmless.
     */
    @Override
    void close();
}
