package com.fhi.libraries.app_unittest.provision;

/**
 * A provisioned resource together with the means to dispose of it.
 *
 * <p>Disposal happens exactly once; a second call is a
 * {@link com.fhi.libraries.app_unittest.exception.UsageException}.</p>
 */
public abstract class Provision<R> implements Disposer, AutoCloseable
{
    /**
     * Returns the provisioned resource.
     */
    public abstract R resource();

    @Override
    public abstract void dispose();

    /**
     * Same as {@link #dispose()}, for try-with-resources.
     */
    @Override
    public void close()
    {   dispose();
    }
}
