package com.fhi.libraries.app_unittest.provision;

import java.util.function.Consumer;

import com.fhi.libraries.app_unittest.exception.UsageException;

final class PlainProvision<R> extends Provision<R>
{
    private final R                   resource;
    private final Consumer<? super R> closer;
    private boolean                   disposed;

    PlainProvision(R resource, Consumer<? super R> closer)
    {   this.resource = resource;
        this.closer   = closer;
    }

    @Override
    public R resource()
    {   return resource;
    }

    @Override
    public void dispose()
    {
        if (disposed) throw UsageException.alreadyDisposed();
        disposed = true;
        if (closer != null)
        {   closer.accept(resource);
        }
    }
}
