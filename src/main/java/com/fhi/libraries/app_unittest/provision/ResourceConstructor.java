package com.fhi.libraries.app_unittest.provision;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A nullary resource constructor in one of two shapes:
 * <ul>
 *   <li><b>plain</b>: a {@link ResourceFactory} returning the resource, optionally paired with a
 *       teardown hook;</li>
 *   <li><b>generator-shaped</b>: a {@link ResourceGenerator} yielding the resource exactly once and
 *       cleaning up after it is resumed.</li>
 * </ul>
 * Turned into a resource and its disposer by {@link ResourceProvisioner}.
 */
public abstract class ResourceConstructor<R>
{
    private ResourceConstructor()
    {
    }

    public static <R> ResourceConstructor<R> of(ResourceFactory<R> factory)
    {   return new Plain<>(factory, null);
    }

    /**
     * @param closer teardown hook run when the resource is disposed
     */
    public static <R> ResourceConstructor<R> of(ResourceFactory<R> factory, Consumer<? super R> closer)
    {   return new Plain<>(factory, Objects.requireNonNull(closer, "closer"));
    }

    public static <R> ResourceConstructor<R> generating(ResourceGenerator<R> generator)
    {   return new Generating<>(generator);
    }

    public abstract boolean isGenerating();

    /**
     * A short name of the constructor shape, used in messages.
     */
    public String shape()
    {   return isGenerating() ? "generator" : "plain";
    }


    static final class Plain<R> extends ResourceConstructor<R>
    {
        final ResourceFactory<R>    factory;
        final Consumer<? super R>   closer;

        Plain(ResourceFactory<R> factory, Consumer<? super R> closer)
        {   this.factory = Objects.requireNonNull(factory, "factory");
            this.closer  = closer;
        }

        @Override
        public boolean isGenerating()
        {   return false;
        }
    }


    static final class Generating<R> extends ResourceConstructor<R>
    {
        final ResourceGenerator<R> generator;

        Generating(ResourceGenerator<R> generator)
        {   this.generator = Objects.requireNonNull(generator, "generator");
        }

        @Override
        public boolean isGenerating()
        {   return true;
        }
    }
}
