package com.fhi.libraries.app_unittest.provision;

import java.util.Objects;

import com.fhi.libraries.app_unittest.exception.ResourceLifecycleException;
import com.fhi.libraries.app_unittest.exception.TypeMismatchException;

import lombok.extern.slf4j.Slf4j;


/**
 * Turns a {@link ResourceConstructor} into a {@link Provision}: the resource plus its disposer.
 *
 * <ul>
 *   <li>plain constructor: the factory is invoked once; disposal runs the teardown hook if
 *       there is one and does nothing otherwise;</li>
 *   <li>generator-shaped constructor: the generator is advanced to its single yield; disposal
 *       resumes it once and expects it to finish (see {@link GeneratorProvision}).</li>
 * </ul>
 *
 * <p>The produced resource must be an instance of the expected type; otherwise the
 * resource is released again and a {@link TypeMismatchException} is raised.</p>
 */
@Slf4j
public class ResourceProvisioner
{
    public <R> Provision<R> provision(ResourceConstructor<? extends R> constructor, Class<R> expectedType)
    {
        Objects.requireNonNull(constructor, "constructor");
        Objects.requireNonNull(expectedType, "expectedType");
        log.debug("Provisioning {} from a {} constructor", expectedType.getSimpleName(), constructor.shape());

        Provision<? extends R> provision;
        if (constructor.isGenerating())
        {   provision = provisionGenerating((ResourceConstructor.Generating<? extends R>) constructor);
        }
        else
        {   provision = provisionPlain((ResourceConstructor.Plain<? extends R>) constructor);
        }

        Object resource = provision.resource();
        if (!expectedType.isInstance(resource))
        {   TypeMismatchException mismatch = TypeMismatchException.of(expectedType, resource);
            releaseQuietly(provision, mismatch);
            throw mismatch;
        }

        return narrow(provision);
    }


    private <R> Provision<R> provisionPlain(ResourceConstructor.Plain<R> plain)
    {
        R resource;
        try
        {   resource = plain.factory.create();
        }
        catch (RuntimeException e)
        {   throw e;
        }
        catch (Exception e)
        {   throw ResourceLifecycleException.failed("creation", e);
        }
        return new PlainProvision<>(resource, plain.closer);
    }

    private <R> Provision<R> provisionGenerating(ResourceConstructor.Generating<R> generating)
    {
        GeneratorProvision<R> provision = new GeneratorProvision<>(generating.generator);
        provision.acquire();
        return provision;
    }

    /**
     * A value of the wrong type still went through its constructor; run its cleanup
     * unless it is a plain value whose teardown hook only accepts the right type.
     */
    private static void releaseQuietly(Provision<?> provision, TypeMismatchException mismatch)
    {
        if (provision instanceof PlainProvision) return;
        try
        {   provision.dispose();
        }
        catch (RuntimeException e)
        {   mismatch.addSuppressed(e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <R> Provision<R> narrow(Provision<? extends R> provision)
    {   return (Provision<R>) provision;
    }
}
