package com.fhi.libraries.app_unittest.cases;

import java.util.Map;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.fhi.libraries.app_unittest.config.HarnessProperties;
import com.fhi.libraries.app_unittest.handle.ApplicationHandle;
import com.fhi.libraries.app_unittest.handle.ClientHandle;
import com.fhi.libraries.app_unittest.provision.Disposer;
import com.fhi.libraries.app_unittest.provision.ResourceConstructor;
import com.fhi.libraries.app_unittest.provision.ResourceProvisioner;

/**
 * Helpers shared by the resource-injecting test case variants.
 */
final class CaseSupport
{
    static final ResourceProvisioner DEFAULT_PROVISIONER = new ResourceProvisioner();

    private CaseSupport()
    {
    }

    /**
     * Resolves the {@code index}-th type argument that {@code concrete} binds for {@code generic},
     * e.g. {@code A} of {@code AppTestCase<A>}. Falls back to {@code Object} when the argument
     * is not fixed by the class hierarchy.
     */
    @SuppressWarnings("unchecked")
    static <T> Class<T> typeArgument(Class<?> concrete, Class<?> generic, int index)
    {
        JavaType[] params = TypeFactory.defaultInstance().findTypeParameters(concrete, generic);
        if (params == null || params.length <= index)
        {   return (Class<T>) Object.class;
        }
        return (Class<T>) params[index].getRawClass();
    }

    /**
     * A plain constructor opening a client on {@code app}; closing the client is its teardown hook.
     */
    static <C extends ClientHandle> ResourceConstructor<C> clientConstructor(ApplicationHandle<? extends C> app,
                                                                          boolean useCookies,
                                                                          Map<String, Object> options)
    {
        return ResourceConstructor.of(() -> app.openClient(useCookies, options), ClientHandle::close);
    }

    static boolean defaultUseCookies()
    {   return HarnessProperties.get().getClient().isUseCookies();
    }

    /**
     * Disposes {@code acquired} after a later acquisition failed, keeping the original failure.
     */
    static RuntimeException releaseAfterFailure(RuntimeException failure, Disposer acquired)
    {
        try
        {   acquired.dispose();
        }
        catch (RuntimeException e)
        {   failure.addSuppressed(e);
        }
        return failure;
    }
}
