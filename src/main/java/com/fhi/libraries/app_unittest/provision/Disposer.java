package com.fhi.libraries.app_unittest.provision;

import java.util.Arrays;
import java.util.List;

/**
 * Releases whatever a provisioning step acquired.
 */
@FunctionalInterface
public interface Disposer
{
    Disposer NONE = () -> {};

    void dispose();

    /**
     * Runs every disposer in the given order, even when one of them fails.
     * The first failure is rethrown once all have run, later ones are attached to it as
     * suppressed exceptions.
     */
    static Disposer inOrder(Disposer... disposers)
    {   List<Disposer> steps = List.copyOf(Arrays.asList(disposers));
        return () -> DisposerChain.disposeAll(steps);
    }
}
