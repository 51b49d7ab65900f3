package com.fhi.libraries.app_unittest.provision;

/**
 * Hands the resource of a {@link ResourceGenerator} over to the harness.
 */
@FunctionalInterface
public interface ResourceYield<R>
{
    /**
     * Publishes the resource and suspends until the resource is disposed.
     * Must be called exactly once per generator run.
     */
    void accept(R resource);
}
