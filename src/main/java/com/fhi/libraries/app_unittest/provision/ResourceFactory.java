package com.fhi.libraries.app_unittest.provision;

/**
 * Plain resource constructor: returns exactly one resource.
 */
@FunctionalInterface
public interface ResourceFactory<R>
{
    R create() throws Exception;
}
