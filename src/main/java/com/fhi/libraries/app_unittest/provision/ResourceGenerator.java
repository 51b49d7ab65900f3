package com.fhi.libraries.app_unittest.provision;

/**
 * Generator-shaped resource constructor.
 *
 * <p>The body builds the resource, hands it over with exactly one
 * {@link ResourceYield#accept(Object)} call, and cleans up once that call returns, which
 * happens when the test using the resource is over:</p>
 * <pre>{@code
 * ResourceConstructor.generating(out -> {
 *     Path dir = Files.createTempDirectory("db");
 *     try {
 *         out.accept(buildApp(dir));
 *     } finally {
 *         FileSystemUtils.deleteRecursively(dir);
 *     }
 * });
 * }</pre>
 *
 * <p>The body runs on its own thread; it is suspended inside {@code accept} while the
 * test runs. Thread-bound state the body sets up around {@code accept} (a
 * {@code ThreadLocal}, a security or locale context holder, an MDC entry) is therefore
 * not visible to the test, which runs on the caller's thread. Hand such state over as
 * part of the yielded resource instead.</p>
 */
@FunctionalInterface
public interface ResourceGenerator<R>
{
    void generate(ResourceYield<R> out) throws Exception;
}
