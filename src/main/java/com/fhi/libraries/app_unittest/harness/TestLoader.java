package com.fhi.libraries.app_unittest.harness;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

import com.fhi.libraries.app_unittest.exception.UsageException;

import lombok.extern.slf4j.Slf4j;


/**
 * Builds suites out of {@link TestCase} subclasses.
 *
 * <p>Every instance method whose name starts with {@code test} becomes one test, in
 * alphabetical order; each gets its own instance, created with the no-arg constructor.
 * Subclasses choose the suite type by overriding {@link #createSuite(List)}.</p>
 */
@Slf4j
public class TestLoader
{
    public TestSuite loadTestsFromTestCase(Class<? extends TestCase> testCaseClass)
    {
        List<Test> tests = new ArrayList<>();
        for (String name : TestMethods.names(testCaseClass))
        {   tests.add(instantiate(testCaseClass, name));
        }
        log.debug("Loaded {} test(s) from {}", tests.size(), testCaseClass.getSimpleName());
        return createSuite(tests);
    }

    /**
     * One suite per class, grouped in a suite.
     */
    @SafeVarargs
    public final TestSuite loadTestsFromTestCases(Class<? extends TestCase>... testCaseClasses)
    {
        List<Test> suites = new ArrayList<>();
        for (Class<? extends TestCase> testCaseClass : testCaseClasses)
        {   suites.add(loadTestsFromTestCase(testCaseClass));
        }
        return createSuite(suites);
    }

    /**
     * Creates an instance of {@code testCaseClass} running the test method {@code name}.
     *
     * @throws UsageException if the class cannot be instantiated or has no such test method
     */
    public <T extends TestCase> T instantiate(Class<T> testCaseClass, String name)
    {
        if (Modifier.isAbstract(testCaseClass.getModifiers())) throw UsageException.notATestCase(testCaseClass, null);

        T testCase;
        try
        {   Constructor<T> constructor = testCaseClass.getDeclaredConstructor();
            constructor.setAccessible(true);
            testCase = constructor.newInstance();
        }
        catch (InvocationTargetException e)
        {   if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
            throw UsageException.notATestCase(testCaseClass, e.getCause());
        }
        catch (ReflectiveOperationException e)
        {   throw UsageException.notATestCase(testCaseClass, e);
        }

        testCase.setName(name);
        return testCase;
    }

    protected TestSuite createSuite(List<Test> tests)
    {   return new TestSuite(tests);
    }
}
