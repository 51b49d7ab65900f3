package com.fhi.libraries.app_unittest.harness;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fhi.libraries.app_unittest.exception.HarnessException;
import com.fhi.libraries.app_unittest.exception.UsageException;

class TestSuiteTest
{
    static final List<String> RAN = new ArrayList<>();

    static class Alpha extends TestCase
    {
        public void testB() { RAN.add("Alpha.testB"); }
        public void testA() { RAN.add("Alpha.testA"); }
        public void testC() { RAN.add("Alpha.testC"); fail("C fails"); }
    }

    static class Beta extends TestCase
    {
        public void testOnly() { RAN.add("Beta.testOnly"); }
    }

    static class WithHelpers extends TestCase
    {
        public void testReal() { RAN.add("WithHelpers.testReal"); testHelper(); testLooksLike("x"); }

        private void testHelper() { RAN.add("WithHelpers.testHelper"); }

        protected void testLooksLike(String value) { RAN.add("WithHelpers.testLooksLike " + value); }
    }

    abstract static class Abstract extends TestCase
    {
        public void testNever() { }
    }

    static class ExplodingConstructor extends TestCase
    {
        ExplodingConstructor()
        {   throw new IllegalStateException("no instance for you");
        }

        public void testNever() { }
    }

    @BeforeEach
    void clear()
    {   RAN.clear();
    }

    @Test
    @DisplayName("Non-public test* methods are helpers, not tests, whatever their parameters")
    void testLoaderSkipsHelpers()
    {
        // WHEN
        TestSuite suite = new TestLoader().loadTestsFromTestCase(WithHelpers.class);
        TestResult result = new TestResult();
        suite.run(result);

        // THEN
        assertEquals(1, suite.countTestCases());
        assertEquals("testReal", ((TestCase) suite.getEntries().get(0).getTest()).getName());
        assertTrue(result.wasSuccessful(), () -> result.toString());
        assertEquals(List.of("WithHelpers.testReal", "WithHelpers.testHelper", "WithHelpers.testLooksLike x"), RAN);
    }

    @Test
    @DisplayName("The loader creates one named instance per test method, alphabetically")
    void testLoaderOrder()
    {
        // WHEN
        TestSuite suite = new TestLoader().loadTestsFromTestCase(Alpha.class);

        // THEN
        assertEquals(3, suite.countTestCases());
        List<String> names = new ArrayList<>();
        for (SuiteEntry entry : suite.getEntries())
        {   assertEquals(SuiteEntry.Kind.LEAF, entry.getKind());
            names.add(((TestCase) entry.getTest()).getName());
        }
        assertEquals(List.of("testA", "testB", "testC"), names);
    }

    @Test
    @DisplayName("Nested suites are tagged as groups when added; running walks them in order")
    void testNestedSuites()
    {
        // GIVEN a suite of two class suites
        TestSuite suite = new TestLoader().loadTestsFromTestCases(Alpha.class, Beta.class);

        // THEN its direct members are groups
        assertEquals(2, suite.getEntries().size());
        assertTrue(suite.getEntries().get(0).isGroup());
        assertEquals(4, suite.countTestCases());
        assertThrows(IllegalStateException.class,
                     () -> suite.getEntries().get(0).asGroup().getEntries().get(0).asGroup());

        // WHEN
        TestResult result = new TestResult();
        suite.run(result);

        // THEN
        assertEquals(List.of("Alpha.testA", "Alpha.testB", "Alpha.testC", "Beta.testOnly"), RAN);
        assertEquals(4, result.getTestsRun());
        assertEquals(1, result.getFailures().size());
    }

    @Test
    @DisplayName("With failFast the suite stops before the test after the first failure")
    void testFailFast()
    {
        TestSuite suite = new TestLoader().loadTestsFromTestCases(Alpha.class, Beta.class);
        TestResult result = new TestResult();
        result.setFailFast(true);

        suite.run(result);

        assertEquals(List.of("Alpha.testA", "Alpha.testB", "Alpha.testC"), RAN);
        assertTrue(result.shouldStop());
    }

    @Test
    @DisplayName("Classes that cannot be instantiated are reported as usage errors")
    void testNotATestCase()
    {
        TestLoader loader = new TestLoader();

        UsageException ex = assertThrows(UsageException.class, () -> loader.loadTestsFromTestCase(Abstract.class));
        assertEquals(HarnessException.Cause.NOT_A_TEST_CASE, ex.getCauseEnum());

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                                                    () -> loader.loadTestsFromTestCase(ExplodingConstructor.class));
        assertEquals("no instance for you", thrown.getMessage());
    }

    @Test
    @DisplayName("The runner returns the result of the whole run")
    void testRunner()
    {
        TestResult result = new TestRunner(false, false).run(new TestLoader().loadTestsFromTestCase(Beta.class));

        assertTrue(result.wasSuccessful());
        assertEquals(1, result.getTestsRun());
        assertEquals(List.of("Beta.testOnly"), RAN);
    }
}
