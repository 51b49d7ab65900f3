package com.fhi.libraries.app_unittest.cases;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fhi.libraries.app_unittest.exception.ContractViolationException;
import com.fhi.libraries.app_unittest.exception.HarnessException;
import com.fhi.libraries.app_unittest.exception.TypeMismatchException;
import com.fhi.libraries.app_unittest.exception.UsageException;
import com.fhi.libraries.app_unittest.harness.Binding;
import com.fhi.libraries.app_unittest.harness.TestResult;
import com.fhi.libraries.app_unittest.provision.ResourceConstructor;
import com.fhi.libraries.app_unittest.testsupport.EventLog;
import com.fhi.libraries.app_unittest.testsupport.FakeApplication;

class AppTestCaseTest
{
    static final EventLog EVENTS = new EventLog();

    // Applications the cases received, in order
    static final List<FakeApplication> INJECTED = Collections.synchronizedList(new ArrayList<>());


    /**
     * Plain constructor: one new application per test, closed as teardown hook.
     */
    static class PlainAppCase extends AppTestCase<FakeApplication>
    {
        final List<FakeApplication> created = new ArrayList<>();

        @Override
        protected ResourceConstructor<FakeApplication> createApp()
        {   return ResourceConstructor.of(() ->
                   {   FakeApplication app = new FakeApplication("app" + (created.size() + 1), EVENTS);
                       created.add(app);
                       return app;
                   },
                   FakeApplication::close);
        }

        @Override
        protected void setUp(FakeApplication app)
        {   EVENTS.add("setUp " + app.getName());
        }

        @Override
        protected void tearDown(FakeApplication app)
        {   EVENTS.add("tearDown " + app.getName());
        }

        public void testReceivesApp(FakeApplication app)
        {   INJECTED.add(app);
            assertEquals(1, created.size());
            assertSame(created.get(0), app);
        }

        public void testFails(FakeApplication app)
        {   assertEquals("someone else", app.getName());
        }
    }

    /**
     * Generator constructor yielding twice, with a finally block as spy.
     */
    static class DoubleYieldCase extends AppTestCase<FakeApplication>
    {
        @Override
        protected ResourceConstructor<FakeApplication> createApp()
        {   return ResourceConstructor.generating(out ->
            {   try
                {   out.accept(new FakeApplication("first", EVENTS));
                    EVENTS.add("resumed");
                    out.accept(new FakeApplication("second", EVENTS));
                }
                finally
                {   EVENTS.add("generator finally");
                }
            });
        }

        public void testSomething(FakeApplication app)
        {   EVENTS.add("test " + app.getName());
        }
    }

    static class GeneratorCase extends AppTestCase<FakeApplication>
    {
        @Override
        protected ResourceConstructor<FakeApplication> createApp()
        {   return ResourceConstructor.generating(out ->
            {   FakeApplication app = new FakeApplication("gen", EVENTS);
                EVENTS.add("created");
                out.accept(app);
                app.close();
            });
        }

        public void testSomething(FakeApplication app)
        {   EVENTS.add("test " + app.getName());
        }
    }

    static class FailingConstructorCase extends AppTestCase<FakeApplication>
    {
        @Override
        protected ResourceConstructor<FakeApplication> createApp()
        {   return ResourceConstructor.of(() -> { throw new IllegalStateException("cannot build app"); });
        }

        public void testNever(FakeApplication app)
        {   EVENTS.add("never");
        }
    }

    static class NoConstructorCase extends AppTestCase<FakeApplication>
    {
        @Override
        protected ResourceConstructor<FakeApplication> createApp()
        {   return null;
        }

        public void testNever(FakeApplication app)
        {
        }
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    static class WrongTypeCase extends AppTestCase<FakeApplication>
    {
        @Override
        protected ResourceConstructor<FakeApplication> createApp()
        {   return (ResourceConstructor) ResourceConstructor.of(() -> "not an application");
        }

        public void testNever(FakeApplication app)
        {
        }
    }


    @BeforeEach
    void clear()
    {   EVENTS.clear();
        INJECTED.clear();
    }

    @Test
    @DisplayName("The injected application is what the constructor returned; no override remains afterwards")
    void testInjectedAppAndRestoredBindings()
    {
        // GIVEN
        PlainAppCase testCase = new PlainAppCase();
        testCase.setName("testReceivesApp");
        Binding originalTest = testCase.getTestMethodBinding();
        TestResult result = new TestResult();

        // WHEN
        testCase.run(result);

        // THEN the test saw the constructed app, through setUp and tearDown too
        assertTrue(result.wasSuccessful(), () -> result.toString());
        assertEquals(List.of(testCase.created.get(0)), INJECTED);
        assertEquals(List.of("setUp app1", "tearDown app1", "app1.close"), EVENTS.events());

        // ...and the case is back to its original, unbound test method
        assertSame(originalTest, testCase.getTestMethodBinding());
        assertFalse(testCase.getTestMethodBinding().isPartial());
        assertEquals(1, testCase.getTestMethodBinding().getArity());
        assertFalse(testCase.isActive());
    }

    @Test
    @DisplayName("Every run gets a fresh application, disposed even when the test fails")
    void testFreshAppPerRun()
    {
        PlainAppCase testCase = new PlainAppCase();
        testCase.setName("testFails");
        TestResult result = new TestResult();

        testCase.run(result);
        testCase.run(result);

        assertEquals(2, testCase.created.size());
        assertNotSame(testCase.created.get(0), testCase.created.get(1));
        assertEquals(2, result.getFailures().size());
        assertEquals(1, EVENTS.count("app1.close"));
        assertEquals(1, EVENTS.count("app2.close"));
    }

    @Test
    @DisplayName("A generator constructor is resumed exactly once, after tearDown")
    void testGeneratorResumedOnce()
    {
        GeneratorCase testCase = new GeneratorCase();
        testCase.setName("testSomething");
        TestResult result = new TestResult();

        testCase.run(result);

        assertTrue(result.wasSuccessful());
        assertEquals(List.of("created", "test gen", "gen.close"), EVENTS.events());
    }

    @Test
    @DisplayName("A double-yield generator fails the run with a contract violation, bindings restored")
    void testDoubleYield()
    {
        // GIVEN
        DoubleYieldCase testCase = new DoubleYieldCase();
        testCase.setName("testSomething");
        TestResult result = new TestResult();

        // WHEN
        ContractViolationException ex = assertThrows(ContractViolationException.class, () -> testCase.run(result));

        // THEN the test itself ran and passed, the generator was unwound, the case restored
        assertEquals(HarnessException.Cause.MULTIPLE_YIELDS, ex.getCauseEnum());
        assertEquals(1, result.getSuccesses().size());
        assertEquals(List.of("test first", "resumed", "generator finally"), EVENTS.events());
        assertFalse(testCase.getTestMethodBinding().isPartial());
        assertFalse(testCase.isActive());
    }

    @Test
    @DisplayName("A failing constructor propagates before anything is rebound or run")
    void testConstructorFailure()
    {
        FailingConstructorCase testCase = new FailingConstructorCase();
        testCase.setName("testNever");
        TestResult result = new TestResult();

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> testCase.run(result));

        assertEquals("cannot build app", ex.getMessage());
        assertEquals(0, result.getTestsRun());
        assertTrue(EVENTS.events().isEmpty());
        assertFalse(testCase.getTestMethodBinding().isPartial());
    }

    @Test
    @DisplayName("Misconfigured cases are usage errors")
    void testUsageErrors()
    {
        NoConstructorCase noConstructor = new NoConstructorCase();
        noConstructor.setName("testNever");
        UsageException missing = assertThrows(UsageException.class, () -> noConstructor.run(new TestResult()));
        assertEquals(HarnessException.Cause.MISSING_CONSTRUCTOR, missing.getCauseEnum());

        WrongTypeCase wrongType = new WrongTypeCase();
        wrongType.setName("testNever");
        assertThrows(TypeMismatchException.class, () -> wrongType.run(new TestResult()));

        // test methods must take the application
        PlainAppCase plain = new PlainAppCase();
        UsageException arity = assertThrows(UsageException.class, () -> plain.setName("testMissing"));
        assertEquals(HarnessException.Cause.MISSING_TEST_METHOD, arity.getCauseEnum());
    }

    @Test
    @DisplayName("debug() throws the test failure after disposing the application")
    void testDebug()
    {
        PlainAppCase testCase = new PlainAppCase();
        testCase.setName("testFails");

        assertThrows(AssertionError.class, testCase::debug);

        assertEquals(1, EVENTS.count("app1.close"));
        assertFalse(testCase.isActive());
    }
}
