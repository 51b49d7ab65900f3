package com.fhi.libraries.app_unittest.spring;

import static com.fhi.libraries.app_unittest.spring.ResponseAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.TestSocketUtils;
import org.springframework.web.client.RestTemplate;

import com.fhi.libraries.app_unittest.cases.AppClientTestCase;
import com.fhi.libraries.app_unittest.cases.AppTestCase;
import com.fhi.libraries.app_unittest.cases.ClientTestCase;
import com.fhi.libraries.app_unittest.cases.LiveTestCase;
import com.fhi.libraries.app_unittest.handle.ApplicationHandle;
import com.fhi.libraries.app_unittest.harness.TestLoader;
import com.fhi.libraries.app_unittest.harness.TestResult;
import com.fhi.libraries.app_unittest.harness.TestRunner;
import com.fhi.libraries.app_unittest.live.LiveTestLoader;
import com.fhi.libraries.app_unittest.provision.ResourceConstructor;
import com.fhi.libraries.app_unittest.sample.GreetingApplication;

import lombok.extern.slf4j.Slf4j;

/**
 * The test case variants driving a real Spring Boot application.
 */
@Slf4j
class SpringHarnessIntegrationTest
{
    static SpringApplicationHandle sharedApp;

    static final List<Path>                    DATA_DIRS = Collections.synchronizedList(new ArrayList<>());
    static final List<SpringApplicationHandle> HANDLES   = Collections.synchronizedList(new ArrayList<>());


    static class GreetingClientCase extends ClientTestCase<MockMvcClient>
    {
        GreetingClientCase()
        {   super(sharedApp);
        }

        public void testLoginKeepsSession(MockMvcClient client)
        {   client.post("/login", Map.of("username", "ada"));
            assertResponseEqual(client.get("/whoami"), "ada");
        }

        public void testNewClientIsAnonymous(MockMvcClient client)
        {   assertResponseEqual(client.get("/whoami"), "anonymous");
            assertNull(client.getCookie("remember"));
        }
    }

    static class IsolatedDataCase extends AppClientTestCase<SpringApplicationHandle, MockMvcClient>
    {
        @Override
        protected ResourceConstructor<SpringApplicationHandle> createApp()
        {   return SpringApplicationHandle.builder(GreetingApplication.class)
                                          .isolatedDataDirectory("app.data-dir")
                                          .constructor();
        }

        public void testOwnDataDirectory(SpringApplicationHandle app, MockMvcClient client)
        {   Path dir = Path.of(client.get("/data-dir").getText());
            assertTrue(Files.isDirectory(dir));
            assertEquals(dir.toString(), app.getConfig().get("app.data-dir"));
            DATA_DIRS.add(dir);
            HANDLES.add(app);
        }

        public void testSecondDataDirectory(SpringApplicationHandle app, MockMvcClient client)
        {   testOwnDataDirectory(app, client);
        }
    }

    static class PlainAppCase extends AppTestCase<SpringApplicationHandle>
    {
        @Override
        protected ResourceConstructor<SpringApplicationHandle> createApp()
        {   return SpringApplicationHandle.builder(GreetingApplication.class)
                                          .property("greeting.salutation", "Hi")
                                          .constructor();
        }

        public void testConfiguredApp(SpringApplicationHandle app)
        {   assertEquals("Hi", app.getProperty("greeting.salutation"));
            HANDLES.add(app);
        }
    }

    static class GreetingLiveCase extends LiveTestCase
    {
        public void testHelloOverHttp()
        {   String body = new RestTemplate().getForObject(getServerUrl() + "/hello?name=live", String.class);
            assertEquals("Hello, live!", body);
        }
    }


    @BeforeEach
    void clear()
    {   DATA_DIRS.clear();
        HANDLES.clear();
    }

    @Test
    @DisplayName("Clients of a shared application never leak session state into the next test")
    void testClientIsolationBetweenTests()
    {
        // GIVEN
        sharedApp = SpringApplicationHandle.builder(GreetingApplication.class).build();
        try
        {   // WHEN
            TestResult result = new TestRunner().run(new TestLoader().loadTestsFromTestCase(GreetingClientCase.class));

            // THEN
            assertEquals(2, result.getTestsRun());
            assertTrue(result.wasSuccessful(), () -> result.toString());
        }
        finally
        {   sharedApp.close();
        }
    }

    @Test
    @DisplayName("Isolated data directories exist during the test and are deleted afterwards")
    void testIsolatedDataDirectories()
    {
        // WHEN
        TestResult result = new TestRunner().run(new TestLoader().loadTestsFromTestCase(IsolatedDataCase.class));

        // THEN
        assertTrue(result.wasSuccessful(), () -> result.toString());
        assertEquals(2, DATA_DIRS.size());
        assertNotEquals(DATA_DIRS.get(0), DATA_DIRS.get(1));
        for (Path dir : DATA_DIRS)
        {   assertFalse(Files.exists(dir), dir + " should have been deleted");
        }
        for (SpringApplicationHandle handle : HANDLES)
        {   assertTrue(handle.isClosed());
        }
    }

    @Test
    @DisplayName("A plain application constructor closes the handle after the test")
    void testPlainConstructor()
    {
        TestResult result = new TestRunner().run(new TestLoader().loadTestsFromTestCase(PlainAppCase.class));

        assertTrue(result.wasSuccessful(), () -> result.toString());
        assertEquals(1, HANDLES.size());
        assertTrue(HANDLES.get(0).isClosed());
    }

    @Test
    @DisplayName("A live suite serves the application on a real port for LiveTestCases")
    void testLiveEndpoint()
    {
        // GIVEN an application configured for a free port
        int port = TestSocketUtils.findAvailableTcpPort();
        SpringApplicationHandle app = SpringApplicationHandle.builder(GreetingApplication.class)
                                                             .host("127.0.0.1")
                                                             .port(port)
                                                             .build();
        assertEquals(port, app.getConfig().get(ApplicationHandle.CONFIG_PORT));
        try
        {   // WHEN
            TestResult result = new TestRunner().run(
                    new LiveTestLoader(app, Duration.ofSeconds(60)).loadTestsFromTestCase(GreetingLiveCase.class));

            // THEN
            assertTrue(result.wasSuccessful(), () -> result.toString());
            assertEquals(1, result.getTestsRun());
        }
        finally
        {   app.close();
        }
    }
}
