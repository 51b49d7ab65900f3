package com.fhi.libraries.app_unittest.spring;

import org.junit.jupiter.api.Assertions;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;


/**
 * Assertions on {@link ClientResponse}s, meant to be statically imported in tests.
 * Failures are {@link AssertionError}s, so the harness records them as test failures.
 */
public final class ResponseAssertions
{
    // Missing paths read as null instead of throwing
    private static final Configuration JSONPATH_CONF_LAX = Configuration.defaultConfiguration()
                                                                        .addOptions(Option.SUPPRESS_EXCEPTIONS);

    private ResponseAssertions()
    {
    }

    public static void assertStatus(ClientResponse response, int expectedStatus)
    {   Assertions.assertEquals(expectedStatus, response.getStatus(),
                                () -> "Unexpected HTTP status, body: " + preview(response));
    }

    /**
     * Asserts the whole body equals {@code expectedBody}.
     */
    public static void assertResponseEqual(ClientResponse response, String expectedBody)
    {   Assertions.assertEquals(expectedBody, response.getText());
    }

    public static void assertInResponse(String fragment, ClientResponse response)
    {
        String body = response.getText();
        if (body == null || !body.contains(fragment))
        {   Assertions.fail("'" + fragment + "' not found in response body: " + preview(response));
        }
    }

    /**
     * Asserts the value at {@code path} of the JSON body. Numbers are compared by value,
     * so {@code 1} matches {@code 1L}.
     */
    public static void assertJsonPath(ClientResponse response, String path, Object expected)
    {
        Object actual = JsonPath.using(JSONPATH_CONF_LAX).parse(response.getText()).read(path);
        if (expected instanceof Number && actual instanceof Number)
        {   Assertions.assertEquals(((Number) expected).doubleValue(), ((Number) actual).doubleValue(),
                                    "JSON value at " + path);
            return;
        }
        Assertions.assertEquals(expected, actual, "JSON value at " + path);
    }

    public static void assertRedirectsTo(ClientResponse response, String expectedLocation)
    {
        int status = response.getStatus();
        Assertions.assertTrue(status >= 300 && status < 400, () -> "Expected a redirect, got HTTP " + status);
        String location = response.getRedirectUrl() != null ? response.getRedirectUrl() : response.getHeader("Location");
        Assertions.assertEquals(expectedLocation, location, "Redirect location");
    }

    private static String preview(ClientResponse response)
    {
        String text = response.getText();
        if (text == null || text.isBlank()) return "<empty>";
        return text.length() > 500 ? text.substring(0, 500) + "..." : text;
    }
}
