package com.fhi.libraries.app_unittest.spring;

import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fhi.libraries.app_unittest.exception.UsageException;
import com.fhi.libraries.app_unittest.handle.ClientHandle;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;


/**
 * A simulated client issuing requests through {@link MockMvc}, without any socket.
 *
 * <p>With cookies on, the client behaves like a browser tab: cookies set by responses
 * are sent back with later requests, and all requests share one HTTP session until the
 * application invalidates it. With cookies off, every request starts from scratch.</p>
 *
 * <p>Options:</p>
 * <ul>
 *   <li>{@value #OPTION_HEADERS}: a {@code Map} of headers added to every request;</li>
 *   <li>{@value #OPTION_PRINT}: {@code true} prints every exchange to the console.</li>
 * </ul>
 */
@Slf4j
public class MockMvcClient implements ClientHandle
{
    public static final String OPTION_HEADERS = "headers";
    public static final String OPTION_PRINT   = "print";

    private static final Set<String> SUPPORTED_OPTIONS = new TreeSet<>(List.of(OPTION_HEADERS, OPTION_PRINT));

    private static final ObjectMapper JSON = new ObjectMapper();

    private final MockMvc             mockMvc;
    private final boolean             useCookies;
    private final Map<String, String> defaultHeaders;
    private final boolean             print;
    private final Map<String, Cookie> cookieJar = new LinkedHashMap<>();

    private MockHttpSession session = new MockHttpSession();
    private boolean         closed;


    /**
     * @throws UsageException on an option key other than {@value #OPTION_HEADERS} and {@value #OPTION_PRINT}
     */
    public MockMvcClient(MockMvc mockMvc, boolean useCookies, Map<String, Object> options)
    {
        Map<String, Object> opts = options == null ? Map.of() : options;
        for (String key : opts.keySet())
        {   if (!SUPPORTED_OPTIONS.contains(key)) throw UsageException.unknownClientOption(key, SUPPORTED_OPTIONS);
        }

        this.mockMvc        = mockMvc;
        this.useCookies     = useCookies;
        this.defaultHeaders = toHeaders(opts.get(OPTION_HEADERS));
        this.print          = Boolean.TRUE.equals(opts.get(OPTION_PRINT))
                              || "true".equalsIgnoreCase(String.valueOf(opts.get(OPTION_PRINT)));
    }


    // -----------------------------------------
    // Requests
    // -----------------------------------------

    public ClientResponse get(String uriTemplate, Object... uriVars)
    {   return perform(MockMvcRequestBuilders.get(uriTemplate, uriVars));
    }

    /**
     * Posts {@code form} as {@code application/x-www-form-urlencoded}.
     */
    public ClientResponse post(String uri, Map<String, String> form)
    {
        MockHttpServletRequestBuilder req = MockMvcRequestBuilders.post(uri)
                                                                  .contentType(MediaType.APPLICATION_FORM_URLENCODED);
        if (form != null) form.forEach(req::param);
        return perform(req);
    }

    /**
     * Posts {@code body} serialized as JSON.
     */
    public ClientResponse postJson(String uri, Object body)
    {   return perform(withJson(MockMvcRequestBuilders.post(uri), body));
    }

    public ClientResponse put(String uri, Object body)
    {   return perform(withJson(MockMvcRequestBuilders.put(uri), body));
    }

    public ClientResponse delete(String uriTemplate, Object... uriVars)
    {   return perform(MockMvcRequestBuilders.delete(uriTemplate, uriVars));
    }

    /**
     * Sends a request built by the caller, adding default headers, cookies and the session.
     *
     * @throws UsageException if the client has been closed
     */
    public ClientResponse perform(MockHttpServletRequestBuilder request)
    {
        if (closed) throw UsageException.clientClosed();

        defaultHeaders.forEach(request::header);
        if (useCookies)
        {   if (!cookieJar.isEmpty()) request.cookie(cookieJar.values().toArray(new Cookie[0]));
            request.session(session);
        }

        MvcResult result;
        try
        {   ResultActions actions = mockMvc.perform(request);
            if (print) actions.andDo(print());
            result = actions.andReturn();
        }
        catch (RuntimeException e)
        {   throw e;
        }
        catch (Exception e)
        {   throw new IllegalStateException("Error performing request: " + e.getMessage(), e);
        }

        MockHttpServletResponse response = result.getResponse();
        log.debug("{} {} -> {}", result.getRequest().getMethod(), result.getRequest().getRequestURI(), response.getStatus());
        if (useCookies) remember(result);
        return new ClientResponse(response);
    }


    // -----------------------------------------
    // State
    // -----------------------------------------

    public boolean isUseCookies()
    {   return useCookies;
    }

    /**
     * Value of the cookie the client currently holds, null if none.
     */
    public String getCookie(String name)
    {   Cookie cookie = cookieJar.get(name);
        return cookie == null ? null : cookie.getValue();
    }

    public Map<String, String> getCookies()
    {   Map<String, String> values = new LinkedHashMap<>();
        cookieJar.forEach((name, cookie) -> values.put(name, cookie.getValue()));
        return Collections.unmodifiableMap(values);
    }

    /**
     * The session shared by requests of this client; only meaningful with cookies on.
     */
    public MockHttpSession getSession()
    {   return session;
    }

    @Override
    public boolean isClosed()
    {   return closed;
    }

    @Override
    public void close()
    {
        if (closed) return;
        closed = true;
        cookieJar.clear();
        if (!session.isInvalid()) session.invalidate();
    }


    private void remember(MvcResult result)
    {
        for (Cookie cookie : result.getResponse().getCookies())
        {   if (cookie.getMaxAge() == 0) cookieJar.remove(cookie.getName());
            else                         cookieJar.put(cookie.getName(), cookie);
        }

        // the application may have replaced the session, e.g. on login
        HttpSession current = result.getRequest().getSession(false);
        if (current instanceof MockHttpSession && !((MockHttpSession) current).isInvalid())
        {   session = (MockHttpSession) current;
        }
        else if (session.isInvalid())
        {   session = new MockHttpSession();
        }
    }

    private static MockHttpServletRequestBuilder withJson(MockHttpServletRequestBuilder req, Object body)
    {
        req.contentType(MediaType.APPLICATION_JSON);
        if (body == null) return req;
        try
        {   return req.content(body instanceof String ? (String) body : JSON.writeValueAsString(body));
        }
        catch (JsonProcessingException e)
        {   throw new IllegalArgumentException("Request body cannot be written as JSON: " + body, e);
        }
    }

    private static Map<String, String> toHeaders(Object option)
    {
        if (option == null) return Map.of();
        if (!(option instanceof Map))
        {   throw new IllegalArgumentException("Client option '" + OPTION_HEADERS + "' must be a Map, got " + option);
        }
        Map<String, String> headers = new LinkedHashMap<>();
        ((Map<?, ?>) option).forEach((k, v) -> headers.put(String.valueOf(k), String.valueOf(v)));
        return Collections.unmodifiableMap(headers);
    }
}
