package com.fhi.libraries.app_unittest.spring;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.mock.web.MockHttpServletResponse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;

import jakarta.servlet.http.Cookie;


/**
 * What a {@link MockMvcClient} request returned.
 */
public class ClientResponse
{
    private static final ObjectMapper JSON = new ObjectMapper();

    private final MockHttpServletResponse response;

    public ClientResponse(MockHttpServletResponse response)
    {   this.response = response;
    }

    public int getStatus()
    {   return response.getStatus();
    }

    public String getHeader(String name)
    {   return response.getHeader(name);
    }

    public Map<String, List<String>> getHeaders()
    {   Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : response.getHeaderNames())
        {   headers.put(name, response.getHeaders(name));
        }
        return headers;
    }

    public String getContentType()
    {   return response.getContentType();
    }

    /**
     * Body decoded as UTF-8 unless the response names another charset.
     */
    public String getText()
    {
        try
        {   return response.getContentAsString(StandardCharsets.UTF_8);
        }
        catch (UnsupportedEncodingException e)
        {   throw new IllegalStateException("Response charset " + response.getCharacterEncoding() + " is not supported", e);
        }
    }

    public byte[] getBytes()
    {   return response.getContentAsByteArray();
    }

    /**
     * @throws IllegalStateException if the body is not JSON
     */
    public JsonNode json()
    {
        try
        {   return JSON.readTree(getText());
        }
        catch (JsonProcessingException e)
        {   throw new IllegalStateException("Response body is not JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads {@code path} from the JSON body, e.g. {@code $.owner.name}.
     */
    public <T> T read(String path)
    {   return JsonPath.parse(getText()).read(path);
    }

    public String getRedirectUrl()
    {   return response.getRedirectedUrl();
    }

    public String getCookie(String name)
    {   Cookie cookie = response.getCookie(name);
        return cookie == null ? null : cookie.getValue();
    }

    public MockHttpServletResponse getMockResponse()
    {   return response;
    }

    @Override
    public String toString()
    {   return "ClientResponse{status=" + getStatus() + ", contentType=" + getContentType() + "}";
    }
}
