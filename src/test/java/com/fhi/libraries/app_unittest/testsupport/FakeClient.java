package com.fhi.libraries.app_unittest.testsupport;

import java.util.Map;

import com.fhi.libraries.app_unittest.handle.ClientHandle;

import lombok.Getter;

/**
 * Client of a {@link FakeApplication}; remembers how it was opened.
 */
@Getter
public class FakeClient implements ClientHandle
{
    private final FakeApplication     app;
    private final int                 id;
    private final boolean             useCookies;
    private final Map<String, Object> options;
    private boolean                   closed;

    FakeClient(FakeApplication app, int id, boolean useCookies, Map<String, Object> options)
    {   this.app        = app;
        this.id         = id;
        this.useCookies = useCookies;
        this.options    = options;
    }

    @Override
    public void close()
    {   closed = true;
        app.getEvents().add("client" + id + ".close");
    }

    @Override
    public String toString()
    {   return "FakeClient#" + id;
    }
}
