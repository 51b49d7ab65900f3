package com.fhi.libraries.app_unittest.testsupport;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered record of what fakes and test cases did, shared across threads.
 */
public class EventLog
{
    private final List<String> events = new ArrayList<>();

    public synchronized void add(String event)
    {   events.add(event);
    }

    public synchronized List<String> events()
    {   return List.copyOf(events);
    }

    public synchronized int count(String event)
    {   return (int) events.stream().filter(event::equals).count();
    }

    public synchronized void clear()
    {   events.clear();
    }

    @Override
    public synchronized String toString()
    {   return events.toString();
    }
}
