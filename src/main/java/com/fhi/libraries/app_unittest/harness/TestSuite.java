package com.fhi.libraries.app_unittest.harness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered collection of tests and nested suites, run one after the other.
 */
public class TestSuite implements Test, Iterable<Test>
{
    private final List<SuiteEntry> entries = new ArrayList<>();

    public TestSuite()
    {
    }

    public TestSuite(Iterable<? extends Test> tests)
    {   addTests(tests);
    }

    public void addTest(Test test)
    {   entries.add(SuiteEntry.of(test));
    }

    public void addTests(Iterable<? extends Test> tests)
    {   for (Test test : tests)
        {   addTest(test);
        }
    }

    /**
     * The direct members of this suite, tagged leaf or group.
     */
    public List<SuiteEntry> getEntries()
    {   return Collections.unmodifiableList(entries);
    }

    @Override
    public Iterator<Test> iterator()
    {   return entries.stream()
                      .map(SuiteEntry::getTest)
                      .collect(Collectors.toUnmodifiableList())
                      .iterator();
    }

    @Override
    public int countTestCases()
    {   int count = 0;
        for (SuiteEntry entry : entries)
        {   count += entry.getTest().countTestCases();
        }
        return count;
    }

    /**
     * Runs the members in order, stopping early once {@link TestResult#shouldStop()}.
     */
    @Override
    public void run(TestResult result)
    {
        for (SuiteEntry entry : entries)
        {   if (result.shouldStop()) break;
            entry.getTest().run(result);
        }
    }

    @Override
    public void debug() throws Throwable
    {
        for (SuiteEntry entry : entries)
        {   entry.getTest().debug();
        }
    }

    @Override
    public String toString()
    {   return getClass().getSimpleName() + entries.stream()
                                                   .map(e -> String.valueOf(e.getTest()))
                                                   .collect(Collectors.joining(", ", "[", "]"));
    }
}
