package com.fhi.libraries.app_unittest.harness;

import java.util.Objects;

/**
 * A member of a {@link TestSuite}: either a single test (leaf) or a nested suite (group).
 * Which one is decided once, when the test is added.
 */
public abstract class SuiteEntry
{
    public enum Kind { LEAF, GROUP }

    private SuiteEntry()
    {
    }

    public static SuiteEntry of(Test test)
    {   Objects.requireNonNull(test, "test");
        return test instanceof TestSuite ? new Group((TestSuite) test) : new Leaf(test);
    }

    public abstract Kind getKind();

    public abstract Test getTest();

    public boolean isGroup()
    {   return getKind() == Kind.GROUP;
    }

    /**
     * @throws IllegalStateException if this entry is a leaf
     */
    public TestSuite asGroup()
    {   if (!isGroup()) throw new IllegalStateException(getTest() + " is a leaf, not a group");
        return (TestSuite) getTest();
    }


    static final class Leaf extends SuiteEntry
    {
        private final Test test;

        Leaf(Test test)
        {   this.test = test;
        }

        @Override public Kind getKind() { return Kind.LEAF; }
        @Override public Test getTest() { return test; }
    }


    static final class Group extends SuiteEntry
    {
        private final TestSuite suite;

        Group(TestSuite suite)
        {   this.suite = suite;
        }

        @Override public Kind getKind() { return Kind.GROUP; }
        @Override public Test getTest() { return suite; }
    }
}
