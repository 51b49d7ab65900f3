package com.fhi.libraries.app_unittest.harness;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Reflection helpers for finding test methods on {@link TestCase} subclasses.
 */
final class TestMethods
{
    static final String TEST_METHOD_PREFIX = "test";

    private TestMethods()
    {
    }

    /**
     * Finds the instance method {@code name} with {@code arity} parameters, searching from
     * {@code type} up to (excluding) {@link TestCase}. Any visibility is accepted.
     *
     * @return the method, made accessible, or null if there is none
     */
    static Method find(Class<?> type, String name, int arity)
    {
        for (Class<?> c = type; c != null && c != TestCase.class; c = c.getSuperclass())
        {   for (Method m : c.getDeclaredMethods())
            {   if (     m.getName().equals(name)
                      && m.getParameterCount() == arity
                      && isCandidate(m))
                {   m.setAccessible(true);
                    return m;
                }
            }
        }
        return null;
    }

    /**
     * Names of all public instance methods starting with {@value #TEST_METHOD_PREFIX},
     * declared anywhere between {@code type} and {@link TestCase}, sorted alphabetically.
     * Non-public {@code test*} methods are helpers, not tests.
     */
    static List<String> names(Class<?> type)
    {
        TreeSet<String> names = new TreeSet<>();
        for (Class<?> c = type; c != null && c != TestCase.class; c = c.getSuperclass())
        {   for (Method m : c.getDeclaredMethods())
            {   if (     m.getName().startsWith(TEST_METHOD_PREFIX)
                      && Modifier.isPublic(m.getModifiers())
                      && isCandidate(m))
                {   names.add(m.getName());
                }
            }
        }
        return new ArrayList<>(names);
    }

    private static boolean isCandidate(Method m)
    {   return !Modifier.isStatic(m.getModifiers())
            && !m.isBridge()
            && !m.isSynthetic()
            && m.getReturnType() == void.class;
    }
}
