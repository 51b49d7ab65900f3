package com.fhi.libraries.app_unittest.harness;

import java.util.Arrays;
import java.util.Objects;

import com.fhi.libraries.app_unittest.exception.UsageException;

/**
 * A named step of a test case (setUp, the test method, tearDown) with a fixed number of
 * parameters, and possibly some of them already supplied.
 *
 * <p>A binding is immutable: {@link #partial(Object...)} returns a new binding with more
 * leading arguments and remembers the binding it was derived from. It can only be
 * {@linkplain #call() called} once all its parameters are supplied.</p>
 */
public final class Binding
{
    /**
     * The code behind a binding.
     */
    @FunctionalInterface
    public interface Target
    {
        void invoke(Object[] args) throws Throwable;
    }

    private static final Object[] NO_ARGS = new Object[0];

    private final String   name;
    private final int      arity;
    private final Target   target;
    private final Object[] leadingArgs;
    private final Binding  original;


    private Binding(String name, int arity, Target target, Object[] leadingArgs, Binding original)
    {   this.name        = name;
        this.arity       = arity;
        this.target      = target;
        this.leadingArgs = leadingArgs;
        this.original    = original;
    }

    public static Binding of(String name, int arity, Target target)
    {   if (arity < 0) throw new IllegalArgumentException("arity must be >= 0, got " + arity);
        return new Binding(Objects.requireNonNull(name, "name"), arity, Objects.requireNonNull(target, "target"), NO_ARGS, null);
    }

    /**
     * Returns a binding with {@code args} appended to the arguments supplied so far.
     *
     * @throws UsageException if that would exceed the arity
     */
    public Binding partial(Object... args)
    {
        int supplied = leadingArgs.length + args.length;
        if (supplied > arity) throw UsageException.incompleteBinding(name, arity, supplied);

        Object[] combined = Arrays.copyOf(leadingArgs, supplied);
        System.arraycopy(args, 0, combined, leadingArgs.length, args.length);
        return new Binding(name, arity, target, combined, original());
    }

    /**
     * Invokes the target with the supplied arguments.
     *
     * @throws UsageException if not all parameters are supplied; the target is not invoked
     */
    public void call() throws Throwable
    {   requireComplete();
        target.invoke(leadingArgs.clone());
    }

    public void requireComplete()
    {   if (!isComplete()) throw UsageException.incompleteBinding(name, arity, leadingArgs.length);
    }

    public boolean isComplete()
    {   return leadingArgs.length == arity;
    }

    /**
     * True if this binding was derived from another one by {@link #partial(Object...)}.
     */
    public boolean isPartial()
    {   return original != null;
    }

    /**
     * The binding this one was derived from, or this binding itself.
     */
    public Binding original()
    {   return original != null ? original : this;
    }

    public String getName()
    {   return name;
    }

    public int getArity()
    {   return arity;
    }

    /**
     * The arguments supplied so far, as a copy.
     */
    public Object[] getLeadingArgs()
    {   return leadingArgs.clone();
    }

    @Override
    public String toString()
    {   return isPartial()
                   ? String.format("partial(%s/%d, %s)", name, arity, Arrays.toString(leadingArgs))
                   : String.format("%s/%d", name, arity);
    }
}
