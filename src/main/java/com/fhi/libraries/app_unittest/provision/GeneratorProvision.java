package com.fhi.libraries.app_unittest.provision;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

import com.fhi.libraries.app_unittest.exception.ContractViolationException;
import com.fhi.libraries.app_unittest.exception.ResourceLifecycleException;
import com.fhi.libraries.app_unittest.exception.UsageException;

import lombok.extern.slf4j.Slf4j;


/**
 * Two-phase resource backed by a {@link ResourceGenerator}.
 *
 * <p>The generator body runs on its own daemon thread. Acquisition starts the thread and
 * waits for the first yield; disposal resumes the body once and waits for it to end.
 * The two threads never run generator code at the same time: each side blocks on its
 * queue while the other one works.</p>
 *
 * <p>State: {@code NEW -> SUSPENDED -> DONE}. Only a {@code SUSPENDED} generator can be
 * resumed, and only once.</p>
 */
@Slf4j
final class GeneratorProvision<R> extends Provision<R>
{
    private enum State { NEW, SUSPENDED, DONE }

    private enum Signal { RESUME, CLOSE }

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    /** A second yield after a CLOSE gets closed again, up to this many times. */
    private static final int MAX_CLOSE_ATTEMPTS = 3;

    private final ResourceGenerator<R>         generator;
    private final BlockingQueue<Event>         toCaller    = new LinkedBlockingQueue<>();
    private final BlockingQueue<Signal>        toGenerator = new LinkedBlockingQueue<>();

    private State state = State.NEW;
    private R     resource;


    GeneratorProvision(ResourceGenerator<R> generator)
    {   this.generator = generator;
    }

    /**
     * Starts the generator and waits for its first yield.
     */
    @SuppressWarnings("unchecked")
    void acquire()
    {
        Thread thread = new Thread(this::runGenerator, "resource-generator-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        thread.start();

        Event first = awaitEvent();
        switch (first.kind)
        {
            case YIELDED ->
            {   resource = (R) first.value;
                state    = State.SUSPENDED;
                log.debug("Generator on {} yielded {}", thread.getName(), resource);
            }
            case RETURNED ->
            {   state = State.DONE;
                throw UsageException.noYield();
            }
            case FAILED ->
            {   state = State.DONE;
                throw propagate("creation", first.failure);
            }
        }
    }

    @Override
    public R resource()
    {   if (state == State.NEW) throw UsageException.notProvisioned(state);
        return resource;
    }

    /**
     * Resumes the generator once and expects it to finish.
     *
     * @throws ContractViolationException if the generator yields a second value
     */
    @Override
    public void dispose()
    {
        if (state == State.NEW)  throw UsageException.notProvisioned(state);
        if (state == State.DONE) throw UsageException.alreadyDisposed();
        state = State.DONE;

        toGenerator.add(Signal.RESUME);
        Event next = awaitEvent();
        switch (next.kind)
        {
            case RETURNED -> log.debug("Generator finished after resume");
            case FAILED   -> throw propagate("cleanup", next.failure);
            case YIELDED  ->
            {   ContractViolationException violation = ContractViolationException.multipleYields(next.value);
                closeAfterViolation(violation);
                throw violation;
            }
        }
    }


    // -----------------------------------------
    // Generator thread side
    // -----------------------------------------

    private void runGenerator()
    {
        try
        {   generator.generate(this::yieldResource);
            toCaller.add(Event.returned());
        }
        catch (GeneratorClosed closed)
        {   toCaller.add(Event.returned());
        }
        catch (Throwable t)
        {   toCaller.add(Event.failed(t));
        }
    }

    private void yieldResource(R value)
    {
        toCaller.add(Event.yielded(value));
        Signal signal;
        try
        {   signal = toGenerator.take();
        }
        catch (InterruptedException e)
        {   Thread.currentThread().interrupt();
            throw new GeneratorClosed();
        }
        if (signal == Signal.CLOSE) throw new GeneratorClosed();
    }


    // -----------------------------------------
    // Caller side helpers
    // -----------------------------------------

    /**
     * Unwinds a generator that is suspended in a second yield, so its finally blocks run.
     */
    private void closeAfterViolation(ContractViolationException violation)
    {
        for (int attempt = 0; attempt < MAX_CLOSE_ATTEMPTS; attempt++)
        {   toGenerator.add(Signal.CLOSE);
            Event event = awaitEvent();
            switch (event.kind)
            {
                case RETURNED -> { return; }
                case FAILED   ->
                {   violation.addSuppressed(event.failure);
                    return;
                }
                case YIELDED  -> log.warn("Generator kept yielding after being closed: {}", event.value);
            }
        }
        log.warn("Giving up closing a generator after {} attempts; its thread stays suspended", MAX_CLOSE_ATTEMPTS);
    }

    private Event awaitEvent()
    {
        try
        {   return toCaller.take();
        }
        catch (InterruptedException e)
        {   Thread.currentThread().interrupt();
            throw ResourceLifecycleException.failed("generator hand-over (interrupted)", e);
        }
    }

    private static RuntimeException propagate(String phase, Throwable failure)
    {
        if (failure instanceof RuntimeException)
        {   return (RuntimeException) failure;
        }
        if (failure instanceof Error)
        {   throw (Error) failure;
        }
        return ResourceLifecycleException.failed(phase, failure);
    }


    /**
     * Thrown inside the generator thread, out of its pending yield, to unwind it.
     */
    private static final class GeneratorClosed extends RuntimeException
    {
        GeneratorClosed()
        {   super("generator closed", null, false, false);
        }
    }


    private static final class Event
    {
        enum Kind { YIELDED, RETURNED, FAILED }

        final Kind      kind;
        final Object    value;
        final Throwable failure;

        private Event(Kind kind, Object value, Throwable failure)
        {   this.kind    = kind;
            this.value   = value;
            this.failure = failure;
        }

        static Event yielded(Object value)      { return new Event(Kind.YIELDED, value, null); }
        static Event returned()                 { return new Event(Kind.RETURNED, null, null); }
        static Event failed(Throwable failure)  { return new Event(Kind.FAILED, null, failure); }
    }
}
