package com.example.dndcombat.util;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared delegate executor.
 * Many SerialExecutors can share one thread pool while each still behaves like a single writer.
 */
public class SerialExecutor implements Executor {

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor delegate;
    private Runnable active;

    public SerialExecutor(Executor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public synchronized void execute(Runnable command) {
        Objects.requireNonNull(command, "command");
        tasks.add(() -> {
            try {
                command.run();
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext() {
        active = tasks.poll();
        if (active != null) {
            delegate.execute(active);
        }
    }

    /** Number of tasks waiting behind the one currently running. */
    public synchronized int pending() {
        return tasks.size();
    }
}
