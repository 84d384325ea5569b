package com.notegraph.core.service.persistence.idle;

import lombok.RequiredArgsConstructor;

import java.util.concurrent.Executor;

/**
 * Runs the task on the next free turn of the given executor.
 */
@RequiredArgsConstructor
public class NextTurnTaskRunner implements IdleTaskRunner {

    private final Executor executor;

    @Override
    public void runWhenIdle(Runnable task) {
        executor.execute(task);
    }
}
