package com.notegraph.core.service.persistence.idle;

/**
 * Runs a task once the host has spare capacity.
 */
public interface IdleTaskRunner {

    /**
     * Submits the task; it runs asynchronously, at the latest after the runner's maximum wait.
     */
    void runWhenIdle(Runnable task);
}
