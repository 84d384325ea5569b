package com.notegraph.core.service.ingest;

/**
 * Applies one kind of document change. The worker routes items by {@link #getSupportedType()}.
 *
 * @param <T> the work item type handled
 */
public interface IngestionHandler<T extends IngestionWorkItem> {

    /**
     * @throws IngestionException when the change cannot be applied
     */
    void handle(T workItem);

    Class<T> getSupportedType();
}
