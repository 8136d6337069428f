package io.livedoc.infrastructure.store;

import io.livedoc.domain.model.ChangeEvent;

/**
 * Receives every committed write from the store gateway, right after the commit.
 */
@FunctionalInterface
public interface ChangePublisher {
    void publish(ChangeEvent event);
}
