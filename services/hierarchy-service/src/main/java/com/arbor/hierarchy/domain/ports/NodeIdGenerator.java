package com.arbor.hierarchy.domain.ports;

import java.util.UUID;

/**
 * Source of node ids. Ids are never reused.
 */
@FunctionalInterface
public interface NodeIdGenerator {

    String nextId();

    static NodeIdGenerator randomUuid() {
        return () -> UUID.randomUUID().toString();
    }
}
