package com.arbor.hierarchy.domain.model;

import java.util.List;

/**
 * Outcome of checking a tenant's derived ancestry against its stored nodes.
 *
 * @param consistent   true when no violation was found
 * @param nodesChecked number of active nodes examined
 * @param violations   one human-readable message per violated invariant
 */
public record ConsistencyReport(boolean consistent, int nodesChecked, List<String> violations) {

    public static ConsistencyReport of(int nodesChecked, List<String> violations) {
        return new ConsistencyReport(violations.isEmpty(), nodesChecked, List.copyOf(violations));
    }
}
