package com.tessera.database.relation;

import java.util.List;

/**
 * Outcome of {@link BelongsToMany#sync}.
 *
 * @param attached related keys newly attached
 * @param detached related keys removed
 */
public record SyncResult(List<Object> attached, List<Object> detached) {

    public SyncResult {
        attached = List.copyOf(attached);
        detached = List.copyOf(detached);
    }
}
