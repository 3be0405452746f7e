package com.yerin.bookpipe.domain;

/**
 * Lease condition checked atomically with a status compare-and-swap.
 * {@link #none()} requires that nobody holds a live lease (cancel, reaper);
 * {@link #heldBy(String)} requires that the given worker still holds it.
 */
public record LeaseGuard(String owner) {

    private static final LeaseGuard NONE = new LeaseGuard(null);

    public static LeaseGuard none() {
        return NONE;
    }

    public static LeaseGuard heldBy(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("lease owner must not be blank");
        }
        return new LeaseGuard(owner);
    }

    public boolean requiresNoLease() {
        return owner == null;
    }
}
