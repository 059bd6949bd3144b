package io.platoonmesh.protocol;

public enum PredecessorStatus {
    /** Leader or detached: nothing to track. */
    NOT_APPLICABLE,
    FRESH,
    /** Predecessor changed recently and has not reported yet; the staleness window is still open. */
    AWAITING,
    STALE
}
