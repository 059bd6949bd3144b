package io.platoonmesh.control;

public enum ControlMode {
    /** Not a platoon member; no actuation. */
    IDLE,
    /** Leader regulating to the target speed. */
    CRUISE,
    /** Follower keeping the target gap to its predecessor. */
    GAP_KEEPING,
    /** Leader replaying a fixed lead script instead of cruising. */
    SCRIPTED,
    /** Fixed deceleration while predecessor data is missing, stale, or the relay is unreachable. */
    FAIL_SAFE
}
