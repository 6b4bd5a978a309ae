package org.clyze.source.callsite.ir;

/** Where a front end places a call's sentinel constant, relative to the call instruction. */
public enum SentinelSide {
    /** The sentinel is an extra argument: the call follows the constant load. */
    BEFORE_CALL,
    /** The call is wrapped or followed by a marker: the call precedes the constant load. */
    AFTER_CALL
}
