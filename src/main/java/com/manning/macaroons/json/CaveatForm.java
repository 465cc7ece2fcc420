package com.manning.macaroons.json;

/**
 * How the caveats of a macaroon are written in its JSON form.
 */
public enum CaveatForm {
    /** A single hex string holding the raw caveat packets. */
    COMPACT,
    /** An array with one {@code {"cid", "vid", "cl"}} object per caveat. */
    LEGACY
}
