package com.statuswatch.core.fake;

/**
 * How strictly a simulator command's arguments are parsed.
 */
public enum ArgumentMode {
    /** Unknown options are rejected. */
    STRICT,
    /** Unknown options are ignored. */
    LENIENT,
    /** Arguments are passed through unparsed. */
    RAW
}
