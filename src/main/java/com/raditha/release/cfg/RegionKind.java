package com.raditha.release.cfg;

/**
 * Kinds of region a basic block can be nested in.
 */
public enum RegionKind {
    ROOT,
    TRY,
    CATCH,
    FINALLY,
    LOOP
}
