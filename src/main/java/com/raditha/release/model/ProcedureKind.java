package com.raditha.release.model;

/**
 * The kind of declaration an analyzable procedure comes from.
 */
public enum ProcedureKind {
    /**
     * Regular method declaration with a body.
     */
    METHOD,

    /**
     * Constructor declaration.
     */
    CONSTRUCTOR,

    /**
     * Static initializer block (static { ... }).
     */
    STATIC_INITIALIZER,

    /**
     * Instance initializer block ({ ... }).
     */
    INSTANCE_INITIALIZER,

    /**
     * Lambda expression, with either a block or an expression body.
     */
    LAMBDA
}
