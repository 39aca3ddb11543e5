package com.callprobe.instrumenter.engine;

/**
 * Thrown when an identifier the engine must introduce is already bound in the compilation unit.
 * Generated code is never allowed to shadow user code.
 */
public class IdentifierCollisionException extends RuntimeException {

    public IdentifierCollisionException(String message) {
        super(message);
    }
}
