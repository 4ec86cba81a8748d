package com.jcollect.collection;

/**
 * Thrown when a macro is registered under the name of a built-in collection method.
 */
public class MacroCollisionException extends IllegalArgumentException {
    public MacroCollisionException(String name) {
        super("Cannot register macro '" + name + "': the name is a built-in collection method");
    }
}
