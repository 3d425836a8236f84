package org.pragmatica.spek.error;

/**
 * Common shape of every error value produced by the compiler, the machine and the equivalence checker.
 */
public interface SpekError {
    String message();
}
