package org.pragmatica.spek.equivalence;

/**
 * How internal steps count when comparing behaviours.
 */
public enum EquivalenceMode {
    /**
     * Private steps are matched one for one like any other label.
     */
    STRONG,
    /**
     * Private steps are unobservable: a move may be matched by any number of private steps around the same label.
     */
    WEAK
}
