package org.pragmatica.spek.error;

/**
 * The equivalence checker gave up before deciding, because the reachable state space is larger than allowed.
 * Distinguishes "could not decide" from "not bisimilar".
 *
 * @param limit    Configured state limit
 * @param explored Number of states discovered when the limit was hit
 */
public record ExplorationLimitExceeded(int limit, int explored) implements SpekError {
    @Override
    public String message() {
        return "State space exploration exceeded the limit of " + limit + " states (" + explored + " discovered)";
    }
}
