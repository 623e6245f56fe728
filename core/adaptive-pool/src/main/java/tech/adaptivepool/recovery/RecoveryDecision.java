package tech.adaptivepool.recovery;

/**
 * Outcome of one crash.
 *
 * @param restarts restart count of the slot including this crash
 * @param replace  spawn a replacement in the same slot; false means the slot is exhausted
 */
public record RecoveryDecision(int restarts, boolean replace) {

    public boolean fatal() {
        return !replace;
    }
}
