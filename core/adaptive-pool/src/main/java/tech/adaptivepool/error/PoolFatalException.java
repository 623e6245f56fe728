package tech.adaptivepool.error;

/**
 * A unit slot exceeded its restart cap. The pool stops admitting new tasks
 * until it is reset or recreated.
 */
public class PoolFatalException extends PoolException {

    private final int slotId;
    private final int restarts;

    public PoolFatalException(String poolName, int slotId, int restarts) {
        super(poolName, String.format("Pool [%s] unit slot [%d] exceeded restart limit after %d restarts",
            poolName, slotId, restarts));
        this.slotId = slotId;
        this.restarts = restarts;
    }

    public int getSlotId() {
        return slotId;
    }

    public int getRestarts() {
        return restarts;
    }
}
