package tech.adaptivepool.recovery;

import org.jboss.logging.Logger;
import tech.adaptivepool.error.PoolFatalException;
import tech.adaptivepool.error.WorkerCrashException;

/**
 * Applies the per-slot restart cap to unit crashes.
 * <p>
 * A crashed slot is replaced while its restart count stays below {@code maxRestartsPerSlot};
 * the crash that reaches the cap is fatal for the pool. Voluntary exits never reach here.
 */
public final class FailureRecoverySupervisor {

    private static final Logger LOG = Logger.getLogger(FailureRecoverySupervisor.class);

    private final String poolName;
    private final int maxRestartsPerSlot;

    public FailureRecoverySupervisor(String poolName, int maxRestartsPerSlot) {
        this.poolName = poolName;
        this.maxRestartsPerSlot = maxRestartsPerSlot;
    }

    /**
     * @param crash            the unexpected exit
     * @param restartsSoFar    restarts the slot has already used
     */
    public RecoveryDecision onCrash(WorkerCrashException crash, int restartsSoFar) {
        int restarts = restartsSoFar + 1;
        if (restarts < maxRestartsPerSlot) {
            LOG.warnf("Pool [%s] unit slot [%d] crashed (exit %d), restart %d of %d",
                    poolName, crash.getUnitId(), crash.getExitCode(), restarts, maxRestartsPerSlot - 1);
            return new RecoveryDecision(restarts, true);
        }
        LOG.errorf("Pool [%s] unit slot [%d] crashed (exit %d) and reached its restart cap of %d",
                poolName, crash.getUnitId(), crash.getExitCode(), maxRestartsPerSlot);
        return new RecoveryDecision(restarts, false);
    }

    public PoolFatalException fatal(int slotId, int restarts) {
        return new PoolFatalException(poolName, slotId, restarts);
    }

    public int maxRestartsPerSlot() {
        return maxRestartsPerSlot;
    }
}
