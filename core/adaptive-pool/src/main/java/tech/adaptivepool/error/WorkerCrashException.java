package tech.adaptivepool.error;

/**
 * A unit exited unexpectedly. Handled by the recovery supervisor and never
 * delivered to the submitter of a task that is retried.
 */
public class WorkerCrashException extends PoolException {

    private final int unitId;
    private final int exitCode;

    public WorkerCrashException(String poolName, int unitId, int exitCode) {
        super(poolName, String.format("Unit [%d] in pool [%s] exited with code %d", unitId, poolName, exitCode));
        this.unitId = unitId;
        this.exitCode = exitCode;
    }

    public int getUnitId() {
        return unitId;
    }

    public int getExitCode() {
        return exitCode;
    }
}
