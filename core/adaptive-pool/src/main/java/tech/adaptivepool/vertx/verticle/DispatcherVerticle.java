package tech.adaptivepool.vertx.verticle;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.jboss.logging.Logger;
import tech.adaptivepool.config.PoolConfig;
import tech.adaptivepool.error.PoolException;
import tech.adaptivepool.error.PoolFatalException;
import tech.adaptivepool.error.QueueFullException;
import tech.adaptivepool.error.ShutdownException;
import tech.adaptivepool.error.TaskCancelledException;
import tech.adaptivepool.error.TaskException;
import tech.adaptivepool.error.TaskTimeoutException;
import tech.adaptivepool.error.WorkerCrashException;
import tech.adaptivepool.metrics.MetricsCollector;
import tech.adaptivepool.metrics.MetricsSnapshot;
import tech.adaptivepool.metrics.UnitStats;
import tech.adaptivepool.pool.PoolState;
import tech.adaptivepool.pool.PoolTask;
import tech.adaptivepool.pool.TaskQueue;
import tech.adaptivepool.recovery.FailureRecoverySupervisor;
import tech.adaptivepool.recovery.RecoveryDecision;
import tech.adaptivepool.scaling.PoolLoad;
import tech.adaptivepool.scaling.ScalingController;
import tech.adaptivepool.scaling.ScalingDecision;
import tech.adaptivepool.unit.ExecutionUnit;
import tech.adaptivepool.unit.UnitEvents;
import tech.adaptivepool.unit.UnitStatus;
import tech.adaptivepool.vertx.channel.PoolChannels;
import tech.adaptivepool.vertx.message.UnitMessages.PoolFatal;
import tech.adaptivepool.warning.WarningService;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Dispatcher verticle owning all state of one adaptive pool.
 * <p>
 * Pure actor model - no locks, no concurrent collections. Every event (task submitted, unit
 * result, unit exit, scaling tick, timeout, cancel, terminate) is handled as one step on
 * this verticle's event loop.
 * <p>
 * Owns:
 * <ul>
 *   <li>Unit slots (slot id → unit) and the idle set, longest idle first</li>
 *   <li>The task queue</li>
 *   <li>Scaling cooldown timestamp and the periodic scaling tick</li>
 *   <li>Fatal halt state</li>
 *   <li>Rate limiter (optional)</li>
 * </ul>
 * <p>
 * Methods without a leading {@code handle} are safe to call from any thread; they hop onto
 * the event loop. Task completions run there too, so callbacks attached to a task's future
 * must not block.
 * <p>
 * Threading: Event Loop (non-blocking). Units run on their own worker threads.
 */
public class DispatcherVerticle<P, R> extends AbstractVerticle {

    private static final Logger LOG = Logger.getLogger(DispatcherVerticle.class);

    static final long RATE_LIMIT_RETRY_MS = 250;

    private final PoolConfig<P, R> config;
    private final String poolName;
    private final MetricsCollector metrics;
    private final WarningService warningService;
    private final ScalingController scaling;
    private final FailureRecoverySupervisor supervisor;
    private final PoolChannels.Address channels;

    // === OWNED STATE (plain collections - single threaded verticle) ===

    // Live units, excluding terminating ones
    private final Map<Integer, UnitSlot<P, R>> units = new LinkedHashMap<>();

    // Units asked to exit (scale-down or termination) that have not reported their exit yet
    private final Map<Integer, UnitSlot<P, R>> terminating = new HashMap<>();

    // Insertion order = longest idle first
    private final Set<Integer> idleIds = new LinkedHashSet<>();

    private final TaskQueue<P, R> queue = new TaskQueue<>();

    // Caller-visible completions of the current step, released after the snapshot is republished
    private final List<Runnable> afterStep = new ArrayList<>();

    private int nextUnitId = 0;
    private long lastScaleActionAt = 0;
    private long tickTimerId = -1;
    private long graceTimerId = -1;
    private boolean dispatchRetryScheduled = false;
    private boolean limitWarningRaised = false;
    private PoolFatalException fatalError;
    private Promise<Void> termination;
    private RateLimiter rateLimiter;

    // Read from any thread
    private volatile PoolState state = PoolState.INITIALIZING;
    private volatile MetricsSnapshot snapshot;
    private volatile boolean started = false;

    public DispatcherVerticle(PoolConfig<P, R> config, PoolChannels.Address channels, MetricsCollector metrics,
                              WarningService warningService) {
        this.config = config;
        this.channels = channels;
        this.poolName = config.name();
        this.metrics = metrics;
        this.warningService = warningService;
        this.scaling = new ScalingController(config);
        this.supervisor = new FailureRecoverySupervisor(poolName, config.maxRestartsPerSlot());
        this.snapshot = buildSnapshot();
    }

    @Override
    public void start() {
        if (config.rateLimitPerMinute() != null) {
            this.rateLimiter = createRateLimiter(config.rateLimitPerMinute());
        }

        LOG.infof("DispatcherVerticle [%s] starting with minUnits=%d, maxUnits=%d, rateLimit=%s",
                poolName, config.minUnits(), config.maxUnits(), config.rateLimitPerMinute());

        metrics.initialize(config.minUnits(), config.maxUnits(), config.queueCapacity());

        step(() -> {
            for (int i = 0; i < config.minUnits(); i++) {
                spawn(new UnitSlot<>(nextUnitId++, now()));
            }
            state = PoolState.RUNNING;
        });

        tickTimerId = vertx.setPeriodic(config.checkIntervalMs(), id -> step(this::handleTick));
        started = true;

        LOG.infof("DispatcherVerticle [%s] started with %d units", poolName, units.size());
    }

    @Override
    public void stop() {
        vertx.cancelTimer(tickTimerId);
        vertx.cancelTimer(graceTimerId);

        if (!units.isEmpty() || !terminating.isEmpty()) {
            LOG.warnf("DispatcherVerticle [%s] stopped with %d units still alive, killing them",
                    poolName, units.size() + terminating.size());
            List<UnitSlot<P, R>> survivors = new ArrayList<>(units.values());
            survivors.addAll(terminating.values());
            survivors.forEach(slot -> slot.handle().kill());
        }

        metrics.remove();
        LOG.infof("DispatcherVerticle [%s] stopped", poolName);
    }

    // === ENTRY POINTS (any thread) ===

    public void submit(PoolTask<P, R> task) {
        context.runOnContext(v -> step(() -> handleSubmit(task)));
    }

    public Future<Boolean> cancel(long taskId) {
        return onDispatcher(() -> handleCancel(taskId));
    }

    public Future<Void> terminate() {
        return onDispatcher(this::handleTerminate).compose(done -> done);
    }

    public Future<Void> reset() {
        return onDispatcher(this::handleReset).compose(done -> done);
    }

    public PoolState state() {
        return state;
    }

    public MetricsSnapshot snapshot() {
        return snapshot;
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * For a pool that was never started.
     */
    public void markTerminated() {
        state = PoolState.TERMINATED;
        snapshot = buildSnapshot();
    }

    // === TASK HANDLING ===

    void handleSubmit(PoolTask<P, R> task) {
        if (!state.acceptsTasks()) {
            reject(task, new ShutdownException(poolName, "Pool [" + poolName + "] is " + state), "SHUTDOWN");
            return;
        }
        if (fatalError != null) {
            reject(task, fatalError, "POOL_FATAL");
            return;
        }
        if (config.isQueueBounded() && queue.size() >= config.queueCapacity()) {
            LOG.debugf("Pool [%s] queue full (%d), rejecting task [%d]", poolName, queue.size(), task.id());
            reject(task, new QueueFullException(poolName, config.queueCapacity()), "QUEUE_FULL");
            return;
        }

        queue.append(task);
        metrics.taskSubmitted();
        dispatch();
        metrics.observeQueueDepth(queue.size());
    }

    private void dispatch() {
        while (!queue.isEmpty() && !idleIds.isEmpty()) {
            if (rateLimiter != null && !rateLimiter.acquirePermission()) {
                LOG.debugf("Rate limit exceeded for pool [%s], %d tasks waiting", poolName, queue.size());
                metrics.rateLimited();
                scheduleDispatchRetry();
                return;
            }

            PoolTask<P, R> task = queue.poll();
            Integer unitId = idleIds.iterator().next();
            idleIds.remove(unitId);
            assign(units.get(unitId), task);
        }
    }

    private void assign(UnitSlot<P, R> slot, PoolTask<P, R> task) {
        slot.status(UnitStatus.BUSY);
        slot.currentTask(task);
        task.markDispatched(slot.id(), now());

        if (config.hasTaskTimeout()) {
            task.timeoutTimerId(vertx.setTimer(config.taskTimeoutMs(),
                    id -> step(() -> handleTimeout(slot, task))));
        }

        LOG.debugf("Pool [%s] dispatching task [%d] to unit [%d]", poolName, task.id(), slot.id());
        try {
            slot.handle().assign(task.id(), task.payload());
        } catch (RuntimeException e) {
            // The unit's exit report requeues the task
            LOG.errorf("Pool [%s] unit [%d] refused task [%d], killing it: %s",
                    poolName, slot.id(), task.id(), e.getMessage());
            slot.handle().kill();
        }
    }

    private void scheduleDispatchRetry() {
        if (dispatchRetryScheduled) {
            return;
        }
        dispatchRetryScheduled = true;
        vertx.setTimer(RATE_LIMIT_RETRY_MS, id -> step(() -> {
            dispatchRetryScheduled = false;
            if (state == PoolState.RUNNING) {
                dispatch();
            }
        }));
    }

    boolean handleCancel(long taskId) {
        PoolTask<P, R> queued = queue.remove(taskId);
        if (queued != null) {
            LOG.debugf("Pool [%s] task [%d] cancelled while queued", poolName, taskId);
            if (failTask(queued, new TaskCancelledException(poolName, taskId, false))) {
                metrics.taskCancelled();
            }
            return true;
        }

        for (UnitSlot<P, R> slot : allSlots()) {
            PoolTask<P, R> task = slot.currentTask();
            if (task != null && task.id() == taskId && !task.isSettled()) {
                LOG.debugf("Pool [%s] task [%d] marked cancelled on unit [%d]", poolName, taskId, slot.id());
                task.requestCancel();
                return true;
            }
        }
        return false;
    }

    private void handleTimeout(UnitSlot<P, R> slot, PoolTask<P, R> task) {
        if (task.isSettled() || slot.currentTask() != task) {
            return;
        }
        task.timeoutTimerId(-1);

        LOG.warnf("Pool [%s] task [%d] timed out after %dms on unit [%d]",
                poolName, task.id(), config.taskTimeoutMs(), slot.id());
        failTask(task, new TaskTimeoutException(poolName, task.id(), Duration.ofMillis(config.taskTimeoutMs())));
        metrics.taskTimedOut();

        if (config.killOnTimeout()) {
            slot.handle().kill();
        }
    }

    // === UNIT EVENTS ===

    private void handleResult(UnitSlot<P, R> slot, long taskId, R value) {
        PoolTask<P, R> task = finishTask(slot, taskId);
        if (task == null) {
            return;
        }
        slot.incrementCompleted();

        if (task.isCancelRequested()) {
            settleCancelled(task);
        } else if (completeTask(task, value)) {
            metrics.taskSucceeded(now() - task.dispatchedAt());
        } else {
            LOG.debugf("Pool [%s] discarding late result of task [%d]", poolName, taskId);
        }

        releaseUnit(slot);
    }

    private void handleError(UnitSlot<P, R> slot, long taskId, Throwable error) {
        PoolTask<P, R> task = finishTask(slot, taskId);
        if (task == null) {
            return;
        }
        slot.incrementFailed();

        String errorType = error.getClass().getSimpleName();
        if (task.isCancelRequested()) {
            settleCancelled(task);
        } else if (failTask(task, new TaskException(poolName, taskId, errorType, error.getMessage(), error))) {
            metrics.taskFailed(now() - task.dispatchedAt(), errorType);
        } else {
            LOG.debugf("Pool [%s] discarding late failure of task [%d]", poolName, taskId);
        }

        releaseUnit(slot);
    }

    /**
     * Detaches the slot's current task if it matches the reported one.
     *
     * @return the task, or null for a stale or mismatched report
     */
    private PoolTask<P, R> finishTask(UnitSlot<P, R> slot, long taskId) {
        if (!isCurrent(slot)) {
            LOG.debugf("Pool [%s] ignoring report for task [%d] from replaced unit [%d]", poolName, taskId, slot.id());
            return null;
        }
        PoolTask<P, R> task = slot.currentTask();
        if (task == null || task.id() != taskId) {
            LOG.warnf("Pool [%s] unit [%d] reported task [%d] it was not running", poolName, slot.id(), taskId);
            return null;
        }
        slot.currentTask(null);
        cancelTimeout(task);
        return task;
    }

    private void releaseUnit(UnitSlot<P, R> slot) {
        if (slot.status() == UnitStatus.TERMINATING) {
            return;
        }
        slot.status(UnitStatus.IDLE);
        idleIds.add(slot.id());
        dispatch();
    }

    private void handleExit(UnitSlot<P, R> slot, int exitCode) {
        if (!isCurrent(slot)) {
            return;
        }

        PoolTask<P, R> task = slot.currentTask();
        slot.currentTask(null);
        if (task != null) {
            cancelTimeout(task);
        }

        boolean requested = terminating.remove(slot.id(), slot);
        if (!requested) {
            units.remove(slot.id());
            idleIds.remove(slot.id());
        }

        if (requested || state == PoolState.DRAINING) {
            LOG.infof("Pool [%s] unit [%d] exited with code %d", poolName, slot.id(), exitCode);
            if (task != null && !task.isSettled()) {
                String reason = exitCode == ExecutionUnit.EXIT_KILLED
                        ? "Unit was force-terminated after the shutdown grace period"
                        : "Unit exited before the task finished";
                reject(task, new ShutdownException(poolName, reason), "SHUTDOWN");
            }
            checkDrained();
            return;
        }

        if (exitCode == ExecutionUnit.EXIT_NORMAL) {
            handleUnexpectedCleanExit(slot, task);
        } else {
            handleCrash(slot, task, exitCode);
        }

        if (fatalError != null && units.isEmpty()) {
            rejectQueued(fatalError, "POOL_FATAL");
        }
        dispatch();
    }

    private void handleUnexpectedCleanExit(UnitSlot<P, R> slot, PoolTask<P, R> task) {
        // Not a crash: no restart is counted, capacity is topped back up to minUnits
        LOG.warnf("Pool [%s] unit [%d] exited without being asked to", poolName, slot.id());
        requeueInterrupted(task);
        while (fatalError == null && state == PoolState.RUNNING && units.size() < config.minUnits()) {
            if (!spawn(new UnitSlot<>(nextUnitId++, now()))) {
                break;
            }
        }
    }

    private void handleCrash(UnitSlot<P, R> slot, PoolTask<P, R> task, int exitCode) {
        WorkerCrashException crash = new WorkerCrashException(poolName, slot.id(), exitCode);
        LOG.warn(crash.getMessage());
        metrics.unitCrashed();

        requeueInterrupted(task);

        RecoveryDecision decision = supervisor.onCrash(crash, slot.restarts());
        if (decision.replace()) {
            UnitSlot<P, R> replacement = slot.successor(now());
            replacement.restarts(decision.restarts());
            if (spawn(replacement)) {
                metrics.unitRestarted();
                warningService.addWarning(WarningService.UNIT_RESTART, "WARNING",
                        String.format("Unit slot [%d] crashed with exit code %d and was replaced (restart %d of %d)",
                                slot.id(), exitCode, decision.restarts(), config.maxRestartsPerSlot()),
                        source());
            }
        } else {
            halt(supervisor.fatal(slot.id(), decision.restarts()));
        }
    }

    private void requeueInterrupted(PoolTask<P, R> task) {
        if (task == null || task.isSettled()) {
            return;
        }
        if (task.isCancelRequested()) {
            settleCancelled(task);
            return;
        }
        LOG.infof("Pool [%s] requeueing task [%d] at the front of the queue", poolName, task.id());
        queue.requeueFront(task);
        metrics.observeQueueDepth(queue.size());
    }

    private void halt(PoolFatalException fatal) {
        fatalError = fatal;
        metrics.poolFatal();
        LOG.errorf("Pool [%s] halted: %s", poolName, fatal.getMessage());

        warningService.addWarning(WarningService.POOL_FATAL, "CRITICAL", fatal.getMessage(), source());
        channels.fatal(vertx)
                .publish(new PoolFatal(poolName, fatal.getSlotId(), fatal.getRestarts(), Instant.now()));
    }

    // === SCALING ===

    private void handleTick() {
        if (state != PoolState.RUNNING || fatalError != null) {
            return;
        }

        long now = now();
        PoolLoad load = new PoolLoad(units.size(), idleIds.size(), queue.size(), isRateLimited());
        ScalingDecision decision = scaling.evaluate(load, lastScaleActionAt, now);

        switch (decision) {
            case SCALE_UP -> scaleUp(now);
            case SCALE_DOWN -> scaleDown(now);
            case NONE -> checkUnitLimit(load);
        }
    }

    private void scaleUp(long now) {
        if (!spawn(new UnitSlot<>(nextUnitId++, now))) {
            return;
        }
        lastScaleActionAt = now;
        metrics.scaledUp(units.size());
        LOG.infof("Pool [%s] scaled up to %d units (queue depth %d)", poolName, units.size(), queue.size());
        dispatch();
    }

    private void scaleDown(long now) {
        Integer unitId = idleIds.iterator().next();
        idleIds.remove(unitId);
        UnitSlot<P, R> slot = units.remove(unitId);
        slot.status(UnitStatus.TERMINATING);
        terminating.put(unitId, slot);
        slot.handle().shutdown();

        lastScaleActionAt = now;
        metrics.scaledDown();
        LOG.infof("Pool [%s] scaled down to %d units, retiring unit [%d]", poolName, units.size(), unitId);
    }

    private void checkUnitLimit(PoolLoad load) {
        boolean saturated = load.units() >= config.maxUnits() && load.queueDepth() > config.scaleUpThreshold();
        if (saturated && !limitWarningRaised) {
            limitWarningRaised = true;
            warningService.addWarning(WarningService.POOL_LIMIT, "WARNING",
                    String.format("Max unit limit reached (%d/%d) with %d tasks queued",
                            load.units(), config.maxUnits(), load.queueDepth()),
                    source());
        } else if (load.queueDepth() == 0) {
            limitWarningRaised = false;
        }
    }

    private boolean isRateLimited() {
        return rateLimiter != null && rateLimiter.getMetrics().getAvailablePermissions() <= 0;
    }

    // === LIFECYCLE ===

    private Future<Void> handleTerminate() {
        if (termination != null) {
            return termination.future();
        }
        termination = Promise.promise();

        LOG.infof("Pool [%s] terminating: %d queued tasks, %d units", poolName, queue.size(), units.size());
        state = PoolState.DRAINING;
        vertx.cancelTimer(tickTimerId);

        rejectQueued(new ShutdownException(poolName, "Pool [" + poolName + "] is terminating"), "SHUTDOWN");

        for (UnitSlot<P, R> slot : units.values()) {
            slot.status(UnitStatus.TERMINATING);
            terminating.put(slot.id(), slot);
        }
        units.clear();
        idleIds.clear();
        new ArrayList<>(terminating.values()).forEach(slot -> slot.handle().shutdown());

        if (!terminating.isEmpty()) {
            graceTimerId = vertx.setTimer(Math.max(1, config.shutdownGraceMs()), id -> step(this::killSurvivors));
        }
        checkDrained();
        return termination.future();
    }

    private void killSurvivors() {
        if (terminating.isEmpty()) {
            return;
        }
        LOG.warnf("Pool [%s] shutdown grace period of %dms elapsed, killing %d units",
                poolName, config.shutdownGraceMs(), terminating.size());
        new ArrayList<>(terminating.values()).forEach(slot -> slot.handle().kill());
    }

    private void checkDrained() {
        if (state != PoolState.DRAINING || !terminating.isEmpty() || !units.isEmpty()) {
            return;
        }
        vertx.cancelTimer(graceTimerId);
        state = PoolState.TERMINATED;
        LOG.infof("Pool [%s] terminated", poolName);
        Promise<Void> drained = termination;
        afterStep.add(drained::complete);
    }

    private Future<Void> handleReset() {
        if (state != PoolState.RUNNING) {
            return Future.failedFuture(new ShutdownException(poolName, "Cannot reset pool [" + poolName + "] in state " + state));
        }
        if (fatalError != null) {
            LOG.infof("Pool [%s] reset, clearing fatal error: %s", poolName, fatalError.getMessage());
            fatalError = null;
        }
        while (units.size() < config.minUnits()) {
            if (!spawn(new UnitSlot<>(nextUnitId++, now()))) {
                return Future.failedFuture(new PoolException(poolName, "Pool [" + poolName + "] could not respawn units"));
            }
        }
        dispatch();
        return Future.succeededFuture();
    }

    // === HELPERS ===

    private boolean spawn(UnitSlot<P, R> slot) {
        ExecutionUnit<P> handle;
        try {
            handle = config.unitFactory().spawn(slot.id(), new SlotEvents(slot));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Pool [%s] failed to spawn unit [%d]", poolName, slot.id());
            return false;
        }
        slot.handle(handle);
        slot.status(UnitStatus.IDLE);
        units.put(slot.id(), slot);
        idleIds.add(slot.id());
        metrics.observeUnits(units.size());
        LOG.debugf("Pool [%s] spawned unit [%d]", poolName, slot.id());
        return true;
    }

    private boolean isCurrent(UnitSlot<P, R> slot) {
        return units.get(slot.id()) == slot || terminating.get(slot.id()) == slot;
    }

    /**
     * @return false if the task was already settled
     */
    private boolean completeTask(PoolTask<P, R> task, R value) {
        if (!task.tryComplete(value)) {
            return false;
        }
        afterStep.add(task::publish);
        return true;
    }

    private boolean failTask(PoolTask<P, R> task, Throwable cause) {
        if (!task.tryFail(cause)) {
            return false;
        }
        afterStep.add(task::publish);
        return true;
    }

    private void settleCancelled(PoolTask<P, R> task) {
        if (failTask(task, new TaskCancelledException(poolName, task.id(), true))) {
            metrics.taskCancelled();
        }
    }

    private void reject(PoolTask<P, R> task, PoolException error, String reason) {
        if (failTask(task, error)) {
            metrics.taskRejected(reason);
        }
    }

    private void rejectQueued(PoolException error, String reason) {
        List<PoolTask<P, R>> dropped = queue.drain();
        if (!dropped.isEmpty()) {
            LOG.infof("Pool [%s] rejecting %d queued tasks: %s", poolName, dropped.size(), error.getMessage());
        }
        dropped.forEach(task -> reject(task, error, reason));
    }

    private void cancelTimeout(PoolTask<P, R> task) {
        if (task.timeoutTimerId() >= 0) {
            vertx.cancelTimer(task.timeoutTimerId());
            task.timeoutTimerId(-1);
        }
    }

    private List<UnitSlot<P, R>> allSlots() {
        List<UnitSlot<P, R>> slots = new ArrayList<>(units.values());
        slots.addAll(terminating.values());
        return slots;
    }

    private String source() {
        return "AdaptivePool:" + poolName;
    }

    private long now() {
        return System.currentTimeMillis();
    }

    /**
     * Runs one dispatcher step, republishes the snapshot, then releases the step's completions.
     * A caller woken by a task or lifecycle future therefore never reads an older snapshot.
     */
    private void step(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Pool [%s] dispatcher step failed", poolName);
        }
        snapshot = buildSnapshot();
        if (started) {
            int busy = units.size() - idleIds.size();
            metrics.updateGauges(units.size(), busy, idleIds.size(), queue.size());
        }
        releaseCompletions();
    }

    private void releaseCompletions() {
        while (!afterStep.isEmpty()) {
            List<Runnable> batch = new ArrayList<>(afterStep);
            afterStep.clear();
            for (Runnable completion : batch) {
                try {
                    completion.run();
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Pool [%s] completion callback failed", poolName);
                }
            }
        }
    }

    private <T> Future<T> onDispatcher(Supplier<T> action) {
        Promise<T> promise = Promise.promise();
        context.runOnContext(v -> step(() -> {
            try {
                T result = action.get();
                afterStep.add(() -> promise.complete(result));
            } catch (RuntimeException e) {
                afterStep.add(() -> promise.fail(e));
                throw e;
            }
        }));
        return promise.future();
    }

    private MetricsSnapshot buildSnapshot() {
        long now = now();
        List<UnitStats> perUnit = allSlots().stream()
                .sorted(Comparator.comparingInt(UnitSlot::id))
                .map(slot -> new UnitStats(slot.id(), slot.status().name(), slot.tasksCompleted(),
                        slot.tasksFailed(), slot.restarts(), now - slot.startedAt()))
                .toList();
        int busy = (int) allSlots().stream().filter(slot -> slot.currentTask() != null).count();
        return metrics.snapshot(state.name(), units.size(), busy, queue.size(), perUnit, now);
    }

    private RateLimiter createRateLimiter(int limitPerMinute) {
        RateLimiterConfig rateLimiterConfig = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(limitPerMinute)
                .timeoutDuration(Duration.ZERO)
                .build();

        return RateLimiter.of("pool-" + poolName, rateLimiterConfig);
    }

    /**
     * Serializes one slot's unit events onto the dispatcher. Events from a unit that no
     * longer owns its slot are dropped by the handlers.
     */
    private final class SlotEvents implements UnitEvents<R> {

        private final UnitSlot<P, R> slot;

        SlotEvents(UnitSlot<P, R> slot) {
            this.slot = slot;
        }

        @Override
        public void onResult(int unitId, long taskId, R value) {
            context.runOnContext(v -> step(() -> handleResult(slot, taskId, value)));
        }

        @Override
        public void onError(int unitId, long taskId, Throwable error) {
            context.runOnContext(v -> step(() -> handleError(slot, taskId, error)));
        }

        @Override
        public void onExit(int unitId, int exitCode) {
            context.runOnContext(v -> step(() -> handleExit(slot, exitCode)));
        }
    }
}
