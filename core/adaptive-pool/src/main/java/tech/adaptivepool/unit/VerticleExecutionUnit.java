package tech.adaptivepool.unit;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.ThreadingModel;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.ReplyException;
import org.jboss.logging.Logger;
import tech.adaptivepool.vertx.channel.PoolChannels;
import tech.adaptivepool.vertx.channel.TypedChannel;
import tech.adaptivepool.vertx.message.UnitMessages.*;
import tech.adaptivepool.vertx.verticle.UnitVerticle;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ExecutionUnit} backed by a {@link UnitVerticle} on a dedicated worker thread.
 * <p>
 * Assignments issued before the verticle finishes deploying are held until it is up.
 * {@link #kill()} reports the exit immediately; the worker thread cannot be stopped, so
 * a handler that is still running is abandoned and its reply discarded.
 */
class VerticleExecutionUnit<P, R> implements ExecutionUnit<P> {

    private static final Logger LOG = Logger.getLogger(VerticleExecutionUnit.class);

    private final Vertx vertx;
    private final PoolChannels.Address channels;
    private final String poolName;
    private final int unitId;
    private final String unitKey;
    private final TaskHandler<P, R> handler;
    private final UnitEvents<R> events;
    private final TypedChannel<Assignment, UnitReply> channel;

    private final AtomicBoolean exited = new AtomicBoolean(false);
    private final AtomicLong currentTaskId = new AtomicLong(-1);
    private volatile boolean stopping = false;
    private volatile Future<UnitReply> inFlight;
    private Future<String> deployment;

    VerticleExecutionUnit(Vertx vertx, PoolChannels.Address channels, int unitId, String unitKey,
                          TaskHandler<P, R> handler, UnitEvents<R> events, long replyTimeoutMs) {
        this.vertx = vertx;
        this.channels = channels;
        this.poolName = channels.poolName();
        this.unitId = unitId;
        this.unitKey = unitKey;
        this.handler = handler;
        this.events = events;
        this.channel = channels.unit(vertx, unitKey, replyTimeoutMs);
    }

    void deploy() {
        DeploymentOptions options = new DeploymentOptions()
                .setThreadingModel(ThreadingModel.WORKER)
                .setWorkerPoolName(channels.workerPoolName(unitKey))
                .setWorkerPoolSize(1);

        deployment = vertx.deployVerticle(new UnitVerticle<>(poolName, channels.unitAddress(unitKey), unitKey, handler), options)
                .onSuccess(id -> LOG.debugf("Unit [%s] deployed for pool [%s], deployment: %s", unitKey, poolName, id))
                .onFailure(err -> {
                    LOG.errorf("Failed to deploy unit [%s] for pool [%s]: %s", unitKey, poolName, err.getMessage());
                    exit(EXIT_CRASHED);
                });
    }

    @Override
    public int id() {
        return unitId;
    }

    String key() {
        return unitKey;
    }

    @Override
    public void assign(long taskId, P payload) {
        if (exited.get()) {
            throw new IllegalStateException("Unit [" + unitKey + "] has exited");
        }
        if (stopping) {
            throw new IllegalStateException("Unit [" + unitKey + "] is shutting down");
        }
        if (!currentTaskId.compareAndSet(-1, taskId)) {
            throw new IllegalStateException("Unit [" + unitKey + "] is busy with task [" + currentTaskId.get() + "]");
        }

        inFlight = deployment.compose(id -> channel.request(new Assignment(taskId, payload)));
        inFlight.onComplete(ar -> {
            if (ar.succeeded()) {
                handleReply(taskId, ar.result());
            } else {
                handleRequestFailure(taskId, ar.cause());
            }
        });
    }

    @SuppressWarnings("unchecked")
    private void handleReply(long taskId, UnitReply reply) {
        if (exited.get()) {
            LOG.debugf("Discarding reply for task [%d] from exited unit [%s]", taskId, unitKey);
            return;
        }
        if (reply instanceof Crashed crashed) {
            LOG.warnf("Unit [%s] crashed on task [%d]: %s", unitKey, taskId, crashed.reason());
            exit(EXIT_CRASHED);
            return;
        }

        currentTaskId.set(-1);
        if (reply instanceof Completed completed) {
            events.onResult(unitId, taskId, (R) completed.result());
        } else if (reply instanceof Failed failed) {
            Throwable cause = failed.cause() != null
                    ? failed.cause()
                    : new RuntimeException(failed.errorType() + ": " + failed.message());
            events.onError(unitId, taskId, cause);
        }
    }

    private void handleRequestFailure(long taskId, Throwable cause) {
        if (exited.get()) {
            return;
        }
        // Deployment failure already reported the exit; anything else means the unit stopped answering
        if (cause instanceof ReplyException replyException) {
            LOG.warnf("Unit [%s] did not answer task [%d] (%s): %s",
                    unitKey, taskId, replyException.failureType(), replyException.getMessage());
        } else {
            LOG.warnf("Unit [%s] failed to take task [%d]: %s", unitKey, taskId, cause.getMessage());
        }
        exit(EXIT_CRASHED);
    }

    @Override
    public void shutdown() {
        if (exited.get() || stopping) {
            return;
        }
        stopping = true;
        // The exit must follow the reply of the task still running, if any
        Future<UnitReply> pending = inFlight;
        Future<Void> drained = pending == null
                ? Future.succeededFuture()
                : pending.<Void>mapEmpty().recover(err -> Future.succeededFuture());
        drained
                .compose(v -> deployment)
                .compose(vertx::undeploy)
                .onComplete(ar -> {
                    if (ar.failed()) {
                        LOG.warnf("Undeploy of unit [%s] failed: %s", unitKey, ar.cause().getMessage());
                    }
                    exit(EXIT_NORMAL);
                });
    }

    @Override
    public void kill() {
        if (!exit(EXIT_KILLED)) {
            return;
        }
        LOG.infof("Unit [%s] in pool [%s] killed", unitKey, poolName);
        deployment
                .compose(vertx::undeploy)
                .onComplete(ar -> LOG.debugf("Killed unit [%s] undeployed (success=%s)", unitKey, ar.succeeded()));
    }

    @Override
    public boolean isBusy() {
        return currentTaskId.get() != -1;
    }

    @Override
    public boolean isAlive() {
        return !exited.get();
    }

    private boolean exit(int code) {
        if (!exited.compareAndSet(false, true)) {
            return false;
        }
        events.onExit(unitId, code);
        return true;
    }

    @Override
    public String toString() {
        return "VerticleExecutionUnit[" + unitKey + "]";
    }
}
