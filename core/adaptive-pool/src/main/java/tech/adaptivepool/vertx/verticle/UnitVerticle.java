package tech.adaptivepool.vertx.verticle;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.eventbus.Message;
import org.jboss.logging.Logger;
import tech.adaptivepool.unit.TaskHandler;
import tech.adaptivepool.vertx.message.UnitMessages.*;

/**
 * Worker verticle hosting one execution unit.
 * <p>
 * One instance per unit, deployed on its own single-thread worker pool so a blocking or
 * runaway handler never holds up another unit. Processes one assignment at a time.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>Deployed by {@code VerticleExecutionUnit} when the pool spawns a unit</li>
 *   <li>Replies {@link Completed} or {@link Failed} for every assignment</li>
 *   <li>Replies {@link Crashed} and undeploys itself if the handler throws an {@link Error}</li>
 *   <li>Undeployed by the pool on scale-down, kill or termination</li>
 * </ul>
 * <p>
 * Threading: Worker (blocking handlers are fine)
 */
public class UnitVerticle<P, R> extends AbstractVerticle {

    private static final Logger LOG = Logger.getLogger(UnitVerticle.class);

    private final String poolName;
    private final String address;
    private final String unitKey;
    private final TaskHandler<P, R> handler;

    private boolean crashed = false;

    public UnitVerticle(String poolName, String address, String unitKey, TaskHandler<P, R> handler) {
        this.poolName = poolName;
        this.address = address;
        this.unitKey = unitKey;
        this.handler = handler;
    }

    @Override
    public void start() {
        vertx.eventBus().<Assignment>localConsumer(address, this::handleAssignment);
        LOG.debugf("UnitVerticle [%s] started for pool [%s] on thread [%s]",
                unitKey, poolName, Thread.currentThread().getName());
    }

    @Override
    public void stop() {
        LOG.debugf("UnitVerticle [%s] stopped for pool [%s]", unitKey, poolName);
    }

    @SuppressWarnings("unchecked")
    private void handleAssignment(Message<Assignment> msg) {
        Assignment assignment = msg.body();
        if (crashed) {
            msg.reply(new Crashed(assignment.taskId(), "unit already crashed"));
            return;
        }

        LOG.debugf("Unit [%s] processing task [%d]", unitKey, assignment.taskId());

        try {
            R result = handler.handle((P) assignment.payload());
            msg.reply(new Completed(assignment.taskId(), result));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            msg.reply(new Failed(assignment.taskId(), e.getClass().getSimpleName(), "interrupted", e));
        } catch (Exception e) {
            LOG.debugf("Unit [%s] task [%d] failed: %s", unitKey, assignment.taskId(), e.getMessage());
            msg.reply(new Failed(assignment.taskId(), e.getClass().getSimpleName(), e.getMessage(), e));
        } catch (Error e) {
            crashed = true;
            LOG.errorf(e, "Unit [%s] in pool [%s] crashed while processing task [%d]",
                    unitKey, poolName, assignment.taskId());
            msg.reply(new Crashed(assignment.taskId(), e.toString()));
            vertx.undeploy(deploymentID());
        }
    }
}
