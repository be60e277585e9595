package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.exception.TransportException;
import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.model.BoxResult;
import it.unimore.iot.labelingline.model.Robot;
import it.unimore.iot.labelingline.model.StatsDelta;
import it.unimore.iot.labelingline.transport.BoxSource;
import it.unimore.iot.labelingline.transport.StatusSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;

/**
 * Fa avanzare le scatole lungo il nastro una alla volta: adegua il numero di robot
 * operativi, rende disponibile la scatola, attende il tempo di transito, la ritira e
 * ne aggrega l'esito.
 */
public class ConveyorOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ConveyorOrchestrator.class);

    private final LineContext context;
    private final BoxSource source;
    private final BoxWorkspace workspace;
    private final ClaimProtocol claims;
    private final StatusSink statusSink;
    private final List<BoxResult> results = Collections.synchronizedList(new ArrayList<>());

    public ConveyorOrchestrator(LineContext context, BoxSource source, BoxWorkspace workspace, ClaimProtocol claims) {
        this.context = context;
        this.source = source;
        this.workspace = workspace;
        this.claims = claims;
        this.statusSink = context.getRepository();
    }

    /**
     * Esegue la pipeline fino all'esaurimento del flusso di scatole o alla cancellazione.
     * Al termine cancella lo spazio di lavoro, liberando gli agenti in attesa.
     */
    public void runPipeline(CyclicBarrier startBarrier) throws InterruptedException {
        try {
            if (startBarrier != null) {
                startBarrier.await();
            }
            logger.info("Conveyor started on line {}", context.getLineId());
            while (!workspace.isCancelled()) {
                Optional<Box> next;
                try {
                    next = source.receiveNextBox(true);
                } catch (TransportException e) {
                    logger.error("Box handoff failed, skipping to the next box", e);
                    statusSink.publishStats(StatsDelta.transportError());
                    continue;
                }
                if (next.isPresent()) {
                    processBox(next.get());
                } else if (source.isExhausted()) {
                    logger.info("Box stream exhausted after {} box(es)", results.size());
                    break;
                }
            }
        } catch (BrokenBarrierException e) {
            logger.error("Start barrier broken, conveyor not started", e);
        } finally {
            workspace.cancel();
        }
    }

    void processBox(Box box) throws InterruptedException {
        SimulationClock clock = context.getClock();
        box.setPosition(0.0);

        int required = context.getPlan().requiredRobots(box.getNumItems());
        List<Robot> changed = context.getRoster().rightSize(required);
        long ts = System.currentTimeMillis();
        changed.forEach(robot -> statusSink.publishRobotStatus(robot.snapshot(ts)));

        claims.open(box);
        workspace.publish(box);
        logger.debug("Box {} available with {} item(s), {} robot(s) required",
                box.getId(), box.getNumItems(), required);

        double transitTime = context.getParams().getTransitTime();
        clock.sleep(transitTime);

        box.setPosition(context.getParams().getBeltLength());
        workspace.withdraw();
        claims.close(box);
        long settleTimeout = Math.max(1000L, clock.toWallMillis(transitTime));
        while (!claims.awaitSettled(box, settleTimeout)) {
            logger.warn("Box {} still has {} label(s) in progress", box.getId(), claims.inFlight());
            if (workspace.isCancelled()) {
                break;
            }
        }

        BoxResult result = BoxResult.of(box);
        results.add(result);
        statusSink.publishStats(StatsDelta.boxDeparted(box));
        if (result.getMissed() > 0) {
            logger.info("Box {} departed: {}/{} labeled, {} missed",
                    box.getId(), result.getLabeled(), result.getNumItems(), result.getMissed());
        } else {
            logger.debug("Box {} departed fully labeled", box.getId());
        }
    }

    public List<BoxResult> getResults() {
        synchronized (results) {
            return new ArrayList<>(results);
        }
    }
}
