package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.exception.TransportException;
import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.model.SystemParameters;
import it.unimore.iot.labelingline.transport.BoxSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Sistema di visione: genera le scatole della corsa e le consegna al nastro con la
 * cadenza di arrivo, poi chiude il flusso. Una consegna fallita viene registrata e
 * la generazione prosegue con la scatola successiva.
 */
public class BoxGeneratorAgent extends SimulatedAgent {

    private static final Logger logger = LoggerFactory.getLogger(BoxGeneratorAgent.class);

    private final SystemParameters params;
    private final BoxGenerator generator;
    private final Random random;
    private final BoxSink sink;
    private final SimulationClock clock;
    private volatile int sent;
    private volatile int failedSends;

    public BoxGeneratorAgent(String agentId, SystemParameters params, Random random, BoxSink sink,
                             SimulationClock clock) {
        super(agentId, null);
        this.params = params;
        this.generator = new BoxGenerator(params);
        this.random = random;
        this.sink = sink;
        this.clock = clock;
    }

    @Override
    protected void start() throws InterruptedException {
        logger.info("Generator {} started: {} box(es) every {} s", agentId, params.getBoxCount(),
                params.getBoxInterval());
        for (int i = 0; i < params.getBoxCount() && running; i++) {
            Box box = generator.generate(i, random, clock.now());
            try {
                sink.send(box);
                sent++;
            } catch (TransportException e) {
                failedSends++;
                logger.error("Failed to hand off box {}", box.getId(), e);
            }
            if (i < params.getBoxCount() - 1) {
                clock.sleep(params.getBoxInterval());
            }
        }
    }

    @Override
    protected void onStop() {
        try {
            sink.complete();
            logger.info("Generator {} finished: {} sent, {} failed", agentId, sent, failedSends);
        } catch (TransportException e) {
            logger.error("Failed to signal end of box stream", e);
        }
    }

    public int getSent() {
        return sent;
    }

    public int getFailedSends() {
        return failedSends;
    }
}
