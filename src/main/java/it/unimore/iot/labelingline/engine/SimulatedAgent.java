package it.unimore.iot.labelingline.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;

/**
 * Base degli agenti eseguiti su un proprio thread. Se è presente una barriera di
 * partenza l'agente la attende prima di iniziare, così tutti partono insieme.
 */
public abstract class SimulatedAgent implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedAgent.class);

    protected final String agentId;
    private final CyclicBarrier startBarrier;
    protected volatile boolean running = true;

    protected SimulatedAgent(String agentId, CyclicBarrier startBarrier) {
        this.agentId = agentId;
        this.startBarrier = startBarrier;
    }

    @Override
    public void run() {
        try {
            if (startBarrier != null) {
                startBarrier.await();
            }
            start(); // comportamento specifico della sottoclasse
        } catch (BrokenBarrierException e) {
            logger.error("Start barrier broken for agent {}", agentId, e);
        } catch (InterruptedException e) {
            if (running) { // log solo se l'interruzione non era prevista
                logger.warn("Agent {} was interrupted unexpectedly.", agentId);
            }
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.error("Agent {} terminated by an unexpected error", agentId, e);
            throw e;
        } finally {
            onStop();
            logger.debug("Agent {} shutdown complete.", agentId);
        }
    }

    // Richiede l'arresto cooperativo; l'agente lo osserva al prossimo punto di attesa
    public void shutdown() {
        this.running = false;
        logger.debug("Shutdown requested for agent {}.", agentId);
    }

    public boolean isRunning() {
        return running;
    }

    public String getAgentId() {
        return agentId;
    }

    /**
     * Logica principale dell'agente, eseguita dopo la barriera di partenza.
     *
     * @throws InterruptedException se il thread viene interrotto.
     */
    protected abstract void start() throws InterruptedException;

    // Chiamato all'uscita da run(), anche in caso di errore
    protected void onStop() {
    }
}
