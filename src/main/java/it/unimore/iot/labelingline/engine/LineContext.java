package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.domain.StateRepository;
import it.unimore.iot.labelingline.model.SystemParameters;

import java.util.Random;

/**
 * Contesto di una singola esecuzione, passato a tutti i componenti: parametri,
 * piano delle zone, roster, repository di stato, orologio e sorgente casuale principale.
 */
public class LineContext {

    private final String lineId;
    private final SystemParameters params;
    private final ZonePlan plan;
    private final RobotRoster roster;
    private final StateRepository repository;
    private final SimulationClock clock;
    private final Random masterRandom;

    public LineContext(String lineId, SystemParameters params) {
        this(lineId, params, new StateRepository(lineId, params));
    }

    public LineContext(String lineId, SystemParameters params, StateRepository repository) {
        this.lineId = lineId;
        this.params = params;
        this.plan = ZonePlanner.plan(params);
        this.roster = RobotRoster.create(params, plan);
        this.repository = repository;
        this.clock = new SimulationClock(params.getTimeScale());
        this.masterRandom = new Random(params.getSeed());
    }

    /**
     * Nuova sorgente casuale indipendente, derivata dal seme principale.
     */
    public synchronized Random newRandom() {
        return new Random(masterRandom.nextLong());
    }

    public String getLineId() {
        return lineId;
    }

    public SystemParameters getParams() {
        return params;
    }

    public ZonePlan getPlan() {
        return plan;
    }

    public RobotRoster getRoster() {
        return roster;
    }

    public StateRepository getRepository() {
        return repository;
    }

    public SimulationClock getClock() {
        return clock;
    }
}
