package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.BoxResult;
import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.model.SimulationStats;

import java.util.List;

/**
 * Esito di una simulazione concorrente: contatori finali, esito di ogni scatola e
 * stato finale di ogni robot.
 */
public class LiveSimulationResult {

    private final SimulationStats stats;
    private final List<BoxResult> boxes;
    private final List<RobotStatus> robots;
    private final long elapsedMillis;
    private final boolean stopped;

    public LiveSimulationResult(SimulationStats stats, List<BoxResult> boxes, List<RobotStatus> robots,
                                long elapsedMillis, boolean stopped) {
        this.stats = stats;
        this.boxes = List.copyOf(boxes);
        this.robots = List.copyOf(robots);
        this.elapsedMillis = elapsedMillis;
        this.stopped = stopped;
    }

    public SimulationStats getStats() {
        return stats;
    }

    public List<BoxResult> getBoxes() {
        return boxes;
    }

    public List<RobotStatus> getRobots() {
        return robots;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    /**
     * {@code true} se l'esecuzione è stata interrotta da un comando STOP.
     */
    public boolean isStopped() {
        return stopped;
    }

    public double getEfficiency() {
        return stats.efficiency();
    }
}
