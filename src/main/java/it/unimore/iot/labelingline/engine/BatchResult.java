package it.unimore.iot.labelingline.engine;

import java.util.List;

/**
 * Esito di una singola esecuzione della stima sequenziale.
 */
public class BatchResult {

    private final int robots;
    private final int backups;
    private final double failureProbability;
    private final int boxes;
    private final int totalItems;
    private final int labeled;
    private final int missed;
    private final int failures;
    private final int backupActivations;
    private final List<Integer> labelsPerRobot;
    private final long elapsedMillis;

    public BatchResult(int robots, int backups, double failureProbability, int boxes, int totalItems, int labeled,
                       int missed, int failures, int backupActivations, List<Integer> labelsPerRobot,
                       long elapsedMillis) {
        this.robots = robots;
        this.backups = backups;
        this.failureProbability = failureProbability;
        this.boxes = boxes;
        this.totalItems = totalItems;
        this.labeled = labeled;
        this.missed = missed;
        this.failures = failures;
        this.backupActivations = backupActivations;
        this.labelsPerRobot = List.copyOf(labelsPerRobot);
        this.elapsedMillis = elapsedMillis;
    }

    public double getEfficiency() {
        return totalItems > 0 ? 100.0 * labeled / totalItems : 0.0;
    }

    public double getAvgMissedPerBox() {
        return boxes > 0 ? (double) missed / boxes : 0.0;
    }

    public int getRobots() {
        return robots;
    }

    public int getBackups() {
        return backups;
    }

    public double getFailureProbability() {
        return failureProbability;
    }

    public int getBoxes() {
        return boxes;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public int getLabeled() {
        return labeled;
    }

    public int getMissed() {
        return missed;
    }

    public int getFailures() {
        return failures;
    }

    public int getBackupActivations() {
        return backupActivations;
    }

    /**
     * Etichette applicate da ciascun robot, indicizzate per id.
     */
    public List<Integer> getLabelsPerRobot() {
        return labelsPerRobot;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    @Override
    public String toString() {
        return "BatchResult{" +
                "robots=" + robots +
                ", backups=" + backups +
                ", failureProbability=" + failureProbability +
                ", efficiency=" + getEfficiency() +
                ", missed=" + missed +
                ", failures=" + failures +
                '}';
    }
}
