package it.unimore.iot.labelingline.model;

/**
 * Incremento dei contatori aggregati prodotto da un singolo evento della linea
 * (scatola uscita, guasto, attivazione di un ricambio, errore di trasporto).
 */
public class StatsDelta {

    private int boxes;
    private int items;
    private int labeled;
    private int missed;
    private int failures;
    private int backupActivations;
    private int transportErrors;
    private long timestamp;

    public StatsDelta() {
    }

    public StatsDelta(int boxes, int items, int labeled, int missed, int failures, int backupActivations,
                      int transportErrors, long timestamp) {
        this.boxes = boxes;
        this.items = items;
        this.labeled = labeled;
        this.missed = missed;
        this.failures = failures;
        this.backupActivations = backupActivations;
        this.transportErrors = transportErrors;
        this.timestamp = timestamp;
    }

    // Esito di una scatola uscita dalla linea
    public static StatsDelta boxDeparted(Box box) {
        return new StatsDelta(1, box.getNumItems(), box.getLabeledCount(), box.getMissedCount(),
                0, 0, 0, System.currentTimeMillis());
    }

    public static StatsDelta robotFailure() {
        return new StatsDelta(0, 0, 0, 0, 1, 0, 0, System.currentTimeMillis());
    }

    public static StatsDelta backupActivation() {
        return new StatsDelta(0, 0, 0, 0, 0, 1, 0, System.currentTimeMillis());
    }

    public static StatsDelta transportError() {
        return new StatsDelta(0, 0, 0, 0, 0, 0, 1, System.currentTimeMillis());
    }

    public int getBoxes() {
        return boxes;
    }

    public void setBoxes(int boxes) {
        this.boxes = boxes;
    }

    public int getItems() {
        return items;
    }

    public void setItems(int items) {
        this.items = items;
    }

    public int getLabeled() {
        return labeled;
    }

    public void setLabeled(int labeled) {
        this.labeled = labeled;
    }

    public int getMissed() {
        return missed;
    }

    public void setMissed(int missed) {
        this.missed = missed;
    }

    public int getFailures() {
        return failures;
    }

    public void setFailures(int failures) {
        this.failures = failures;
    }

    public int getBackupActivations() {
        return backupActivations;
    }

    public void setBackupActivations(int backupActivations) {
        this.backupActivations = backupActivations;
    }

    public int getTransportErrors() {
        return transportErrors;
    }

    public void setTransportErrors(int transportErrors) {
        this.transportErrors = transportErrors;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "StatsDelta{" +
                "boxes=" + boxes +
                ", items=" + items +
                ", labeled=" + labeled +
                ", missed=" + missed +
                ", failures=" + failures +
                ", backupActivations=" + backupActivations +
                ", transportErrors=" + transportErrors +
                '}';
    }
}
