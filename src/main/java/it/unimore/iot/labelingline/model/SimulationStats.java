package it.unimore.iot.labelingline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contatori aggregati di un'esecuzione. Ogni evento li incrementa una sola volta
 * tramite {@link #apply(StatsDelta)}; la lettura avviene per il reporting.
 */
public class SimulationStats {

    private int totalBoxes;
    private int totalItems;
    private int itemsLabeled;
    private int itemsMissed;
    private int robotFailures;
    private int backupActivations;
    private int transportErrors;

    public SimulationStats() {
    }

    private SimulationStats(SimulationStats other) {
        this.totalBoxes = other.totalBoxes;
        this.totalItems = other.totalItems;
        this.itemsLabeled = other.itemsLabeled;
        this.itemsMissed = other.itemsMissed;
        this.robotFailures = other.robotFailures;
        this.backupActivations = other.backupActivations;
        this.transportErrors = other.transportErrors;
    }

    public synchronized void apply(StatsDelta delta) {
        totalBoxes += delta.getBoxes();
        totalItems += delta.getItems();
        itemsLabeled += delta.getLabeled();
        itemsMissed += delta.getMissed();
        robotFailures += delta.getFailures();
        backupActivations += delta.getBackupActivations();
        transportErrors += delta.getTransportErrors();
    }

    // Copia coerente dei contatori
    public synchronized SimulationStats snapshot() {
        return new SimulationStats(this);
    }

    /**
     * Percentuale di oggetti etichettati sul totale presentato; 0 se non è passato alcun oggetto.
     */
    @JsonProperty("efficiency")
    public synchronized double efficiency() {
        return totalItems > 0 ? 100.0 * itemsLabeled / totalItems : 0.0;
    }

    public synchronized int getTotalBoxes() {
        return totalBoxes;
    }

    public synchronized int getTotalItems() {
        return totalItems;
    }

    public synchronized int getItemsLabeled() {
        return itemsLabeled;
    }

    public synchronized int getItemsMissed() {
        return itemsMissed;
    }

    public synchronized int getRobotFailures() {
        return robotFailures;
    }

    public synchronized int getBackupActivations() {
        return backupActivations;
    }

    public synchronized int getTransportErrors() {
        return transportErrors;
    }

    @Override
    public synchronized String toString() {
        return "SimulationStats{" +
                "totalBoxes=" + totalBoxes +
                ", totalItems=" + totalItems +
                ", itemsLabeled=" + itemsLabeled +
                ", itemsMissed=" + itemsMissed +
                ", robotFailures=" + robotFailures +
                ", backupActivations=" + backupActivations +
                ", transportErrors=" + transportErrors +
                '}';
    }
}
