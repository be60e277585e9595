package it.unimore.iot.labelingline.model;

/**
 * Esito di una scatola all'uscita dalla linea.
 */
public class BoxResult {

    private int boxId;
    private int numItems;
    private int labeled;
    private int missed;
    private int degradedPlacements;

    public BoxResult() {
    }

    public BoxResult(int boxId, int numItems, int labeled, int missed, int degradedPlacements) {
        this.boxId = boxId;
        this.numItems = numItems;
        this.labeled = labeled;
        this.missed = missed;
        this.degradedPlacements = degradedPlacements;
    }

    public static BoxResult of(Box box) {
        int degraded = (int) box.getItems().stream().filter(Item::isPlacementDegraded).count();
        return new BoxResult(box.getId(), box.getNumItems(), box.getLabeledCount(), box.getMissedCount(), degraded);
    }

    public int getBoxId() {
        return boxId;
    }

    public void setBoxId(int boxId) {
        this.boxId = boxId;
    }

    public int getNumItems() {
        return numItems;
    }

    public void setNumItems(int numItems) {
        this.numItems = numItems;
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

    public int getDegradedPlacements() {
        return degradedPlacements;
    }

    public void setDegradedPlacements(int degradedPlacements) {
        this.degradedPlacements = degradedPlacements;
    }

    @Override
    public String toString() {
        return "BoxResult{" +
                "boxId=" + boxId +
                ", numItems=" + numItems +
                ", labeled=" + labeled +
                ", missed=" + missed +
                '}';
    }
}
