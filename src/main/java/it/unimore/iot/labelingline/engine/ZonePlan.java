package it.unimore.iot.labelingline.engine;

import java.util.Arrays;

/**
 * Piano delle zone per una linea: assi dei robot principali, finestra temporale di
 * ciascuna zona e capacità stimata per stazione.
 */
public class ZonePlan {

    private final double[] axisPositions;
    private final double[] windows;
    private final double stationWindow;
    private final int itemsPerStation;
    private final int robots;

    ZonePlan(double[] axisPositions, double[] windows, double stationWindow, int itemsPerStation) {
        this.axisPositions = axisPositions.clone();
        this.windows = windows.clone();
        this.stationWindow = stationWindow;
        this.itemsPerStation = itemsPerStation;
        this.robots = axisPositions.length;
    }

    public int getZoneCount() {
        return robots;
    }

    public double axisPosition(int zoneIndex) {
        return axisPositions[zoneIndex];
    }

    /**
     * Tempo massimo (secondi simulati) che il robot della zona può dedicare a una scatola.
     */
    public double window(int zoneIndex) {
        return windows[zoneIndex];
    }

    /**
     * Finestra uniforme di una stazione: spaziatura fra robot divisa per la velocità del nastro.
     */
    public double getStationWindow() {
        return stationWindow;
    }

    public int getItemsPerStation() {
        return itemsPerStation;
    }

    /**
     * Robot necessari per una scatola di {@code numItems} oggetti, limitati ai robot principali.
     */
    public int requiredRobots(int numItems) {
        return Math.min(robots, ZonePlanner.requiredRobots(numItems, itemsPerStation));
    }

    public double[] getAxisPositions() {
        return axisPositions.clone();
    }

    @Override
    public String toString() {
        return "ZonePlan{" +
                "axisPositions=" + Arrays.toString(axisPositions) +
                ", windows=" + Arrays.toString(windows) +
                ", itemsPerStation=" + itemsPerStation +
                '}';
    }
}
