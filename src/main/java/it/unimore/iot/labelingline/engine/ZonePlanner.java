package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.SystemParameters;

/**
 * Calcola la disposizione dei robot lungo il nastro e la capacità di etichettatura di ogni zona.
 */
public final class ZonePlanner {

    // Tolleranza sul rapporto finestra / tempo per etichetta prima del troncamento
    private static final double CAPACITY_EPSILON = 1e-9;

    private ZonePlanner() {
    }

    public static ZonePlan plan(SystemParameters params) {
        double[] axis = planZones(params.getRobots(), params.getBeltLength());
        double[] windows = zoneWindows(axis, params.getBeltLength(), params.getBeltSpeed());
        double stationWindow = params.getRobotSpacing() / params.getBeltSpeed();
        return new ZonePlan(axis, windows, stationWindow, itemsPerRobot(stationWindow, params));
    }

    /**
     * Robot equidistanti, ciascuno al centro del proprio segmento: {@code (i + 0.5) * L / n}.
     */
    public static double[] planZones(int numActiveRobots, double beltLength) {
        if (numActiveRobots < 1) {
            throw new IllegalArgumentException("At least one robot is required, got " + numActiveRobots);
        }
        double segment = beltLength / numActiveRobots;
        double[] axis = new double[numActiveRobots];
        for (int i = 0; i < numActiveRobots; i++) {
            axis[i] = (i + 0.5) * segment;
        }
        return axis;
    }

    /**
     * Finestra della zona i: distanza dall'asse successivo divisa per la velocità del nastro.
     * L'ultima zona si estende fino alla fine del nastro.
     */
    public static double[] zoneWindows(double[] axis, double beltLength, double beltSpeed) {
        double[] windows = new double[axis.length];
        for (int i = 0; i < axis.length; i++) {
            double next = i + 1 < axis.length ? axis[i + 1] : beltLength;
            windows[i] = (next - axis[i]) / beltSpeed;
        }
        return windows;
    }

    /**
     * Tempo medio per etichetta, con una distanza media di un terzo della scatola.
     */
    public static double timePerLabel(SystemParameters params) {
        return (params.getBoxSize() / 3.0) / params.getRobotSpeed();
    }

    /**
     * Oggetti che un robot riesce a etichettare nella finestra indicata, almeno uno.
     */
    public static int itemsPerRobot(double window, SystemParameters params) {
        int items = (int) Math.floor(window / timePerLabel(params) + CAPACITY_EPSILON);
        return Math.max(1, items);
    }

    public static int requiredRobots(int numItems, int itemsPerRobot) {
        return (numItems + itemsPerRobot - 1) / itemsPerRobot;
    }
}
