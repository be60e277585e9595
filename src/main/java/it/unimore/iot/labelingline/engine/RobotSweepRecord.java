package it.unimore.iot.labelingline.engine;

/**
 * Riga dell'analisi sul numero di robot: efficienza media, minima e massima sulle
 * ripetizioni e oggetti persi per scatola.
 */
public record RobotSweepRecord(int robots, double avgEfficiency, double minEfficiency, double maxEfficiency,
                               double avgMissedPerBox, boolean optimal) {
}
