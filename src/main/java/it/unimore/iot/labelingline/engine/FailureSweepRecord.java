package it.unimore.iot.labelingline.engine;

/**
 * Riga dell'analisi sui guasti: numero ottimo di robot senza ricambi e con ricambi,
 * con le rispettive efficienze.
 */
public record FailureSweepRecord(double failureProbability, int robotsNoBackup, double efficiencyNoBackup,
                                 int robotsWithBackup, int backupCount, double efficiencyWithBackup) {
}
