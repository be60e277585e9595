package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.SystemParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Analisi parametriche basate su {@link BatchEstimator}: numero minimo di robot per una
 * copertura piena e ricambi necessari al variare della probabilità di guasto.
 */
public class SweepAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SweepAnalyzer.class);

    public static final int RUNS_PER_CONFIGURATION = 5;
    public static final int MAX_ROBOTS_ROBOT_SWEEP = 15;
    public static final int MAX_ROBOTS_FAILURE_SWEEP = 16;
    public static final double TARGET_EFFICIENCY = 99.9;
    public static final double[] FAILURE_PROBABILITIES = {0.0, 0.05, 0.10, 0.15, 0.20, 0.25, 0.30};

    private final SystemParameters base;
    private final BatchEstimator estimator;

    public SweepAnalyzer(SystemParameters base, BatchEstimator estimator) {
        this.base = base;
        this.estimator = estimator;
    }

    private record Aggregate(double avg, double min, double max, double avgMissedPerBox) {
    }

    /**
     * Aumenta i robot da 1 finché la spaziatura resta almeno pari alla scatola. Il primo
     * numero con efficienza media almeno {@value #TARGET_EFFICIENCY} è l'ottimo e chiude l'analisi.
     */
    public List<RobotSweepRecord> robotSweep() {
        Random seeds = new Random(base.getSeed());
        List<RobotSweepRecord> records = new ArrayList<>();
        for (int r = 1; r <= MAX_ROBOTS_ROBOT_SWEEP; r++) {
            if (base.getBeltLength() / r < base.getBoxSize()) {
                break;
            }
            Aggregate aggregate = runConfiguration(r, 0, 0.0, seeds);
            boolean optimal = aggregate.avg() >= TARGET_EFFICIENCY;
            records.add(new RobotSweepRecord(r, aggregate.avg(), aggregate.min(), aggregate.max(),
                    aggregate.avgMissedPerBox(), optimal));
            logger.info("Robot sweep: {} robot(s) -> avg {}% (min {}%, max {}%), {} missed/box{}",
                    r, format(aggregate.avg()), format(aggregate.min()), format(aggregate.max()),
                    format(aggregate.avgMissedPerBox()), optimal ? " [optimal]" : "");
            if (optimal) {
                break;
            }
        }
        return records;
    }

    /**
     * Per ogni probabilità di guasto cerca il numero di robot con la migliore efficienza
     * senza ricambi, poi ripete la ricerca con {@code floor(ottimo * p) + 1} ricambi.
     */
    public List<FailureSweepRecord> failureSweep() {
        Random seeds = new Random(base.getSeed());
        List<FailureSweepRecord> records = new ArrayList<>();
        for (double p : FAILURE_PROBABILITIES) {
            Best noBackup = findBest(0, p, seeds);
            int backupCount = (int) Math.floor(noBackup.robots() * p) + 1;
            Best withBackup = findBest(backupCount, p, seeds);

            records.add(new FailureSweepRecord(p, noBackup.robots(), noBackup.efficiency(),
                    withBackup.robots(), backupCount, withBackup.efficiency()));
            logger.info("Failure sweep p={}: {} robot(s) -> {}% without backup, {} robot(s) + {} backup(s) -> {}%",
                    format(p), noBackup.robots(), format(noBackup.efficiency()), withBackup.robots(),
                    backupCount, format(withBackup.efficiency()));
        }
        return records;
    }

    private record Best(int robots, double efficiency) {
    }

    // Primo numero di robot con la migliore efficienza media; si ferma appena raggiunge l'obiettivo
    private Best findBest(int backups, double failureProbability, Random seeds) {
        Best best = new Best(1, -1.0);
        int maxRobots = Math.min(MAX_ROBOTS_FAILURE_SWEEP, SystemParameters.MAX_ROBOTS - backups);
        for (int r = 1; r <= maxRobots; r++) {
            double efficiency = runConfiguration(r, backups, failureProbability, seeds).avg();
            if (efficiency > best.efficiency()) {
                best = new Best(r, efficiency);
            }
            if (efficiency >= TARGET_EFFICIENCY) {
                break;
            }
        }
        return best;
    }

    private Aggregate runConfiguration(int robots, int backups, double failureProbability, Random seeds) {
        double total = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double missedPerBox = 0.0;
        for (int run = 0; run < RUNS_PER_CONFIGURATION; run++) {
            SystemParameters params = base.toBuilder()
                    .robots(robots)
                    .backups(backups)
                    .failureProbability(failureProbability)
                    .seed(seeds.nextLong())
                    .build();
            BatchResult result = estimator.run(params);
            double efficiency = result.getEfficiency();
            total += efficiency;
            min = Math.min(min, efficiency);
            max = Math.max(max, efficiency);
            missedPerBox += result.getAvgMissedPerBox();
        }
        return new Aggregate(total / RUNS_PER_CONFIGURATION, min, max, missedPerBox / RUNS_PER_CONFIGURATION);
    }

    private static String format(double value) {
        return String.format("%.2f", value);
    }
}
