package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.SystemParameters;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SweepAnalyzerTest {

    @Test
    void robotSweep_stopsAtFirstOptimalConfiguration() {
        SystemParameters base = SystemParameters.builder().itemsRange(5, 9).boxCount(10).seed(8).build();

        List<RobotSweepRecord> records = new SweepAnalyzer(base, new BatchEstimator()).robotSweep();

        assertEquals(1, records.size());
        RobotSweepRecord record = records.get(0);
        assertEquals(1, record.robots());
        assertTrue(record.optimal());
        assertEquals(100.0, record.avgEfficiency(), 1e-9);
        assertEquals(0.0, record.avgMissedPerBox(), 1e-9);
    }

    @Test
    void robotSweep_stopsWhenSpacingDropsBelowBoxSize() {
        SystemParameters base = SystemParameters.builder().itemsRange(10, 12).boxCount(5).seed(8).build();

        List<RobotSweepRecord> records = new SweepAnalyzer(base, new BatchEstimator()).robotSweep();

        // 300 / 7 < 50: l'analisi si ferma a 6 robot
        assertEquals(6, records.size());
        assertTrue(records.stream().noneMatch(RobotSweepRecord::optimal));
        for (RobotSweepRecord record : records) {
            assertTrue(record.minEfficiency() <= record.avgEfficiency() && record.avgEfficiency() <= record.maxEfficiency());
        }
    }

    @Test
    void failureSweep_sizesBackupsFromOptimalRobots() {
        SystemParameters base = SystemParameters.builder().itemsRange(5, 9).boxCount(5).seed(8).build();

        List<FailureSweepRecord> records = new SweepAnalyzer(base, new BatchEstimator()).failureSweep();

        assertEquals(SweepAnalyzer.FAILURE_PROBABILITIES.length, records.size());
        FailureSweepRecord noFailures = records.get(0);
        assertEquals(0.0, noFailures.failureProbability());
        assertEquals(1, noFailures.robotsNoBackup());
        assertEquals(100.0, noFailures.efficiencyNoBackup(), 1e-9);
        assertEquals(1, noFailures.backupCount());
        for (FailureSweepRecord record : records) {
            assertEquals((int) Math.floor(record.robotsNoBackup() * record.failureProbability()) + 1,
                    record.backupCount());
            assertFalse(record.efficiencyWithBackup() < 0.0);
        }
    }
}
