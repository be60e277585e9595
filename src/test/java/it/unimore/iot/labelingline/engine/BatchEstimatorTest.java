package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.model.Item;
import it.unimore.iot.labelingline.model.ItemState;
import it.unimore.iot.labelingline.model.Robot;
import it.unimore.iot.labelingline.model.SystemParameters;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BatchEstimatorTest {

    private final BatchEstimator estimator = new BatchEstimator();

    @Test
    void singleRobot_labelsItsCapacityAndMissesTheRest() {
        SystemParameters params = SystemParameters.builder()
                .robots(1).backups(0).itemsRange(20, 20).boxCount(5).seed(11).build();

        BatchResult result = estimator.run(params);

        assertEquals(5, result.getBoxes());
        assertEquals(100, result.getTotalItems());
        assertEquals(45, result.getLabeled());
        assertEquals(result.getTotalItems() - result.getLabeled(), result.getMissed());
        assertEquals(11.0, result.getAvgMissedPerBox(), 1e-9);
        assertEquals(List.of(45), result.getLabelsPerRobot());
    }

    @Test
    void capacityCoveringTheBox_givesFullEfficiency() {
        for (int items = 5; items <= 9; items++) {
            SystemParameters params = SystemParameters.builder()
                    .robots(1).backups(0).itemsRange(items, items).boxCount(10).seed(items).build();

            assertEquals(100.0, estimator.run(params).getEfficiency(), 1e-9, "items per box: " + items);
        }
    }

    @Test
    void certainFailureWithoutBackups_labelsNothing() {
        SystemParameters params = SystemParameters.builder()
                .robots(4).backups(0).failureProbability(1.0).itemsRange(10, 10).boxCount(8).seed(3).build();

        BatchResult result = estimator.run(params);

        assertEquals(0, result.getLabeled());
        assertEquals(80, result.getMissed());
        assertEquals(4, result.getFailures());
        assertEquals(0, result.getBackupActivations());
        assertEquals(0.0, result.getEfficiency());
    }

    @Test
    void backups_takeOverFailedZones() {
        SystemParameters params = SystemParameters.builder()
                .robots(2).backups(2).failureProbability(1.0).itemsRange(8, 8).boxCount(6).seed(3).build();

        BatchResult result = estimator.run(params);

        assertEquals(2, result.getFailures());
        assertEquals(2, result.getBackupActivations());
        assertEquals(100.0, result.getEfficiency(), 1e-9);
        assertEquals(List.of(0, 0, 24, 24), result.getLabelsPerRobot());
    }

    @Test
    void failures_areDrawnOnEveryBox() {
        int runsWithFailure = 0;
        for (long seed = 0; seed < 200; seed++) {
            SystemParameters params = SystemParameters.builder()
                    .robots(1).backups(0).failureProbability(0.3).itemsRange(10, 10).boxCount(20).seed(seed).build();

            BatchResult result = estimator.run(params);

            assertTrue(result.getFailures() <= 1);
            if (result.getFailures() == 1) {
                runsWithFailure++;
            }
        }
        // su 20 scatole la probabilità di nessun guasto è 0.7^20, meno di 0.1%
        assertTrue(runsWithFailure >= 190, "runs with a failure: " + runsWithFailure);
    }

    @Test
    void failureMidRun_keepsBoxesLabeledBeforeIt() {
        int runsWithPartialWork = 0;
        for (long seed = 0; seed < 50; seed++) {
            SystemParameters params = SystemParameters.builder()
                    .robots(1).backups(0).failureProbability(0.3).itemsRange(5, 5).boxCount(20).seed(seed).build();

            BatchResult result = estimator.run(params);

            // prima del guasto il robot copre la scatola intera, dopo nessun oggetto
            assertEquals(0, result.getLabeled() % 5);
            if (result.getLabeled() > 0 && result.getLabeled() < 100) {
                runsWithPartialWork++;
            }
        }
        assertTrue(runsWithPartialWork > 0);
    }

    @Test
    void sameSeed_givesSameResult() {
        SystemParameters params = SystemParameters.builder()
                .robots(3).backups(1).failureProbability(0.3).boxCount(20).seed(2024).build();

        BatchResult first = estimator.run(params);
        BatchResult second = estimator.run(params);

        assertEquals(first.getLabeled(), second.getLabeled());
        assertEquals(first.getFailures(), second.getFailures());
        assertEquals(first.getLabelsPerRobot(), second.getLabelsPerRobot());
    }

    @Test
    void allocate_visitsStationsInAxisOrderWithCapacity() {
        SystemParameters params = SystemParameters.builder().robots(4).backups(0).seed(1).build();
        ZonePlan plan = ZonePlanner.plan(params);
        RobotRoster roster = RobotRoster.create(params, plan);
        List<Item> items = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            items.add(new Item(i, i, 0.0, false));
        }
        Box box = new Box(0, items, 0.0);
        List<Robot> stations = roster.inAxisOrder();

        estimator.allocate(box, stations, plan, params);

        // due oggetti per stazione, nell'ordine della scatola
        assertEquals(7, box.getLabeledCount());
        assertEquals(0, box.getItem(0).getClaimedBy());
        assertEquals(0, box.getItem(1).getClaimedBy());
        assertEquals(1, box.getItem(2).getClaimedBy());
        assertEquals(3, box.getItem(6).getClaimedBy());
        assertTrue(box.getItems().stream().allMatch(item -> item.getState() == ItemState.LABELED));
        assertEquals(1, roster.get(3).getLabelsPlaced());
    }
}
