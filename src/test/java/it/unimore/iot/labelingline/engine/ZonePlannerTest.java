package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.SystemParameters;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ZonePlannerTest {

    private static final double EPS = 1e-9;

    @Test
    void planZones_shouldCenterRobotsInSegments() {
        assertArrayEquals(new double[]{37.5, 112.5, 187.5, 262.5}, ZonePlanner.planZones(4, 300.0), EPS);
        assertArrayEquals(new double[]{150.0}, ZonePlanner.planZones(1, 300.0), EPS);
    }

    @Test
    void planZones_rejectsEmptyLine() {
        assertThrows(IllegalArgumentException.class, () -> ZonePlanner.planZones(0, 300.0));
    }

    @Test
    void zoneWindows_lastZoneExtendsToBeltEnd() {
        double[] axis = ZonePlanner.planZones(6, 300.0);
        double[] windows = ZonePlanner.zoneWindows(axis, 300.0, 10.0);

        for (int i = 0; i < 5; i++) {
            assertEquals(5.0, windows[i], EPS);
        }
        assertEquals(2.5, windows[5], EPS);
    }

    @Test
    void itemsPerRobot_shouldNotLoseCapacityToRounding() {
        SystemParameters params = SystemParameters.builder().robots(1).backups(0).seed(1).build();

        // 30 s di finestra con 3.33 s per etichetta: 9 oggetti, non 8
        assertEquals(50.0 / 3.0 / 5.0, ZonePlanner.timePerLabel(params), EPS);
        assertEquals(9, ZonePlanner.itemsPerRobot(30.0, params));
        assertEquals(1, ZonePlanner.itemsPerRobot(0.5, params));
    }

    @Test
    void plan_shouldExposeStationCapacity() {
        SystemParameters params = SystemParameters.builder().robots(4).backups(0).seed(1).build();

        ZonePlan plan = ZonePlanner.plan(params);

        assertEquals(4, plan.getZoneCount());
        assertEquals(7.5, plan.getStationWindow(), EPS);
        assertEquals(2, plan.getItemsPerStation());
        assertEquals(3, plan.requiredRobots(5));
        // mai più dei robot principali
        assertEquals(4, plan.requiredRobots(12));
        assertEquals(1, plan.requiredRobots(1));
    }

    @Test
    void requiredRobots_isCeilingDivision() {
        assertEquals(2, ZonePlanner.requiredRobots(10, 9));
        assertEquals(1, ZonePlanner.requiredRobots(9, 9));
        assertEquals(0, ZonePlanner.requiredRobots(0, 9));
    }
}
