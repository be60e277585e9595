package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Robot;
import it.unimore.iot.labelingline.model.RobotState;
import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.model.StatsDelta;
import it.unimore.iot.labelingline.model.SystemParameters;
import it.unimore.iot.labelingline.transport.StatusSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FailureBackupManagerTest {

    private static class RecordingSink implements StatusSink {
        final List<RobotStatus> statuses = new ArrayList<>();
        final List<StatsDelta> deltas = new ArrayList<>();

        @Override
        public void publishRobotStatus(RobotStatus status) {
            statuses.add(status);
        }

        @Override
        public void publishStats(StatsDelta delta) {
            deltas.add(delta);
        }
    }

    private RecordingSink sink;
    private RobotRoster roster;
    private FailureBackupManager manager;

    @BeforeEach
    void setUp() {
        SystemParameters params = SystemParameters.builder().robots(3).backups(1).seed(1).build();
        roster = RobotRoster.create(params, ZonePlanner.plan(params));
        sink = new RecordingSink();
        manager = new FailureBackupManager(roster, sink);
    }

    @Test
    void onFailure_shouldBindFirstFreeBackupToFailedZone() {
        Robot failed = roster.get(1);

        Optional<Robot> backup = manager.onFailure(failed);

        assertTrue(backup.isPresent());
        assertEquals(3, backup.get().getId());
        assertEquals(failed.getAxisPosition(), backup.get().getAxisPosition());
        assertEquals(RobotState.BACKUP, backup.get().getState());
        assertEquals(1, sink.deltas.stream().mapToInt(StatsDelta::getFailures).sum());
        assertEquals(1, sink.deltas.stream().mapToInt(StatsDelta::getBackupActivations).sum());
        assertEquals(2, sink.statuses.size());
    }

    @Test
    void onFailure_withoutBackupsLeavesZoneUncovered() {
        manager.onFailure(roster.get(0));

        Optional<Robot> second = manager.onFailure(roster.get(2));

        assertTrue(second.isEmpty());
        assertTrue(roster.get(2).hasFailed());
        assertEquals(2, sink.deltas.stream().mapToInt(StatsDelta::getFailures).sum());
        assertEquals(1, sink.deltas.stream().mapToInt(StatsDelta::getBackupActivations).sum());
    }

    @Test
    void onFailure_isCountedOnce() {
        Robot robot = roster.get(0);
        manager.onFailure(robot);
        int published = sink.deltas.size();

        assertTrue(manager.onFailure(robot).isEmpty());
        assertEquals(published, sink.deltas.size());
    }

    @Test
    void checkFailure_followsProbabilityAndRequests() {
        Random random = new Random(5);
        Robot robot = roster.get(0);
        assertFalse(manager.checkFailure(robot, random));

        robot.requestFailure();
        assertTrue(manager.checkFailure(robot, random));

        assertFalse(manager.checkFailure(roster.get(3), random));

        SystemParameters always = SystemParameters.builder().robots(1).backups(0).failureProbability(1.0).seed(1).build();
        RobotRoster certain = RobotRoster.create(always, ZonePlanner.plan(always));
        assertTrue(manager.checkFailure(certain.get(0), random));
    }
}
