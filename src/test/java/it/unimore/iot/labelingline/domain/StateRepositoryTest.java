package it.unimore.iot.labelingline.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimore.iot.labelingline.model.CommandAck;
import it.unimore.iot.labelingline.model.LineCommand;
import it.unimore.iot.labelingline.model.RobotState;
import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.model.SimulationStats;
import it.unimore.iot.labelingline.model.StatsDelta;
import it.unimore.iot.labelingline.model.SystemParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StateRepositoryTest {

    // Controller fittizio che registra i comandi ricevuti
    private static class StubController implements LineController {
        boolean running = true;
        boolean stopped;
        final Set<Integer> failable = new HashSet<>(Set.of(0, 1, 2));
        final List<Integer> failed = new ArrayList<>();

        @Override
        public void stop() {
            stopped = true;
        }

        @Override
        public boolean injectFailure(int robotId) {
            if (failable.remove(robotId)) {
                failed.add(robotId);
                return true;
            }
            return false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }
    }

    private StateRepository repository;
    private StubController controller;

    @BeforeEach
    void setUp() {
        repository = new StateRepository("line-t", SystemParameters.builder().seed(1).build());
        controller = new StubController();
    }

    @Test
    void commands_areRejectedWithoutRunningSimulation() {
        CommandAck ack = repository.dispatchCommand(new LineCommand(LineCommand.STOP, null, 0L));

        assertFalse(ack.isAccepted());
        assertEquals(CommandAck.REJECTED, ack.getStatus());
        assertFalse(repository.isRunning());
    }

    @Test
    void stop_isNormalizedAndForwarded() {
        repository.registerController(controller);

        CommandAck ack = repository.dispatchCommand(new LineCommand(" stop ", null, 0L, "m-1"));

        assertTrue(ack.isAccepted());
        assertEquals("STOP", ack.getCmdType());
        assertEquals("m-1", ack.getMsgId());
        assertTrue(controller.stopped);
    }

    @Test
    void fail_requiresValidRobot() {
        repository.registerController(controller);

        assertFalse(repository.dispatchCommand(new LineCommand(LineCommand.FAIL, null, 0L)).isAccepted());
        assertTrue(repository.dispatchCommand(new LineCommand(LineCommand.FAIL, 1, 0L)).isAccepted());
        assertFalse(repository.dispatchCommand(new LineCommand(LineCommand.FAIL, 1, 0L)).isAccepted());
        assertFalse(repository.dispatchCommand(new LineCommand("RESET", null, 0L)).isAccepted());
        assertEquals(List.of(1), controller.failed);
    }

    @Test
    void updates_reachListenersAndQueries() throws Exception {
        List<RobotStatus> robotUpdates = new ArrayList<>();
        List<SimulationStats> statsUpdates = new ArrayList<>();
        repository.addRobotListener(1, robotUpdates::add);
        repository.addStatsListener(statsUpdates::add);

        repository.publishRobotStatus(new RobotStatus(1, 10L, RobotState.ACTIVE, 0, false, null, 112.5, false));
        repository.publishRobotStatus(new RobotStatus(0, 10L, RobotState.IDLE, 0, false, null, 37.5, false));
        repository.publishStats(new StatsDelta(1, 10, 8, 2, 0, 0, 0, 10L));
        repository.publishStats(StatsDelta.robotFailure());

        assertEquals(1, robotUpdates.size());
        assertEquals(2, statsUpdates.size());
        assertEquals(1, statsUpdates.get(1).getRobotFailures());
        assertEquals(80.0, repository.getStats().efficiency(), 1e-9);
        assertEquals(List.of(0, 1), repository.listRobots().stream().map(RobotStatus::getRobotId).collect(Collectors.toList()));

        JsonNode robots = new ObjectMapper().readTree(repository.listRobotsJson());
        assertEquals(2, robots.get("robots").size());
        assertEquals("IDLE", robots.get("robots").get(0).get("state").asText());

        JsonNode summary = new ObjectMapper().readTree(repository.getLineSummaryJson());
        assertEquals("line-t", summary.get("lineId").asText());
        assertEquals(4, summary.get("parameters").get("robots").asInt());
    }
}
