package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.exception.TransportException;
import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.model.BoxResult;
import it.unimore.iot.labelingline.model.RobotState;
import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.model.SimulationStats;
import it.unimore.iot.labelingline.model.SystemParameters;
import it.unimore.iot.labelingline.transport.BoxSource;
import it.unimore.iot.labelingline.transport.InMemoryBoxChannel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(value = 60, unit = TimeUnit.SECONDS)
public class LiveSimulationTest {

    private static final double TIME_SCALE = 0.005;

    // Canale già riempito con tutte le scatole e chiuso
    private static InMemoryBoxChannel filledChannel(SystemParameters params) throws TransportException {
        InMemoryBoxChannel channel = new InMemoryBoxChannel();
        BoxGenerator generator = new BoxGenerator(params);
        Random random = new Random(params.getSeed());
        for (int i = 0; i < params.getBoxCount(); i++) {
            channel.send(generator.generate(i, random, i * params.getBoxInterval()));
        }
        channel.complete();
        return channel;
    }

    private static void assertConsistent(LiveSimulationResult result) {
        SimulationStats stats = result.getStats();
        assertEquals(stats.getTotalItems(), stats.getItemsLabeled() + stats.getItemsMissed());
        assertEquals(stats.getTotalBoxes(), result.getBoxes().size());
        for (BoxResult box : result.getBoxes()) {
            assertEquals(box.getNumItems(), box.getLabeled() + box.getMissed());
        }
        int labelsByRobots = result.getRobots().stream().mapToInt(RobotStatus::getLabelsPlaced).sum();
        assertEquals(stats.getItemsLabeled(), labelsByRobots);
    }

    @Test
    void sixRobots_labelAlmostEverything() throws Exception {
        SystemParameters params = SystemParameters.builder()
                .robots(6).backups(0).itemsRange(10, 10).boxCount(20).seed(17).timeScale(TIME_SCALE).build();
        LiveSimulation simulation = new LiveSimulation(new LineContext("live-test", params), filledChannel(params));

        LiveSimulationResult result = simulation.run();

        assertConsistent(result);
        assertEquals(20, result.getStats().getTotalBoxes());
        assertEquals(200, result.getStats().getTotalItems());
        // media attesa circa 98.8%, su 20 scatole mai sotto il 95% con tempi ideali
        assertTrue(result.getEfficiency() >= 93.0, "efficiency " + result.getEfficiency());
        assertFalse(result.isStopped());
        assertFalse(simulation.isRunning());
    }

    @Test
    void singleRobot_cannotClearCrowdedBoxes() throws Exception {
        SystemParameters params = SystemParameters.builder()
                .robots(1).backups(0).itemsRange(20, 20).boxCount(3).seed(4).timeScale(TIME_SCALE).build();
        LiveSimulation simulation = new LiveSimulation(new LineContext("live-test", params), filledChannel(params));

        LiveSimulationResult result = simulation.run();

        assertConsistent(result);
        assertEquals(60, result.getStats().getTotalItems());
        assertTrue(result.getStats().getItemsMissed() > 0);
        for (BoxResult box : result.getBoxes()) {
            assertEquals(20, box.getNumItems());
            assertTrue(box.getMissed() > 0, "box " + box.getBoxId());
            assertEquals(box.getNumItems() - box.getLabeled(), box.getMissed());
        }
    }

    @Test
    void labeledCount_neverDecreasesWhileBoxIsOnTheBelt() throws Exception {
        SystemParameters params = SystemParameters.builder()
                .robots(4).backups(0).itemsRange(10, 12).boxCount(6).seed(21).timeScale(TIME_SCALE).build();
        InMemoryBoxChannel channel = filledChannel(params);
        AtomicReference<Box> current = new AtomicReference<>();
        BoxSource observed = new BoxSource() {
            @Override
            public Optional<Box> receiveNextBox(boolean blocking) throws TransportException, InterruptedException {
                Optional<Box> box = channel.receiveNextBox(blocking);
                box.ifPresent(current::set);
                return box;
            }

            @Override
            public boolean isExhausted() {
                return channel.isExhausted();
            }
        };
        LiveSimulation simulation = new LiveSimulation(new LineContext("live-test", params), observed);

        AtomicBoolean done = new AtomicBoolean();
        AtomicInteger samples = new AtomicInteger();
        List<String> violations = new CopyOnWriteArrayList<>();
        Thread sampler = new Thread(() -> {
            Map<Integer, Integer> lastSeen = new HashMap<>();
            while (!done.get()) {
                Box box = current.get();
                if (box != null) {
                    int count = box.getLabeledCount();
                    Integer previous = lastSeen.put(box.getId(), count);
                    if (previous != null && count < previous) {
                        violations.add("box " + box.getId() + ": " + previous + " -> " + count);
                    }
                    if (count > box.getNumItems()) {
                        violations.add("box " + box.getId() + ": " + count + " labels for " + box.getNumItems() + " items");
                    }
                    samples.incrementAndGet();
                }
                Thread.onSpinWait();
            }
        });
        sampler.start();
        LiveSimulationResult result;
        try {
            result = simulation.run();
        } finally {
            done.set(true);
            sampler.join();
        }

        assertConsistent(result);
        assertTrue(samples.get() > 0);
        assertTrue(violations.isEmpty(), violations.toString());
    }

    @Test
    void certainFailureWithoutBackups_labelsNothing() throws Exception {
        SystemParameters params = SystemParameters.builder()
                .robots(4).backups(0).failureProbability(1.0).itemsRange(10, 10).boxCount(3).seed(5)
                .timeScale(TIME_SCALE).build();
        LiveSimulation simulation = new LiveSimulation(new LineContext("live-test", params), filledChannel(params));

        LiveSimulationResult result = simulation.run();

        assertConsistent(result);
        assertEquals(0, result.getStats().getItemsLabeled());
        assertEquals(4, result.getStats().getRobotFailures());
        assertTrue(result.getRobots().stream().allMatch(RobotStatus::isFailed));
    }

    @Test
    void injectedFailure_isCoveredByBackup() throws Exception {
        SystemParameters params = SystemParameters.builder()
                .robots(4).backups(1).itemsRange(10, 10).boxCount(4).seed(9).timeScale(TIME_SCALE).build();
        LineContext context = new LineContext("live-test", params);
        LiveSimulation simulation = new LiveSimulation(context, filledChannel(params));
        assertTrue(simulation.injectFailure(0));
        assertFalse(simulation.injectFailure(4));

        LiveSimulationResult result = simulation.run();

        assertConsistent(result);
        assertEquals(1, result.getStats().getRobotFailures());
        assertEquals(1, result.getStats().getBackupActivations());
        RobotStatus failed = context.getRepository().getRobotStatus(0).orElseThrow();
        assertEquals(RobotState.FAILED, failed.getState());
        RobotStatus backup = context.getRepository().getRobotStatus(4).orElseThrow();
        assertEquals(0, backup.getReplacing());
        assertEquals(37.5, backup.getAxisPosition());
    }

    @Test
    void stop_endsRunBeforeStreamIsExhausted() throws Exception {
        SystemParameters params = SystemParameters.builder()
                .robots(3).backups(0).itemsRange(10, 12).boxCount(200).seed(1).timeScale(TIME_SCALE).build();
        // canale mai chiuso: senza STOP la simulazione non terminerebbe
        InMemoryBoxChannel channel = new InMemoryBoxChannel();
        BoxGenerator generator = new BoxGenerator(params);
        Random random = new Random(1);
        for (int i = 0; i < params.getBoxCount(); i++) {
            channel.send(generator.generate(i, random));
        }
        LiveSimulation simulation = new LiveSimulation(new LineContext("live-test", params), channel);

        Thread stopper = new Thread(() -> {
            try {
                Thread.sleep(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            simulation.stop();
        });
        stopper.start();
        LiveSimulationResult result = simulation.run();
        stopper.join();

        assertTrue(result.isStopped());
        assertTrue(result.getBoxes().size() < params.getBoxCount());
        assertConsistent(result);
    }
}
