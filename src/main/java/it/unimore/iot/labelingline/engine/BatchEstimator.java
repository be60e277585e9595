package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.model.Item;
import it.unimore.iot.labelingline.model.Robot;
import it.unimore.iot.labelingline.model.RobotState;
import it.unimore.iot.labelingline.model.SimulationStats;
import it.unimore.iot.labelingline.model.StatsDelta;
import it.unimore.iot.labelingline.model.SystemParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Stima sequenziale dell'efficienza della linea, senza thread né attese.
 * <p>
 Per ogni scatola, ciascun robot principale ancora operativo estrae il guasto del
 * ciclo e i guasti attivano i ricambi come nella simulazione concorrente. Poi i robot
 * operativi in ordine di asse etichettano fino a {@code itemsPerStation} oggetti
 * liberi nell'ordine della scatola. A parità di seme il risultato è identico.
 */
public class BatchEstimator {

    private static final Logger logger = LoggerFactory.getLogger(BatchEstimator.class);

    private final LabelingPolicy policy;

    public BatchEstimator() {
        this(new ArrayOrderPolicy());
    }

    public BatchEstimator(LabelingPolicy policy) {
        this.policy = policy;
    }

    public BatchResult run(SystemParameters params) {
        long started = System.nanoTime();
        LineContext context = new LineContext("batch", params);
        RobotRoster roster = context.getRoster();
        ZonePlan plan = context.getPlan();
        FailureBackupManager failureManager = new FailureBackupManager(roster, context.getRepository());

        Random boxRandom = context.newRandom();
        List<Random> robotRandoms = new ArrayList<>(roster.size());
        for (int i = 0; i < roster.size(); i++) {
            robotRandoms.add(context.newRandom());
        }

        BoxGenerator generator = new BoxGenerator(params);
        for (int i = 0; i < params.getBoxCount(); i++) {
            Box box = generator.generate(i, boxRandom, i * params.getBoxInterval());
            drawFailures(roster, failureManager, robotRandoms);
            allocate(box, activeStations(roster), plan, params);
            context.getRepository().publishStats(StatsDelta.boxDeparted(box));
        }

        SimulationStats stats = context.getRepository().getStats();
        List<Integer> labelsPerRobot = roster.getRobots().stream()
                .map(Robot::getLabelsPlaced)
                .collect(Collectors.toList());
        long elapsed = (System.nanoTime() - started) / 1_000_000;
        BatchResult result = new BatchResult(params.getRobots(), params.getBackups(),
                params.getFailureProbability(), stats.getTotalBoxes(), stats.getTotalItems(),
                stats.getItemsLabeled(), stats.getItemsMissed(), stats.getRobotFailures(),
                stats.getBackupActivations(), labelsPerRobot, elapsed);
        logger.debug("Batch run finished: {}", result);
        return result;
    }

    // Estrazione del ciclo per ogni principale ancora operativo
    private static void drawFailures(RobotRoster roster, FailureBackupManager failureManager,
                                     List<Random> robotRandoms) {
        for (Robot robot : roster.primaries()) {
            if (failureManager.checkFailure(robot, robotRandoms.get(robot.getId()))) {
                failureManager.onFailure(robot);
            }
        }
    }

    private static List<Robot> activeStations(RobotRoster roster) {
        return roster.inAxisOrder().stream()
                .filter(robot -> !robot.hasFailed() && robot.getState() != RobotState.DISABLED)
                .collect(Collectors.toList());
    }

    // Assegnazione a passata singola: ogni stazione prende al più la sua capacità
    void allocate(Box box, List<Robot> stations, ZonePlan plan, SystemParameters params) {
        for (Robot robot : stations) {
            if (box.isCompleted()) {
                break;
            }
            int capacity = ZonePlanner.itemsPerRobot(policy.timeBudget(plan, robot.getZoneIndex()), params);
            int placed = 0;
            while (placed < capacity) {
                Optional<Item> next = policy.selectNextItem(box);
                if (next.isEmpty()) {
                    break;
                }
                Item item = next.get();
                if (!policy.claimItem(box, item, robot.getId())) {
                    break;
                }
                policy.completeItem(box, item, robot.getId(), box.getEntryTime());
                robot.recordLabel();
                placed++;
            }
        }
    }
}
