package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Robot;
import it.unimore.iot.labelingline.model.RobotState;
import it.unimore.iot.labelingline.model.SystemParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Insieme dei robot della linea. I robot principali hanno id {@code 0..robots-1},
 * i ricambi seguono con gli id successivi.
 * <p>
 * Attivazione, disattivazione, latch di guasto e assegnazione dei ricambi avvengono
 * sotto un unico lock del roster, distinto da quello della scatola.
 */
public class RobotRoster {

    private static final Logger logger = LoggerFactory.getLogger(RobotRoster.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Robot> robots;

    public RobotRoster(List<Robot> robots) {
        this.robots = Collections.unmodifiableList(new ArrayList<>(robots));
    }

    public static RobotRoster create(SystemParameters params, ZonePlan plan) {
        List<Robot> robots = new ArrayList<>(params.getTotalRobots());
        for (int i = 0; i < params.getRobots(); i++) {
            robots.add(Robot.primary(i, i, plan.axisPosition(i), params.getFailureProbability()));
        }
        for (int i = 0; i < params.getBackups(); i++) {
            robots.add(Robot.backup(params.getRobots() + i));
        }
        return new RobotRoster(robots);
    }

    // Esegue l'azione in mutua esclusione con le altre modifiche del roster
    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Porta il robot in ACTIVE all'inizio di un ciclo, a meno che sia stato disattivato o sia guasto.
     */
    public boolean beginCycle(Robot robot) {
        return locked(() -> {
            RobotState state = robot.getState();
            if (state.isOutOfService() || robot.hasFailed()) {
                return false;
            }
            robot.transitionTo(RobotState.ACTIVE);
            return true;
        });
    }

    /**
     * Adegua il numero di robot operativi a quello richiesto per la prossima scatola.
     * Disattiva solo robot principali in IDLE, partendo dall'id più alto; riattiva solo
     * robot principali disattivati e non guasti, partendo dall'id più basso. I ricambi non
     * vengono mai toccati.
     *
     * @return i robot il cui stato è cambiato
     */
    public List<Robot> rightSize(int required) {
        return locked(() -> {
            List<Robot> changed = new ArrayList<>();
            int operational = countOperational();
            if (operational > required) {
                for (int i = robots.size() - 1; i >= 0 && operational > required; i--) {
                    Robot robot = robots.get(i);
                    if (!robot.isBackup() && robot.getState() == RobotState.IDLE) {
                        robot.transitionTo(RobotState.DISABLED);
                        changed.add(robot);
                        operational--;
                    }
                }
            } else if (operational < required) {
                for (int i = 0; i < robots.size() && operational < required; i++) {
                    Robot robot = robots.get(i);
                    if (!robot.isBackup() && !robot.hasFailed() && robot.getState() == RobotState.DISABLED) {
                        robot.transitionTo(RobotState.IDLE);
                        changed.add(robot);
                        operational++;
                    }
                }
            }
            if (!changed.isEmpty()) {
                logger.debug("Right-sized to {} operational robot(s), changed {}", operational,
                        changed.stream().map(Robot::getId).collect(Collectors.toList()));
            }
            return changed;
        });
    }

    // Primo ricambio ancora spento in ordine di id; il chiamante possiede il lock
    Optional<Robot> firstDisabledBackup() {
        return robots.stream()
                .filter(Robot::isBackup)
                .filter(r -> r.getState() == RobotState.DISABLED && r.getReplacing() == null)
                .findFirst();
    }

    public int countOperational() {
        return locked(() -> (int) robots.stream()
                .filter(r -> !r.hasFailed() && !r.getState().isOutOfService())
                .count());
    }

    public List<Robot> getRobots() {
        return robots;
    }

    public Robot get(int robotId) {
        if (robotId < 0 || robotId >= robots.size()) {
            throw new IllegalArgumentException("Unknown robot " + robotId);
        }
        return robots.get(robotId);
    }

    public Optional<Robot> find(int robotId) {
        return robotId >= 0 && robotId < robots.size() ? Optional.of(robots.get(robotId)) : Optional.empty();
    }

    public List<Robot> primaries() {
        return robots.stream().filter(r -> !r.isBackup()).collect(Collectors.toList());
    }

    public List<Robot> backups() {
        return robots.stream().filter(Robot::isBackup).collect(Collectors.toList());
    }

    /**
     * Robot posizionati sul nastro ordinati per asse, poi per id. I ricambi mai attivati sono esclusi.
     */
    public List<Robot> inAxisOrder() {
        return robots.stream()
                .filter(r -> r.getAxisPosition() != null)
                .sorted(Comparator.comparingDouble((Robot r) -> r.getAxisPosition()).thenComparingInt(Robot::getId))
                .collect(Collectors.toList());
    }

    public int size() {
        return robots.size();
    }
}
