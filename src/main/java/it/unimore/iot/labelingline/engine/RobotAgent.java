package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.model.Item;
import it.unimore.iot.labelingline.model.Robot;
import it.unimore.iot.labelingline.model.RobotState;
import it.unimore.iot.labelingline.transport.StatusSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CyclicBarrier;

/**
 * Agente di un robot nella simulazione concorrente. A ogni arrivo di scatola esegue un
 * ciclo IDLE, ACTIVE, LABELING, RETURNING finché la finestra della sua zona non è
 * scaduta o non restano oggetti liberi. Un robot guasto esce dal ciclo e non rientra più.
 */
public class RobotAgent extends SimulatedAgent {

    private static final Logger logger = LoggerFactory.getLogger(RobotAgent.class);

    /**
     * Pausa di assestamento in RETURNING, in secondi simulati.
     */
    public static final double SETTLE_TIME = 0.05;

    private final Robot robot;
    private final LineContext context;
    private final BoxWorkspace workspace;
    private final LabelingPolicy policy;
    private final FailureBackupManager failureManager;
    private final StatusSink statusSink;
    private final Random random;

    public RobotAgent(Robot robot, LineContext context, BoxWorkspace workspace, LabelingPolicy policy,
                      FailureBackupManager failureManager, Random random, CyclicBarrier startBarrier) {
        super("robot-" + robot.getId(), startBarrier);
        this.robot = robot;
        this.context = context;
        this.workspace = workspace;
        this.policy = policy;
        this.failureManager = failureManager;
        this.statusSink = context.getRepository();
        this.random = random;
    }

    @Override
    protected void start() throws InterruptedException {
        logger.debug("Robot agent {} started ({})", robot.getId(), robot.isBackup() ? "backup" : "primary");
        long lastSequence = 0;
        while (running) {
            Optional<BoxWorkspace.BoxSlot> slot = workspace.awaitNext(lastSequence);
            if (slot.isEmpty()) {
                break;
            }
            lastSequence = slot.get().sequence();
            processBox(slot.get().box());
            if (robot.hasFailed()) {
                logger.debug("Robot agent {} leaves the line after failure", robot.getId());
                break;
            }
        }
    }

    // Un ciclo completo su una scatola
    void processBox(Box box) throws InterruptedException {
        if (robot.hasFailed() || robot.getState() == RobotState.DISABLED) {
            return;
        }
        if (failureManager.checkFailure(robot, random)) {
            failureManager.onFailure(robot);
            return;
        }
        if (!context.getRoster().beginCycle(robot)) {
            return;
        }

        double window = policy.timeBudget(context.getPlan(), robot.getZoneIndex());
        double robotSpeed = context.getParams().getRobotSpeed();
        SimulationClock clock = context.getClock();
        double cycleStart = clock.now();
        int labels = 0;

        while (running && clock.now() - cycleStart < window) {
            Optional<Item> target = policy.selectNextItem(box);
            if (target.isEmpty()) {
                break;
            }
            Item item = target.get();
            if (!policy.claimItem(box, item, robot.getId())) {
                logger.debug("Robot {} lost item {} of box {}, rescanning", robot.getId(), item.getId(), box.getId());
                continue;
            }
            robot.setCurrentItem(item.getId());
            robot.transitionTo(RobotState.LABELING);

            double reachTime = item.distanceFromOrigin() / robotSpeed;
            clock.sleep(reachTime);
            policy.completeItem(box, item, robot.getId(), clock.now());
            robot.recordLabel();
            robot.setCurrentItem(null);
            labels++;

            clock.sleep(reachTime / 2.0);
            robot.transitionTo(RobotState.ACTIVE);
        }

        robot.transitionTo(RobotState.RETURNING);
        clock.sleep(SETTLE_TIME);
        robot.transitionTo(RobotState.IDLE);
        logger.debug("Robot {} placed {} label(s) on box {}", robot.getId(), labels, box.getId());
        statusSink.publishRobotStatus(robot.snapshot(System.currentTimeMillis()));
    }

    public Robot getRobot() {
        return robot;
    }
}
