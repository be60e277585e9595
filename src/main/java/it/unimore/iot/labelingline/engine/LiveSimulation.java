package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.domain.LineController;
import it.unimore.iot.labelingline.model.Robot;
import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.transport.BoxSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.stream.Collectors;

/**
 * Simulazione concorrente della linea: un thread per robot più il nastro, che gira
 * sul thread chiamante. Tutti partono insieme dalla barriera di avvio.
 */
public class LiveSimulation implements LineController {

    private static final Logger logger = LoggerFactory.getLogger(LiveSimulation.class);

    private final LineContext context;
    private final BoxSource source;
    private final BoxWorkspace workspace = new BoxWorkspace();
    private final ClaimProtocol claims = new ClaimProtocol();
    private final FailureBackupManager failureManager;
    private final List<RobotAgent> agents = new ArrayList<>();
    private volatile boolean running;
    private volatile boolean stopRequested;

    public LiveSimulation(LineContext context, BoxSource source) {
        this.context = context;
        this.source = source;
        this.failureManager = new FailureBackupManager(context.getRoster(), context.getRepository());
    }

    /**
     * Esegue la simulazione fino all'esaurimento delle scatole o a un comando STOP.
     */
    public LiveSimulationResult run() throws InterruptedException {
        synchronized (this) {
            if (running) {
                throw new IllegalStateException("Simulation already running on line " + context.getLineId());
            }
            running = true;
        }
        context.getRepository().registerController(this);
        RobotRoster roster = context.getRoster();
        logger.info("Starting live simulation on line {}: {} robot(s), {} backup(s), plan {}",
                context.getLineId(), context.getParams().getRobots(), context.getParams().getBackups(),
                context.getPlan());

        long ts = System.currentTimeMillis();
        roster.getRobots().forEach(robot -> context.getRepository().publishRobotStatus(robot.snapshot(ts)));

        CyclicBarrier startBarrier = new CyclicBarrier(roster.size() + 1);
        LabelingPolicy policy = new NearestFirstPolicy(claims);
        List<Thread> threads = new ArrayList<>();
        for (Robot robot : roster.getRobots()) {
            RobotAgent agent = new RobotAgent(robot, context, workspace, policy, failureManager,
                    context.newRandom(), startBarrier);
            agents.add(agent);
            threads.add(new Thread(agent, agent.getAgentId()));
        }
        threads.forEach(Thread::start);

        long started = System.currentTimeMillis();
        ConveyorOrchestrator orchestrator = new ConveyorOrchestrator(context, source, workspace, claims);
        try {
            orchestrator.runPipeline(startBarrier);
        } finally {
            agents.forEach(SimulatedAgent::shutdown);
            workspace.cancel();
            joinAll(threads);
            running = false;
        }

        long elapsed = System.currentTimeMillis() - started;
        List<RobotStatus> finalStates = roster.getRobots().stream()
                .map(robot -> robot.snapshot(System.currentTimeMillis()))
                .collect(Collectors.toList());
        LiveSimulationResult result = new LiveSimulationResult(context.getRepository().getStats(),
                orchestrator.getResults(), finalStates, elapsed, stopRequested);
        logger.info("Live simulation finished in {} ms: {} box(es), efficiency {}%",
                elapsed, result.getBoxes().size(), String.format("%.2f", result.getEfficiency()));
        return result;
    }

    private void joinAll(List<Thread> threads) throws InterruptedException {
        long timeout = Math.max(2000L, context.getClock().toWallMillis(context.getParams().getTransitTime()));
        for (Thread thread : threads) {
            thread.join(timeout);
            if (thread.isAlive()) {
                logger.warn("Agent thread {} did not stop in time, interrupting", thread.getName());
                thread.interrupt();
                thread.join(timeout);
            }
        }
    }

    @Override
    public void stop() {
        logger.info("Stop requested for line {}", context.getLineId());
        stopRequested = true;
        agents.forEach(SimulatedAgent::shutdown);
        workspace.cancel();
    }

    @Override
    public boolean injectFailure(int robotId) {
        boolean scheduled = context.getRoster().find(robotId)
                .map(Robot::requestFailure)
                .orElse(false);
        if (scheduled) {
            logger.info("Failure injected for robot {}", robotId);
        }
        return scheduled;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public LineContext getContext() {
        return context;
    }
}
