package it.unimore.iot.labelingline.engine;

import it.unimore.iot.labelingline.model.Robot;
import it.unimore.iot.labelingline.model.StatsDelta;
import it.unimore.iot.labelingline.transport.StatusSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Random;

/**
 * Decide i guasti dei robot principali e assegna i ricambi alle zone rimaste scoperte.
 */
public class FailureBackupManager {

    private static final Logger logger = LoggerFactory.getLogger(FailureBackupManager.class);

    private final RobotRoster roster;
    private final StatusSink statusSink;

    public FailureBackupManager(RobotRoster roster, StatusSink statusSink) {
        this.roster = roster;
        this.statusSink = statusSink;
    }

    /**
     * Estrae il guasto del ciclo per un robot principale non ancora guasto.
     * Un guasto richiesto dall'esterno scatta senza estrazione.
     */
    public boolean checkFailure(Robot robot, Random random) {
        if (robot.isBackup() || robot.hasFailed()) {
            return false;
        }
        if (robot.isFailureRequested()) {
            return true;
        }
        double p = robot.getFailureProbability();
        return p > 0.0 && random.nextDouble() < p;
    }

    /**
     * Registra il guasto del robot e lega il primo ricambio libero alla sua zona.
     * Il guasto viene contato una sola volta anche se segnalato più volte.
     *
     * @return il ricambio attivato, vuoto se non ce n'erano di disponibili o il guasto era già noto
     */
    public Optional<Robot> onFailure(Robot failed) {
        Optional<Optional<Robot>> outcome = roster.locked(() -> {
            if (!failed.latchFailure()) {
                return Optional.empty();
            }
            Optional<Robot> backup = roster.firstDisabledBackup();
            backup.ifPresent(b -> b.bindAsBackup(failed));
            return Optional.of(backup);
        });
        if (outcome.isEmpty()) {
            logger.debug("Failure of robot {} already recorded", failed.getId());
            return Optional.empty();
        }

        long ts = System.currentTimeMillis();
        logger.warn("Robot {} failed at axis {}", failed.getId(), failed.getAxisPosition());
        statusSink.publishStats(StatsDelta.robotFailure());
        statusSink.publishRobotStatus(failed.snapshot(ts));

        Optional<Robot> backup = outcome.get();
        if (backup.isPresent()) {
            Robot b = backup.get();
            logger.info("Backup robot {} activated in place of robot {} at axis {}",
                    b.getId(), failed.getId(), b.getAxisPosition());
            statusSink.publishStats(StatsDelta.backupActivation());
            statusSink.publishRobotStatus(b.snapshot(ts));
        } else {
            logger.warn("No backup available for robot {}: zone {} stays uncovered",
                    failed.getId(), failed.getZoneIndex());
        }
        return backup;
    }
}
