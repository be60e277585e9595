package it.unimore.iot.labelingline.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimore.iot.labelingline.model.CommandAck;
import it.unimore.iot.labelingline.model.LineCommand;
import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.model.SimulationStats;
import it.unimore.iot.labelingline.model.StatsDelta;
import it.unimore.iot.labelingline.model.SystemParameters;
import it.unimore.iot.labelingline.transport.StatusSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

// Repository dello stato della linea: ultimo stato di ogni robot, contatori aggregati e inoltro dei comandi
public class StateRepository implements StatusSink {

    private static final Logger logger = LoggerFactory.getLogger(StateRepository.class);

    private final String lineId;
    private final SystemParameters parameters;
    private final Map<Integer, RobotStatus> robots;
    private final SimulationStats stats;
    private final Map<Integer, List<Consumer<RobotStatus>>> robotListeners;
    private final List<Consumer<SimulationStats>> statsListeners;
    private final ObjectMapper objectMapper;
    private volatile StatusSink statusPublisher;
    private volatile LineController controller;

    // Crea un repository vuoto per la linea indicata
    public StateRepository(String lineId, SystemParameters parameters) {
        this.lineId = lineId;
        this.parameters = parameters;
        this.robots = new ConcurrentHashMap<>();
        this.stats = new SimulationStats();
        this.robotListeners = new ConcurrentHashMap<>();
        this.statsListeners = new CopyOnWriteArrayList<>();
        this.objectMapper = new ObjectMapper();
    }

    // Registra il publisher a valle (es. MQTT) a cui inoltrare ogni aggiornamento
    public void registerStatusPublisher(StatusSink statusPublisher) {
        this.statusPublisher = statusPublisher;
        logger.info("Status publisher registered in StateRepository for line {}", lineId);
    }

    // Registra la simulazione che riceverà i comandi STOP e FAIL
    public void registerController(LineController controller) {
        this.controller = controller;
        logger.info("Line controller registered for line {}", lineId);
    }

    @Override
    public void publishRobotStatus(RobotStatus status) {
        robots.put(status.getRobotId(), status);
        logger.debug("Robot {} status updated: {}", status.getRobotId(), status.getState());
        notifyRobotListeners(status);
        StatusSink downstream = statusPublisher;
        if (downstream != null) {
            downstream.publishRobotStatus(status);
        }
    }

    @Override
    public void publishStats(StatsDelta delta) {
        stats.apply(delta);
        SimulationStats snapshot = stats.snapshot();
        statsListeners.forEach(listener -> {
            try {
                listener.accept(snapshot);
            } catch (Exception e) {
                logger.error("Error notifying stats listener", e);
            }
        });
        StatusSink downstream = statusPublisher;
        if (downstream != null) {
            downstream.publishStats(delta);
        }
    }

    public Optional<RobotStatus> getRobotStatus(int robotId) {
        return Optional.ofNullable(robots.get(robotId));
    }

    // Stati dei robot ordinati per id
    public List<RobotStatus> listRobots() {
        return robots.values().stream()
                .sorted(Comparator.comparingInt(RobotStatus::getRobotId))
                .collect(Collectors.toList());
    }

    public SimulationStats getStats() {
        return stats.snapshot();
    }

    public String getLineId() {
        return lineId;
    }

    public SystemParameters getParameters() {
        return parameters;
    }

    public boolean isRunning() {
        LineController current = controller;
        return current != null && current.isRunning();
    }

    // Associa un listener agli aggiornamenti di stato di un singolo robot
    public void addRobotListener(int robotId, Consumer<RobotStatus> listener) {
        robotListeners.computeIfAbsent(robotId, k -> new CopyOnWriteArrayList<>()).add(listener);
        logger.debug("Listener added for robot {}", robotId);
    }

    public void addStatsListener(Consumer<SimulationStats> listener) {
        statsListeners.add(listener);
    }

    private void notifyRobotListeners(RobotStatus status) {
        List<Consumer<RobotStatus>> listeners = robotListeners.get(status.getRobotId());
        if (listeners != null && !listeners.isEmpty()) {
            listeners.forEach(listener -> {
                try {
                    listener.accept(status);
                } catch (Exception e) {
                    logger.error("Error notifying listener for robot {}", status.getRobotId(), e);
                }
            });
        }
    }

    // --- Metodi di supporto per l'esposizione tramite API CoAP ---

    // Riepilogo JSON della linea: identificativo, stato di esecuzione e parametri
    public String getLineSummaryJson() {
        try {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("lineId", lineId);
            summary.put("running", isRunning());
            summary.put("robots", robots.size());
            summary.put("parameters", parameters);
            return objectMapper.writeValueAsString(summary);
        } catch (Exception e) {
            logger.error("Error serializing summary for line {}", lineId, e);
            return "{\"error\":\"Internal Server Error\"}";
        }
    }

    // Elenco JSON dei robot con il loro stato corrente
    public String listRobotsJson() {
        try {
            List<Map<String, Object>> robotList = new ArrayList<>();
            for (RobotStatus status : listRobots()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", status.getRobotId());
                entry.put("state", status.getState());
                entry.put("backup", status.isBackup());
                robotList.add(entry);
            }
            return objectMapper.writeValueAsString(Map.of("lineId", lineId, "robots", robotList));
        } catch (Exception e) {
            logger.error("Error serializing robot list for line {}", lineId, e);
            return "{\"error\":\"Internal Server Error\"}";
        }
    }

    /**
     * Applica un comando alla simulazione registrata.
     *
     * @param command comando con tipo ed eventuale robot destinatario
     * @return riscontro con esito {@code ACCEPTED} o {@code REJECTED}
     */
    public CommandAck dispatchCommand(LineCommand command) {
        if (command == null || command.getType() == null || command.getType().isBlank()) {
            logger.error("Cannot dispatch command: missing type");
            return CommandAck.rejected(command, "Missing command type");
        }
        LineCommand normalized = normalizeCommand(command);
        LineController current = controller;
        if (current == null || !current.isRunning()) {
            logger.warn("Command {} rejected: no simulation running on line {}", normalized.getType(), lineId);
            return CommandAck.rejected(normalized, "No simulation running");
        }

        switch (normalized.getType()) {
            case LineCommand.STOP:
                logger.info("STOP command received for line {}", lineId);
                current.stop();
                return CommandAck.accepted(normalized, "Stop requested");
            case LineCommand.FAIL:
                if (normalized.getRobotId() == null) {
                    return CommandAck.rejected(normalized, "Field 'robotId' is required for FAIL");
                }
                if (current.injectFailure(normalized.getRobotId())) {
                    logger.info("FAIL command accepted for robot {}", normalized.getRobotId());
                    return CommandAck.accepted(normalized,
                            "Failure scheduled for robot " + normalized.getRobotId());
                }
                return CommandAck.rejected(normalized,
                        "Robot " + normalized.getRobotId() + " cannot fail (unknown, backup or already failed)");
            default:
                logger.warn("Unknown command type: {}", normalized.getType());
                return CommandAck.rejected(normalized, "Unknown command type: " + normalized.getType());
        }
    }

    // Normalizza il comando assicurando maiuscole e timestamp valorizzato
    private LineCommand normalizeCommand(LineCommand command) {
        command.setType(command.getType().trim().toUpperCase());
        if (command.getTs() <= 0) {
            command.setTs(System.currentTimeMillis());
        }
        return command;
    }
}
