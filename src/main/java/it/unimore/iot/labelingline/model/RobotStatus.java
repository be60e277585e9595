package it.unimore.iot.labelingline.model;

/**
 * Rappresenta lo stato di un robot etichettatore in un dato istante.
 * Questa classe è un POJO utilizzato per la serializzazione della telemetria
 * pubblicata verso il repository di stato, MQTT e l'API CoAP.
 */
public class RobotStatus {

    /**
     * Identificativo del robot.
     */
    private int robotId;

    /**
     * Timestamp UNIX (in millisecondi) che indica quando lo stato è stato registrato.
     */
    private long timestamp;

    /**
     * Stato operativo del robot.
     */
    private RobotState state;

    /**
     * Numero di etichette applicate dall'avvio.
     */
    private int labelsPlaced;

    private boolean backup;

    /**
     * Robot sostituito da questo ricambio, {@code null} se non applicabile.
     */
    private Integer replacing;

    /**
     * Posizione dell'asse lungo il nastro in cm, {@code null} per un ricambio mai attivato.
     */
    private Double axisPosition;

    private boolean failed;

    public RobotStatus() {
    }

    public RobotStatus(int robotId, long timestamp, RobotState state, int labelsPlaced, boolean backup,
                       Integer replacing, Double axisPosition, boolean failed) {
        this.robotId = robotId;
        this.timestamp = timestamp;
        this.state = state;
        this.labelsPlaced = labelsPlaced;
        this.backup = backup;
        this.replacing = replacing;
        this.axisPosition = axisPosition;
        this.failed = failed;
    }

    public int getRobotId() {
        return robotId;
    }

    public void setRobotId(int robotId) {
        this.robotId = robotId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public RobotState getState() {
        return state;
    }

    public void setState(RobotState state) {
        this.state = state;
    }

    public int getLabelsPlaced() {
        return labelsPlaced;
    }

    public void setLabelsPlaced(int labelsPlaced) {
        this.labelsPlaced = labelsPlaced;
    }

    public boolean isBackup() {
        return backup;
    }

    public void setBackup(boolean backup) {
        this.backup = backup;
    }

    public Integer getReplacing() {
        return replacing;
    }

    public void setReplacing(Integer replacing) {
        this.replacing = replacing;
    }

    public Double getAxisPosition() {
        return axisPosition;
    }

    public void setAxisPosition(Double axisPosition) {
        this.axisPosition = axisPosition;
    }

    public boolean isFailed() {
        return failed;
    }

    public void setFailed(boolean failed) {
        this.failed = failed;
    }

    @Override
    public String toString() {
        return "RobotStatus{" +
                "robotId=" + robotId +
                ", timestamp=" + timestamp +
                ", state=" + state +
                ", labelsPlaced=" + labelsPlaced +
                ", backup=" + backup +
                ", replacing=" + replacing +
                '}';
    }
}
