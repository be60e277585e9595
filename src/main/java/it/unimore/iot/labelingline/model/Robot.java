package it.unimore.iot.labelingline.model;

/**
 * Rappresenta un braccio robotico etichettatore installato lungo il nastro.
 * <p>
 * Un robot principale riceve la posizione dell'asse all'inizializzazione e non la cambia più.
 * Un robot di ricambio nasce senza posizione ({@link #getAxisPosition()} restituisce {@code null})
 * e la eredita una sola volta dal robot guasto che va a sostituire.
 * Il guasto ({@link #hasFailed()}) è irreversibile.
 * <p>
 * Tutti i metodi sono sincronizzati sull'istanza; le operazioni che coinvolgono
 * più robot passano dal lock del {@code RobotRoster}.
 */
public class Robot {

    /**
     * Valore di zona per un ricambio non ancora assegnato.
     */
    public static final int NO_ZONE = -1;

    private final int id;
    private final boolean backup;
    private final double failureProbability;

    private Double axisPosition;
    private int zoneIndex;
    private RobotState state;
    private Integer currentItem;
    private int labelsPlaced;
    private boolean failed;
    private Integer replacing;
    private boolean failureRequested;

    private Robot(int id, boolean backup, double failureProbability, Double axisPosition, int zoneIndex,
                  RobotState state) {
        this.id = id;
        this.backup = backup;
        this.failureProbability = failureProbability;
        this.axisPosition = axisPosition;
        this.zoneIndex = zoneIndex;
        this.state = state;
    }

    // Crea un robot principale fisso nella zona indicata
    public static Robot primary(int id, int zoneIndex, double axisPosition, double failureProbability) {
        return new Robot(id, false, failureProbability, axisPosition, zoneIndex, RobotState.IDLE);
    }

    // Crea un robot di ricambio spento e senza posizione
    public static Robot backup(int id) {
        return new Robot(id, true, 0.0, null, NO_ZONE, RobotState.DISABLED);
    }

    // Cambia stato rispettando il vincolo che un robot guasto non torna mai operativo
    public synchronized void transitionTo(RobotState next) {
        if (failed && next != RobotState.FAILED) {
            throw new IllegalStateException("Robot " + id + " has failed and cannot move to " + next);
        }
        if (next == RobotState.FAILED && !failed) {
            throw new IllegalStateException("Robot " + id + " must latch the failure before entering FAILED");
        }
        this.state = next;
    }

    // Attiva il latch di guasto; restituisce false se il guasto era già stato registrato
    public synchronized boolean latchFailure() {
        if (backup) {
            throw new IllegalStateException("Backup robot " + id + " is not subject to failures");
        }
        if (failed) {
            return false;
        }
        this.failed = true;
        this.failureRequested = false;
        this.currentItem = null;
        this.state = RobotState.FAILED;
        return true;
    }

    // Lega il ricambio alla zona del robot guasto: avviene una sola volta in tutta l'esecuzione
    public synchronized void bindAsBackup(Robot failedRobot) {
        if (!backup) {
            throw new IllegalStateException("Robot " + id + " is not a backup robot");
        }
        if (state != RobotState.DISABLED || replacing != null) {
            throw new IllegalStateException("Backup robot " + id + " is already bound to robot " + replacing);
        }
        this.axisPosition = failedRobot.getAxisPosition();
        this.zoneIndex = failedRobot.getZoneIndex();
        this.replacing = failedRobot.getId();
        this.state = RobotState.BACKUP;
    }

    // Conta un'etichetta completata; vietato dopo il guasto
    public synchronized void recordLabel() {
        if (failed) {
            throw new IllegalStateException("Failed robot " + id + " cannot place labels");
        }
        labelsPlaced++;
    }

    public synchronized void setCurrentItem(Integer currentItem) {
        this.currentItem = currentItem;
    }

    // Richiede un guasto che scatterà all'inizio del prossimo ciclo del robot
    public synchronized boolean requestFailure() {
        if (backup || failed) {
            return false;
        }
        this.failureRequested = true;
        return true;
    }

    public synchronized boolean isFailureRequested() {
        return failureRequested;
    }

    public int getId() {
        return id;
    }

    public boolean isBackup() {
        return backup;
    }

    public double getFailureProbability() {
        return failureProbability;
    }

    public synchronized Double getAxisPosition() {
        return axisPosition;
    }

    public synchronized int getZoneIndex() {
        return zoneIndex;
    }

    public synchronized RobotState getState() {
        return state;
    }

    public synchronized Integer getCurrentItem() {
        return currentItem;
    }

    public synchronized int getLabelsPlaced() {
        return labelsPlaced;
    }

    public synchronized boolean hasFailed() {
        return failed;
    }

    public synchronized Integer getReplacing() {
        return replacing;
    }

    // Fotografia coerente dello stato del robot, pronta per la pubblicazione
    public synchronized RobotStatus snapshot(long timestamp) {
        return new RobotStatus(id, timestamp, state, labelsPlaced, backup, replacing, axisPosition, failed);
    }

    @Override
    public synchronized String toString() {
        return "Robot{" +
                "id=" + id +
                ", state=" + state +
                ", axisPosition=" + axisPosition +
                ", labelsPlaced=" + labelsPlaced +
                ", backup=" + backup +
                ", replacing=" + replacing +
                '}';
    }
}
