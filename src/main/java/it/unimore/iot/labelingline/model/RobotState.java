package it.unimore.iot.labelingline.model;

/**
 * Definisce i possibili stati operativi di un robot etichettatore.
 */
public enum RobotState {
    /**
     * Il robot è in posizione di riposo e attende la prossima scatola.
     */
    IDLE,
    /**
     * Il robot sta lavorando la scatola corrente e cerca oggetti da etichettare.
     */
    ACTIVE,
    /**
     * Il robot sta raggiungendo ed etichettando un oggetto prenotato.
     */
    LABELING,
    /**
     * Il robot sta tornando al centro dopo la finestra di lavoro.
     */
    RETURNING,
    /**
     * Il robot è spento: per bassa richiesta oppure perché è un ricambio non ancora attivato.
     */
    DISABLED,
    /**
     * Il robot è guasto. Stato terminale.
     */
    FAILED,
    /**
     * Il robot di ricambio è stato attivato al posto di un robot guasto.
     */
    BACKUP;

    // Indica se il robot, in questo stato, non partecipa al ciclo della scatola corrente
    public boolean isOutOfService() {
        return this == DISABLED || this == FAILED;
    }
}
