package it.unimore.iot.labelingline.model;

/**
 * Stati possibili di un oggetto (mango) all'interno di una scatola.
 * Le transizioni ammesse sono solo in avanti: UNCLAIMED -> CLAIMED -> LABELED.
 */
public enum ItemState {
    /**
     * L'oggetto non è ancora stato prenotato da alcun robot.
     */
    UNCLAIMED,
    /**
     * Un robot ha ottenuto l'esclusiva e sta applicando l'etichetta.
     */
    CLAIMED,
    /**
     * L'etichetta è stata applicata.
     */
    LABELED
}
