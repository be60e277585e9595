package it.unimore.iot.labelingline.domain;

/**
 * Controllo di una simulazione in corso, usato dai comandi ricevuti via API.
 */
public interface LineController {

    // Arresto cooperativo: i robot terminano il ciclo corrente e l'esecuzione si chiude
    void stop();

    /**
     * Richiede il guasto di un robot principale, che scatterà all'inizio del suo prossimo ciclo.
     *
     * @return {@code false} se il robot non esiste, è un ricambio o è già guasto
     */
    boolean injectFailure(int robotId);

    boolean isRunning();
}
