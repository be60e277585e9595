package it.unimore.iot.labelingline.transport;

import it.unimore.iot.labelingline.exception.TransportException;
import it.unimore.iot.labelingline.model.Box;

import java.util.Optional;

/**
 * Lato di ricezione del passaggio delle scatole dal generatore al motore di coordinamento.
 */
public interface BoxSource {

    /**
     * Restituisce la prossima scatola in ordine di invio.
     *
     * @param blocking se {@code true} attende l'arrivo di una scatola per al più un intervallo di polling
     * @return la scatola, oppure vuoto se nessuna è disponibile
     * @throws TransportException se la consegna della scatola è fallita; la successiva resta ricevibile
     * @throws InterruptedException se il thread viene interrotto durante l'attesa
     */
    Optional<Box> receiveNextBox(boolean blocking) throws TransportException, InterruptedException;

    /**
     * {@code true} quando il mittente ha chiuso il flusso e non restano scatole da consegnare.
     */
    boolean isExhausted();
}
