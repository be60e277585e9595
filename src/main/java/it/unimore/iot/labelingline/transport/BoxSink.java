package it.unimore.iot.labelingline.transport;

import it.unimore.iot.labelingline.exception.TransportException;
import it.unimore.iot.labelingline.model.Box;

/**
 * Lato di invio del passaggio delle scatole, usato dal generatore.
 */
public interface BoxSink {

    void send(Box box) throws TransportException;

    // Segnala la fine del flusso di scatole
    void complete() throws TransportException;
}
