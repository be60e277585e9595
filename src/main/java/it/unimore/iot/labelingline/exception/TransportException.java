package it.unimore.iot.labelingline.exception;

/**
 * Errore nel passaggio di una scatola fra generatore e motore di coordinamento,
 * o nella pubblicazione dello stato. Riguarda una singola consegna: chi la riceve
 * la registra e prosegue con la successiva.
 */
public class TransportException extends Exception {

    private final Integer boxId;

    public TransportException(String message) {
        super(message);
        this.boxId = null;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.boxId = null;
    }

    public TransportException(String message, Integer boxId, Throwable cause) {
        super(message, cause);
        this.boxId = boxId;
    }

    /**
     * Scatola coinvolta, se nota.
     */
    public Integer getBoxId() {
        return boxId;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TransportException");
        if (boxId != null) {
            sb.append(" [box ").append(boxId).append(']');
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
