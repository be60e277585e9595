package it.unimore.iot.labelingline.exception;

/**
 * Parametro di configurazione non valido. Viene sollevata prima dell'avvio di
 * qualsiasi esecuzione: nessuna simulazione parte con parametri rifiutati.
 */
public class InvalidConfigurationException extends RuntimeException {

    private final String parameter;
    private final String value;

    public InvalidConfigurationException(String parameter, Object value, String reason) {
        super("Invalid parameter '" + parameter + "' (value: " + value + "): " + reason);
        this.parameter = parameter;
        this.value = String.valueOf(value);
    }

    public InvalidConfigurationException(String parameter, Object value, String reason, Throwable cause) {
        super("Invalid parameter '" + parameter + "' (value: " + value + "): " + reason, cause);
        this.parameter = parameter;
        this.value = String.valueOf(value);
    }

    public String getParameter() {
        return parameter;
    }

    public String getValue() {
        return value;
    }
}
