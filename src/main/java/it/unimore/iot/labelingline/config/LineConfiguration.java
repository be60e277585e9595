package it.unimore.iot.labelingline.config;

import it.unimore.iot.labelingline.exception.InvalidConfigurationException;
import it.unimore.iot.labelingline.model.SystemParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Legge la configurazione della linea dalle variabili d'ambiente, con valori
 * predefiniti per quelle assenti. I valori vengono validati prima di qualsiasi esecuzione.
 */
public class LineConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(LineConfiguration.class);

    public static final String BELT_SPEED = "LINE_BELT_SPEED";
    public static final String BOX_SIZE = "LINE_BOX_SIZE";
    public static final String BELT_LENGTH = "LINE_BELT_LENGTH";
    public static final String ITEMS_MIN = "LINE_ITEMS_MIN";
    public static final String ITEMS_MAX = "LINE_ITEMS_MAX";
    public static final String ROBOTS = "LINE_ROBOTS";
    public static final String BACKUPS = "LINE_BACKUPS";
    public static final String FAILURE_PROB = "LINE_FAILURE_PROB";
    public static final String BOXES = "LINE_BOXES";
    public static final String SEED = "LINE_SEED";
    public static final String TIME_SCALE = "LINE_TIME_SCALE";
    public static final String LINE_ID = "LINE_ID";
    public static final String COAP_PORT = "COAP_PORT";
    public static final String MQTT_BROKER_URL = "MQTT_BROKER_URL";

    private final SystemParameters parameters;
    private final String lineId;
    private final int coapPort;
    private final String brokerUrl;

    private LineConfiguration(SystemParameters parameters, String lineId, int coapPort, String brokerUrl) {
        this.parameters = parameters;
        this.lineId = lineId;
        this.coapPort = coapPort;
        this.brokerUrl = brokerUrl;
    }

    // Costruisce la configurazione a partire dall'ambiente del processo
    public static LineConfiguration fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Costruisce la configurazione da una mappa chiave/valore con le stesse chiavi dell'ambiente.
     *
     * @throws InvalidConfigurationException se un valore non è numerico o fuori dai limiti
     */
    public static LineConfiguration fromMap(Map<String, String> env) {
        int itemsMin = readInt(env, ITEMS_MIN, 10);
        // Il massimo predefinito è il 20% in più del minimo
        int itemsMax = readInt(env, ITEMS_MAX, (int) (itemsMin * 1.2));

        SystemParameters parameters = SystemParameters.builder()
                .beltSpeed(readDouble(env, BELT_SPEED, 10.0))
                .boxSize(readDouble(env, BOX_SIZE, 50.0))
                .beltLength(readDouble(env, BELT_LENGTH, 300.0))
                .itemsRange(itemsMin, itemsMax)
                .robots(readInt(env, ROBOTS, 4))
                .backups(readInt(env, BACKUPS, 1))
                .failureProbability(readDouble(env, FAILURE_PROB, 0.0))
                .boxCount(readInt(env, BOXES, 20))
                .seed(readLong(env, SEED, System.currentTimeMillis()))
                .timeScale(readDouble(env, TIME_SCALE, 0.01))
                .build();

        String lineId = Optional.ofNullable(env.get(LINE_ID)).orElse("line-01");
        int coapPort = readInt(env, COAP_PORT, 5683);
        if (coapPort < 0 || coapPort > 65535) {
            throw new InvalidConfigurationException(COAP_PORT, coapPort, "must be a valid UDP port");
        }
        String brokerUrl = env.get(MQTT_BROKER_URL);

        logger.info("Line configuration loaded: {} (line {}, CoAP port {})", parameters, lineId, coapPort);
        return new LineConfiguration(parameters, lineId, coapPort, brokerUrl);
    }

    private static double readDouble(Map<String, String> env, String key, double defaultValue) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key, raw, "not a number", e);
        }
    }

    private static int readInt(Map<String, String> env, String key, int defaultValue) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key, raw, "not an integer", e);
        }
    }

    private static long readLong(Map<String, String> env, String key, long defaultValue) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key, raw, "not an integer", e);
        }
    }

    public SystemParameters getParameters() {
        return parameters;
    }

    public String getLineId() {
        return lineId;
    }

    public int getCoapPort() {
        return coapPort;
    }

    /**
     * URL del broker MQTT, vuoto se la linea lavora solo in memoria.
     */
    public Optional<String> getBrokerUrl() {
        return Optional.ofNullable(brokerUrl).filter(url -> !url.isBlank());
    }
}
