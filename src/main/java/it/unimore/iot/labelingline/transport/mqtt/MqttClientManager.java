package it.unimore.iot.labelingline.transport.mqtt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimore.iot.labelingline.exception.TransportException;
import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.IMqttMessageListener;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

// Gestisce la connessione MQTT di un componente della linea: publish JSON, sottoscrizioni, LWT e info retained
public class MqttClientManager {

    private static final Logger logger = LoggerFactory.getLogger(MqttClientManager.class);
    private static final String CLIENT_ID_PREFIX = "labeling-line";
    public static final String DEFAULT_BROKER_URL = "tcp://localhost:1883";

    private final String brokerUrl;
    private final String lineId;
    private final String role;

    private final IMqttClient mqttClient;
    private final ObjectMapper objectMapper;

    // Broker preso da MQTT_BROKER_URL, con default locale
    public MqttClientManager(String lineId, String role) throws MqttException {
        this(Optional.ofNullable(System.getenv("MQTT_BROKER_URL")).orElse(DEFAULT_BROKER_URL), lineId, role);
    }

    // Prepara il client MQTT con un clientId univoco per linea e ruolo
    public MqttClientManager(String brokerUrl, String lineId, String role) throws MqttException {
        this.brokerUrl = brokerUrl;
        this.lineId = lineId;
        this.role = role;

        String clientId = String.format("%s-%s-%s-%s", CLIENT_ID_PREFIX, lineId, role, UUID.randomUUID());
        this.mqttClient = new MqttClient(brokerUrl, clientId, new MemoryPersistence());
        this.objectMapper = new ObjectMapper();
    }

    // Apre la connessione al broker configurando credenziali, LWT e messaggio informativo retained
    public void connect() throws MqttException {
        if (!this.mqttClient.isConnected()) {
            MqttConnectOptions options = new MqttConnectOptions();
            options.setAutomaticReconnect(true);
            options.setCleanSession(true);
            options.setConnectionTimeout(10);

            // Credenziali da env (se presenti)
            Optional.ofNullable(System.getenv("MQTT_USERNAME")).ifPresent(options::setUserName);
            Optional.ofNullable(System.getenv("MQTT_PASSWORD"))
                    .map(String::toCharArray)
                    .ifPresent(options::setPassword);

            options.setWill(topic("lwt"), "offline".getBytes(StandardCharsets.UTF_8), 1, true);

            this.mqttClient.connect(options);
            logger.info("MQTT client {} connected to {}", role, brokerUrl);

            publishInfoMessage();
        }
    }

    // Pubblica un messaggio retained che descrive il componente
    private void publishInfoMessage() {
        Map<String, Object> info = Map.of(
                "lineId", lineId,
                "role", role,
                "online", true,
                "ts", System.currentTimeMillis()
        );
        try {
            publish(topic("info"), info, true);
            logger.info("Published retained info to {}", topic("info"));
        } catch (TransportException e) {
            logger.error("Error publishing info message for {}", role, e);
        }
    }

    // Chiude la connessione MQTT quando il componente si arresta
    public void disconnect() throws MqttException {
        if (this.mqttClient.isConnected()) {
            this.mqttClient.disconnect();
            logger.info("MQTT client {} disconnected.", role);
        }
    }

    /**
     * Pubblica con QoS 1 l'oggetto serializzato in JSON.
     *
     * @throws TransportException se il client non è connesso, la serializzazione o l'invio falliscono
     */
    public <T> void publish(String topic, T payload, boolean retained) throws TransportException {
        if (!this.mqttClient.isConnected()) {
            throw new TransportException("MQTT client not connected, cannot publish to " + topic);
        }
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(payload);
            this.mqttClient.publish(topic, bytes, 1, retained);
            logger.debug("Published to {}", topic);
        } catch (JsonProcessingException e) {
            throw new TransportException("Cannot serialize payload for " + topic, e);
        } catch (MqttException e) {
            throw new TransportException("Error publishing to " + topic, e);
        }
    }

    public void subscribe(String topicFilter, IMqttMessageListener listener) throws MqttException {
        this.mqttClient.subscribe(topicFilter, 1, listener);
        logger.info("Subscribed to topic: {}", topicFilter);
    }

    // Topic della linea: ll/{lineId}/{suffisso}
    public String lineTopic(String suffix) {
        return String.format("ll/%s/%s", lineId, suffix);
    }

    private String topic(String suffix) {
        return lineTopic(role + "/" + suffix);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    // Espone il client MQTT sottostante per eventuali operazioni avanzate
    public IMqttClient getClient() {
        return this.mqttClient;
    }
}
