package it.unimore.iot.labelingline.transport.mqtt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimore.iot.labelingline.exception.TransportException;
import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.transport.BoxSource;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Riceve le scatole dal broker MQTT e le accoda nell'ordine di arrivo.
 * Un payload non valido diventa una {@link TransportException} alla ricezione successiva,
 * senza bloccare le scatole che seguono.
 */
public class MqttBoxReceiver implements BoxSource {

    private static final Logger logger = LoggerFactory.getLogger(MqttBoxReceiver.class);

    static final String BOXES_SUFFIX = "boxes";
    static final String END_SUFFIX = "boxes/end";
    private static final long POLL_MILLIS = 200;

    // Elemento in coda: una scatola oppure l'errore di una consegna fallita
    private record Delivery(Box box, TransportException error) {
    }

    private final String boxesTopic;
    private final String endTopic;
    private final ObjectMapper objectMapper;
    private final BlockingQueue<Delivery> queue = new LinkedBlockingQueue<>();
    private volatile boolean ended;
    private volatile int expected = -1;
    private volatile int received;

    public MqttBoxReceiver(String lineId) {
        this.boxesTopic = String.format("ll/%s/%s", lineId, BOXES_SUFFIX);
        this.endTopic = String.format("ll/%s/%s", lineId, END_SUFFIX);
        this.objectMapper = new ObjectMapper();
    }

    // Sottoscrive i topic delle scatole e della fine del flusso
    public void start(MqttClientManager mqttClientManager) throws MqttException {
        mqttClientManager.subscribe(boxesTopic, (topic, message) -> onMessage(topic, message.getPayload()));
        mqttClientManager.subscribe(endTopic, (topic, message) -> onMessage(topic, message.getPayload()));
    }

    void onMessage(String topic, byte[] payload) {
        if (endTopic.equals(topic)) {
            try {
                JsonNode end = objectMapper.readTree(payload);
                expected = end.path("boxes").asInt(-1);
            } catch (IOException e) {
                logger.error("Malformed end-of-stream marker on {}", topic, e);
            }
            ended = true;
            logger.info("End of box stream received ({} box(es) announced)", expected);
            return;
        }
        received++;
        try {
            Box box = objectMapper.readValue(payload, Box.class);
            queue.add(new Delivery(box, null));
            logger.debug("Box {} received from {}", box.getId(), topic);
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Malformed box payload on {}", topic, e);
            queue.add(new Delivery(null, new TransportException("Malformed box payload on " + topic, e)));
        }
    }

    @Override
    public Optional<Box> receiveNextBox(boolean blocking) throws TransportException, InterruptedException {
        Delivery delivery = blocking ? queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS) : queue.poll();
        if (delivery == null) {
            return Optional.empty();
        }
        if (delivery.error() != null) {
            throw delivery.error();
        }
        return Optional.of(delivery.box());
    }

    /**
     * Esaurito quando è arrivato il marcatore di fine, tutte le consegne annunciate
     * sono state ricevute e la coda è vuota.
     */
    @Override
    public boolean isExhausted() {
        return ended && (expected < 0 || received >= expected) && queue.isEmpty();
    }
}
