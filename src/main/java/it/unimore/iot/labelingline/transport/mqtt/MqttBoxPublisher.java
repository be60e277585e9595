package it.unimore.iot.labelingline.transport.mqtt;

import it.unimore.iot.labelingline.exception.TransportException;
import it.unimore.iot.labelingline.model.Box;
import it.unimore.iot.labelingline.transport.BoxSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Consegna le scatole generate al motore di coordinamento tramite il broker MQTT.
 * Topic: {@code ll/{lineId}/boxes} per le scatole, {@code ll/{lineId}/boxes/end} per la fine del flusso.
 */
public class MqttBoxPublisher implements BoxSink {

    private static final Logger logger = LoggerFactory.getLogger(MqttBoxPublisher.class);

    private final MqttClientManager mqttClientManager;
    private final String boxesTopic;
    private final String endTopic;
    private int sent;

    public MqttBoxPublisher(MqttClientManager mqttClientManager) {
        this.mqttClientManager = mqttClientManager;
        this.boxesTopic = mqttClientManager.lineTopic(MqttBoxReceiver.BOXES_SUFFIX);
        this.endTopic = mqttClientManager.lineTopic(MqttBoxReceiver.END_SUFFIX);
    }

    @Override
    public synchronized void send(Box box) throws TransportException {
        try {
            mqttClientManager.publish(boxesTopic, box, false);
        } catch (TransportException e) {
            throw new TransportException("Box " + box.getId() + " not delivered", box.getId(), e);
        }
        sent++;
        logger.debug("Box {} published to {}", box.getId(), boxesTopic);
    }

    // Il marcatore di fine porta il numero di scatole inviate
    @Override
    public synchronized void complete() throws TransportException {
        mqttClientManager.publish(endTopic, Map.of("boxes", sent, "ts", System.currentTimeMillis()), false);
        logger.info("End of box stream published to {} after {} box(es)", endTopic, sent);
    }
}
