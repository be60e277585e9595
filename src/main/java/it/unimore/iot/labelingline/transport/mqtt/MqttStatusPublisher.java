package it.unimore.iot.labelingline.transport.mqtt;

import it.unimore.iot.labelingline.exception.TransportException;
import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.model.StatsDelta;
import it.unimore.iot.labelingline.transport.StatusSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replica sul broker MQTT lo stato dei robot ({@code ll/{lineId}/robots/{id}/status}, retained)
 * e gli incrementi dei contatori ({@code ll/{lineId}/stats}).
 */
public class MqttStatusPublisher implements StatusSink {

    private static final Logger logger = LoggerFactory.getLogger(MqttStatusPublisher.class);

    private final MqttClientManager mqttClientManager;

    public MqttStatusPublisher(MqttClientManager mqttClientManager) {
        this.mqttClientManager = mqttClientManager;
    }

    @Override
    public void publishRobotStatus(RobotStatus status) {
        String topic = mqttClientManager.lineTopic("robots/" + status.getRobotId() + "/status");
        try {
            mqttClientManager.publish(topic, status, true);
        } catch (TransportException e) {
            logger.error("Error publishing status of robot {}", status.getRobotId(), e);
        }
    }

    @Override
    public void publishStats(StatsDelta delta) {
        String topic = mqttClientManager.lineTopic("stats");
        try {
            mqttClientManager.publish(topic, delta, false);
        } catch (TransportException e) {
            logger.error("Error publishing stats delta {}", delta, e);
        }
    }
}
