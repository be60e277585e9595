package it.unimore.iot.labelingline.transport;

import it.unimore.iot.labelingline.model.RobotStatus;
import it.unimore.iot.labelingline.model.StatsDelta;

/**
 * Destinazione degli aggiornamenti di stato dei robot e dei contatori della linea.
 * Le implementazioni non propagano errori di trasporto: li registrano e proseguono.
 */
public interface StatusSink {

    void publishRobotStatus(RobotStatus status);

    void publishStats(StatsDelta delta);
}
