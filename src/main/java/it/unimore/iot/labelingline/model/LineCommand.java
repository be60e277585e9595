package it.unimore.iot.labelingline.model;

/**
 * Comando inviato alla linea tramite l'API CoAP.
 * Viene serializzato in JSON come payload di {@code POST /line/cmd}.
 */
public class LineCommand {

    public static final String STOP = "STOP";
    public static final String FAIL = "FAIL";

    /**
     * Tipo di comando: {@code STOP} arresta la simulazione in corso,
     * {@code FAIL} provoca il guasto del robot indicato da {@link #robotId}.
     */
    private String type;

    /**
     * Robot destinatario, richiesto solo per {@code FAIL}.
     */
    private Integer robotId;

    /**
     * Il timestamp UNIX (in millisecondi) che indica quando il comando è stato creato.
     */
    private long ts;

    /**
     * Identificativo opzionale del messaggio, restituito nel riscontro.
     */
    private String msgId;

    public LineCommand() {
    }

    public LineCommand(String type, Integer robotId, long ts) {
        this(type, robotId, ts, null);
    }

    public LineCommand(String type, Integer robotId, long ts, String msgId) {
        this.type = type;
        this.robotId = robotId;
        this.ts = ts;
        this.msgId = msgId;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Integer getRobotId() {
        return robotId;
    }

    public void setRobotId(Integer robotId) {
        this.robotId = robotId;
    }

    public long getTs() {
        return ts;
    }

    public void setTs(long ts) {
        this.ts = ts;
    }

    public String getMsgId() {
        return msgId;
    }

    public void setMsgId(String msgId) {
        this.msgId = msgId;
    }

    @Override
    public String toString() {
        return "LineCommand{" +
                "type='" + type + '\'' +
                ", robotId=" + robotId +
                ", msgId='" + msgId + '\'' +
                '}';
    }
}
