package it.unimore.iot.labelingline.model;

/**
 * Riscontro restituito dalla linea dopo l'elaborazione di un {@link LineCommand}.
 */
public class CommandAck {

    public static final String ACCEPTED = "ACCEPTED";
    public static final String REJECTED = "REJECTED";

    private String cmdType;

    /**
     * Esito: {@link #ACCEPTED} o {@link #REJECTED}.
     */
    private String status;

    private String message;
    private long ts;
    private String msgId;

    public CommandAck() {
    }

    public CommandAck(String cmdType, String status, String message, long ts, String msgId) {
        this.cmdType = cmdType;
        this.status = status;
        this.message = message;
        this.ts = ts;
        this.msgId = msgId;
    }

    public static CommandAck accepted(LineCommand command, String message) {
        return new CommandAck(command.getType(), ACCEPTED, message, System.currentTimeMillis(), command.getMsgId());
    }

    public static CommandAck rejected(LineCommand command, String message) {
        String type = command != null ? command.getType() : null;
        String msgId = command != null ? command.getMsgId() : null;
        return new CommandAck(type, REJECTED, message, System.currentTimeMillis(), msgId);
    }

    public boolean isAccepted() {
        return ACCEPTED.equals(status);
    }

    public String getCmdType() {
        return cmdType;
    }

    public void setCmdType(String cmdType) {
        this.cmdType = cmdType;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
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
}
