package nineflat.core.dynamics;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PortMode {
    @JsonProperty("event_send")
    EVENT_SEND(Communication.EVENT, true),
    @JsonProperty("event_receive")
    EVENT_RECEIVE(Communication.EVENT, false),
    @JsonProperty("analog_send")
    ANALOG_SEND(Communication.ANALOG, true),
    @JsonProperty("analog_receive")
    ANALOG_RECEIVE(Communication.ANALOG, false),
    @JsonProperty("analog_reduce")
    ANALOG_REDUCE(Communication.ANALOG, false);

    private final Communication communication;
    private final boolean send;

    PortMode(Communication communication, boolean send) {
        this.communication = communication;
        this.send = send;
    }

    public Communication communication() {
        return communication;
    }

    public boolean isSend() {
        return send;
    }
}
