package nineflat.core.network;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import nineflat.core.InvalidRoleException;
import nineflat.core.dynamics.Communication;

/**
 * A directed link between two ports of a projection, each endpoint tagged with
 * the role of its owner.
 *
 * {@code communicates} may be left out of the input. It is then taken from the
 * modes of the connected ports when the network is flattened.
 */
public record PortConnection(
        @JsonProperty("sender_role") Role senderRole,
        @JsonProperty("receiver_role") Role receiverRole,
        @JsonProperty("send_port") String sendPort,
        @JsonProperty("receive_port") String receivePort,
        @JsonInclude(JsonInclude.Include.NON_NULL) Communication communicates) {

    public PortConnection {
        if (senderRole == null || receiverRole == null) {
            throw new InvalidRoleException(
                    "Port connection %s -> %s has an unresolved role".formatted(sendPort, receivePort));
        }
    }

    public boolean touches(Role role) {
        return senderRole == role || receiverRole == role;
    }

    public PortConnection withSender(Role role, String port) {
        return new PortConnection(role, receiverRole, port, receivePort, communicates);
    }

    public PortConnection withReceiver(Role role, String port) {
        return new PortConnection(senderRole, role, sendPort, port, communicates);
    }

    public PortConnection withCommunication(Communication communication) {
        return new PortConnection(senderRole, receiverRole, sendPort, receivePort, communication);
    }

    /**
     * The name this connection is known by inside its projection.
     */
    public String label() {
        return String.join("__", senderRole.label(), sendPort, receiverRole.label(), receivePort);
    }
}
