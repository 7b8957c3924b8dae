package nineflat.core.multi;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;

/**
 * A port connection between two named sub-components of the same aggregate.
 */
public record SubComponentConnection(
        String sender,
        @JsonProperty("send_port") String sendPort,
        String receiver,
        @JsonProperty("receive_port") String receivePort) implements Comparable<SubComponentConnection> {

    private static final Comparator<SubComponentConnection> ORDER = Comparator
            .comparing(SubComponentConnection::sender)
            .thenComparing(SubComponentConnection::sendPort)
            .thenComparing(SubComponentConnection::receiver)
            .thenComparing(SubComponentConnection::receivePort);

    @Override
    public int compareTo(SubComponentConnection o) {
        return ORDER.compare(this, o);
    }
}
