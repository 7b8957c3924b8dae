package nineflat.core.dynamics;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Communication {
    @JsonProperty("event")
    EVENT,
    @JsonProperty("analog")
    ANALOG
}
