package org.carball.tuner.model.run;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Result of the connection test of one monitored store.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoreHealth(Status status, Map<String, Object> metrics, String error) {

    public enum Status {
        CONNECTED,
        ERROR,
        NOT_CONNECTED;

        @JsonValue
        public String jsonValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static StoreHealth connected(Map<String, Object> metrics) {
        return new StoreHealth(Status.CONNECTED, metrics, null);
    }

    public static StoreHealth error(String error) {
        return new StoreHealth(Status.ERROR, null, error);
    }

    public static StoreHealth notConnected(String reason) {
        return new StoreHealth(Status.NOT_CONNECTED, null, reason);
    }
}
