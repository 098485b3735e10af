package org.carball.tuner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MailSettings {

    @JsonProperty("host")
    private String host;

    @JsonProperty("port")
    private int port = 587;

    @JsonProperty("username")
    private String username;

    @ToString.Exclude
    @JsonProperty("password")
    private String password;

    @JsonProperty("from")
    private String from;

    @JsonProperty("recipient")
    private String recipient;

    @JsonProperty("start_tls")
    private boolean startTls = true;

    /**
     * Delivery needs at least a transport host and somebody to deliver to.
     */
    public boolean isConfigured() {
        return host != null && !host.isBlank() && recipient != null && !recipient.isBlank();
    }

    public String getSender() {
        if (from != null && !from.isBlank()) {
            return from;
        }
        return username != null ? username : "db-tuner@localhost";
    }
}
