package org.carball.tuner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TunerConfig {

    @ToString.Exclude
    @JsonProperty("postgres_url")
    private String postgresUrl;

    @ToString.Exclude
    @JsonProperty("mongo_uri")
    private String mongoUri;

    @JsonProperty("mongo_database")
    private String mongoDatabase;

    @JsonProperty("slow_query_threshold_ms")
    private long slowQueryThresholdMs = 1000;

    @JsonProperty("schedule")
    private String schedule = "02:00";

    @JsonProperty("execute_recommendations")
    private boolean executeRecommendations = false;

    @JsonProperty("audit_directory")
    private String auditDirectory = "logs/database";

    @JsonProperty("query_timeout_seconds")
    private int queryTimeoutSeconds = 30;

    @JsonProperty("mail")
    private MailSettings mail = new MailSettings();

    @JsonProperty("thresholds")
    private AdvisorThresholds thresholds = AdvisorThresholds.defaults();

    public boolean isRelationalEnabled() {
        return postgresUrl != null && !postgresUrl.isBlank();
    }

    public boolean isDocumentEnabled() {
        return mongoUri != null && !mongoUri.isBlank() && mongoDatabase != null && !mongoDatabase.isBlank();
    }

    public String getDescription() {
        return String.format(
                "Stores: relational=%s, document=%s | slowThreshold=%dms | schedule=%s | execute=%s | audit=%s | timeout=%ds | mail=%s",
                isRelationalEnabled(), isDocumentEnabled(), slowQueryThresholdMs, schedule,
                executeRecommendations, auditDirectory, queryTimeoutSeconds,
                mail != null && mail.isConfigured());
    }
}
