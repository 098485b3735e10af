package org.carball.tuner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.LongConsumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public TunerConfig loadConfiguration(String[] args) throws IOException {
        log.debug("Loading configuration");

        String configFile = findArgument(args, "--config");
        TunerConfig config = configFile != null ? loadFile(Paths.get(configFile)) : new TunerConfig();

        applyEnvironmentVariables(config);
        applyCLIArguments(config, args);

        if (config.getMail() == null) {
            config.setMail(new MailSettings());
        }
        if (config.getThresholds() == null) {
            config.setThresholds(AdvisorThresholds.defaults());
        }
        config.getThresholds().validate();

        log.info("Configuration loaded: {}", config.getDescription());
        log.info("Thresholds: {}", config.getThresholds().getConfigurationSummary());
        return config;
    }

    /**
     * Reads a YAML configuration file with snake_case keys.
     */
    public TunerConfig loadFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Configuration file does not exist: " + path);
        }

        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        TunerConfig config = mapper.readValue(path.toFile(), TunerConfig.class);
        log.info("Loaded configuration file: {}", path);
        return config != null ? config : new TunerConfig();
    }

    private void applyEnvironmentVariables(TunerConfig config) {
        MailSettings mail = config.getMail() != null ? config.getMail() : new MailSettings();
        config.setMail(mail);

        if (environment.containsKey("TUNER_POSTGRES_URL")) {
            config.setPostgresUrl(environment.get("TUNER_POSTGRES_URL"));
        }
        if (environment.containsKey("TUNER_MONGO_URI")) {
            config.setMongoUri(environment.get("TUNER_MONGO_URI"));
        }
        if (environment.containsKey("TUNER_MONGO_DATABASE")) {
            config.setMongoDatabase(environment.get("TUNER_MONGO_DATABASE"));
        }
        if (environment.containsKey("TUNER_SLOW_QUERY_THRESHOLD_MS")) {
            parseLong("TUNER_SLOW_QUERY_THRESHOLD_MS", environment.get("TUNER_SLOW_QUERY_THRESHOLD_MS"),
                    config::setSlowQueryThresholdMs);
        }
        if (environment.containsKey("TUNER_SCHEDULE")) {
            config.setSchedule(environment.get("TUNER_SCHEDULE"));
        }
        if (environment.containsKey("TUNER_EXECUTE_RECOMMENDATIONS")) {
            config.setExecuteRecommendations(Boolean.parseBoolean(environment.get("TUNER_EXECUTE_RECOMMENDATIONS")));
        }
        if (environment.containsKey("TUNER_AUDIT_DIRECTORY")) {
            config.setAuditDirectory(environment.get("TUNER_AUDIT_DIRECTORY"));
        }
        if (environment.containsKey("TUNER_QUERY_TIMEOUT_SECONDS")) {
            parseLong("TUNER_QUERY_TIMEOUT_SECONDS", environment.get("TUNER_QUERY_TIMEOUT_SECONDS"),
                    value -> config.setQueryTimeoutSeconds((int) value));
        }

        if (environment.containsKey("TUNER_MAIL_HOST")) {
            mail.setHost(environment.get("TUNER_MAIL_HOST"));
        }
        if (environment.containsKey("TUNER_MAIL_PORT")) {
            parseLong("TUNER_MAIL_PORT", environment.get("TUNER_MAIL_PORT"), value -> mail.setPort((int) value));
        }
        if (environment.containsKey("TUNER_MAIL_USERNAME")) {
            mail.setUsername(environment.get("TUNER_MAIL_USERNAME"));
        }
        if (environment.containsKey("TUNER_MAIL_PASSWORD")) {
            mail.setPassword(environment.get("TUNER_MAIL_PASSWORD"));
        }
        if (environment.containsKey("TUNER_MAIL_FROM")) {
            mail.setFrom(environment.get("TUNER_MAIL_FROM"));
        }
        if (environment.containsKey("TUNER_MAIL_RECIPIENT")) {
            mail.setRecipient(environment.get("TUNER_MAIL_RECIPIENT"));
        }
    }

    private void applyCLIArguments(TunerConfig config, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];

            // Boolean flags
            if ("--execute".equals(arg)) {
                config.setExecuteRecommendations(true);
                continue;
            }
            if (i + 1 >= args.length) {
                continue;
            }
            String value = args[i + 1];

            switch (arg) {
                case "--postgres-url":
                    config.setPostgresUrl(value);
                    break;
                case "--mongo-uri":
                    config.setMongoUri(value);
                    break;
                case "--mongo-database":
                    config.setMongoDatabase(value);
                    break;
                case "--slow-query-threshold":
                    parseLong(arg, value, config::setSlowQueryThresholdMs);
                    break;
                case "--schedule":
                    config.setSchedule(value);
                    break;
                case "--audit-directory":
                    config.setAuditDirectory(value);
                    break;
                case "--query-timeout":
                    parseLong(arg, value, timeout -> config.setQueryTimeoutSeconds((int) timeout));
                    break;
                case "--mail-recipient":
                    config.getMail().setRecipient(value);
                    break;
            }
        }
    }

    private static void parseLong(String name, String value, LongConsumer target) {
        try {
            target.accept(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, value);
        }
    }

    private static String findArgument(String[] args, String name) {
        for (int i = 0; i < args.length - 1; i++) {
            if (name.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --config <file>                 YAML configuration file
              --postgres-url <jdbc-url>       PostgreSQL JDBC URL (relational store)
              --mongo-uri <uri>               MongoDB connection string (document store)
              --mongo-database <name>         MongoDB database to inspect
              --slow-query-threshold <ms>     Minimum total execution time of a slow statement
              --schedule <HH:mm|cron>         Daily run time (default 02:00)
              --audit-directory <dir>         Directory of the audit logs (default logs/database)
              --query-timeout <seconds>       Per-call database timeout (default 30)
              --mail-recipient <address>      Alert recipient
              --execute                       Create suggested missing indexes

            Environment Variables:
              TUNER_POSTGRES_URL, TUNER_MONGO_URI, TUNER_MONGO_DATABASE,
              TUNER_SLOW_QUERY_THRESHOLD_MS, TUNER_SCHEDULE, TUNER_EXECUTE_RECOMMENDATIONS,
              TUNER_AUDIT_DIRECTORY, TUNER_QUERY_TIMEOUT_SECONDS,
              TUNER_MAIL_HOST, TUNER_MAIL_PORT, TUNER_MAIL_USERNAME, TUNER_MAIL_PASSWORD,
              TUNER_MAIL_FROM, TUNER_MAIL_RECIPIENT

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Configuration file
              4. Built-in defaults
            """;
    }
}
