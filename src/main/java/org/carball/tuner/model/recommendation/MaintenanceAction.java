package org.carball.tuner.model.recommendation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a maintenance command run against a store, such as {@code VACUUM ANALYZE}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MaintenanceAction(String command, boolean success, String error) {

    public static MaintenanceAction completed(String command) {
        return new MaintenanceAction(command, true, null);
    }

    public static MaintenanceAction failed(String command, String error) {
        return new MaintenanceAction(command, false, error);
    }
}
