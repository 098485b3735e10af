package org.carball.tuner.alert;

import org.carball.tuner.model.run.AlertEvent;

/**
 * Delivers anomaly notifications. Implementations without delivery configuration log a warning
 * and return; a configured transport that fails throws {@link DeliveryException}.
 */
public interface AlertDispatcher {

    void dispatch(AlertEvent event);

    default void dispatch(String subject, String body) {
        dispatch(AlertEvent.now(subject, body));
    }
}
