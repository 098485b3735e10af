package org.carball.tuner.model.run;

import java.time.Instant;

public record AlertEvent(String subject, String body, Instant timestamp) {

    public static AlertEvent now(String subject, String body) {
        return new AlertEvent(subject, body, Instant.now());
    }
}
