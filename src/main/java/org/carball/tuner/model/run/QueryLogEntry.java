package org.carball.tuner.model.run;

import org.carball.tuner.model.query.SanitizedQueryRecord;
import org.carball.tuner.model.query.StoreKind;

import java.time.Instant;
import java.util.List;

/**
 * One entry of the rolling slow-query log.
 */
public record QueryLogEntry(Instant timestamp, StoreKind storeKind, List<SanitizedQueryRecord> sanitizedQueries) {}
