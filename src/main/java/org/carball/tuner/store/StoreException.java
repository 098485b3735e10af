package org.carball.tuner.store;

import org.carball.tuner.model.query.StoreKind;

/**
 * A monitored store could not be reached or rejected a statistics query.
 */
public class StoreException extends RuntimeException {

    private final StoreKind storeKind;

    public StoreException(StoreKind storeKind, String message, Throwable cause) {
        super(storeKind.getDisplayName() + ": " + message, cause);
        this.storeKind = storeKind;
    }

    public StoreKind getStoreKind() {
        return storeKind;
    }
}
