package org.carball.tuner.model.query;

public enum StoreKind {
    RELATIONAL("PostgreSQL"),
    DOCUMENT("MongoDB");

    private final String displayName;

    StoreKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
