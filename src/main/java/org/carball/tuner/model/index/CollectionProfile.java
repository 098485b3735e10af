package org.carball.tuner.model.index;

public record CollectionProfile(String name, long documentCount, int indexCount) {

    public boolean isSystemCollection() {
        return name.startsWith("system.");
    }
}
