package org.carball.tuner.model.index;

/**
 * Access counter of a document-store index. The server resets {@code operations} on restart.
 */
public record DocumentIndexUsage(String collection, String name, String keys, long operations) {

    public static final String IDENTITY_INDEX = "_id_";

    public boolean isIdentityIndex() {
        return IDENTITY_INDEX.equals(name);
    }
}
