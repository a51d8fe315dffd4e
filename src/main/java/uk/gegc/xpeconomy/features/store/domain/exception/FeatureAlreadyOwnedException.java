package uk.gegc.xpeconomy.features.store.domain.exception;

public class FeatureAlreadyOwnedException extends RuntimeException {

    private final String itemId;

    public FeatureAlreadyOwnedException(String itemId, String message) {
        super(message);
        this.itemId = itemId;
    }

    public static FeatureAlreadyOwnedException feature(String featureId) {
        return new FeatureAlreadyOwnedException(featureId, "Feature " + featureId + " is already owned");
    }

    public static FeatureAlreadyOwnedException bundle(String bundleId) {
        return new FeatureAlreadyOwnedException(bundleId, "Every feature in bundle " + bundleId + " is already owned");
    }

    public String getItemId() {
        return itemId;
    }
}
