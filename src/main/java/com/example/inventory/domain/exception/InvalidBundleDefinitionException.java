package com.example.inventory.domain.exception;

/**
 * A bundle whose definition cannot be resolved: no components, a malformed component line, or a component
 * missing from the catalog.
 */
public class InvalidBundleDefinitionException extends DomainException {

    private final long bundleId;

    private InvalidBundleDefinitionException(long bundleId, String message, Long componentId) {
        super("INVALID_BUNDLE_DEFINITION", message,
                details("bundleId", bundleId, "componentProductId", componentId));
        this.bundleId = bundleId;
    }

    public static InvalidBundleDefinitionException noComponents(long bundleId) {
        return new InvalidBundleDefinitionException(bundleId,
                "Bundle " + bundleId + " has no components", null);
    }

    public static InvalidBundleDefinitionException nonPositiveQuantity(long bundleId, long componentId,
                                                                       int quantityPerBundle) {
        return new InvalidBundleDefinitionException(bundleId,
                "Bundle " + bundleId + " needs " + quantityPerBundle + " of product " + componentId
                        + "; quantity per bundle must be positive",
                componentId);
    }

    public static InvalidBundleDefinitionException invalidComponentId(long bundleId, long componentId) {
        return new InvalidBundleDefinitionException(bundleId,
                "Bundle " + bundleId + " references invalid product id " + componentId,
                componentId);
    }

    public static InvalidBundleDefinitionException missingComponent(long bundleId, long componentId) {
        return new InvalidBundleDefinitionException(bundleId,
                "Bundle " + bundleId + " references product " + componentId + " which is not in the catalog",
                componentId);
    }

    public long getBundleId() {
        return bundleId;
    }
}
