package io.civicledger.core.protocol;

/**
 * Routing/display location of a report. Stored in the clear; it is not citizen narrative.
 */
public record Location(String area, String address, String nearestStation) {
    public Location {
        if (area == null || address == null || nearestStation == null) {
            throw new IllegalArgumentException("location fields must not be null");
        }
    }
}
