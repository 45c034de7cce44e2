package com.permit.resolution.core.model;

import java.util.Objects;

/**
 * Assessor parcel identifier.
 */
public record ParcelId(String block, String lot) {

    public ParcelId {
        Objects.requireNonNull(block, "block is required");
        Objects.requireNonNull(lot, "lot is required");
    }

    @Override
    public String toString() {
        return block + "/" + lot;
    }
}
