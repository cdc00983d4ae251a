package com.caredirectory.providers.model;

import java.util.List;

/**
 * Projection written into the bulk-download snapshot.
 */
public record SimpleHealthcareProvider(
        Long locationId,
        Long institutionId,
        String title,
        String street,
        String houseNumber,
        String city,
        String postalCode,
        List<String> category,
        String specialization,
        Double lat,
        Double lng) {
}
