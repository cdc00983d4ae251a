package com.caredirectory.providers.model;

import java.util.List;

public record HealthcareProviderDetail(
        Long locationId,
        Long institutionId,
        String title,
        String institutionType,
        String street,
        String houseNumber,
        String city,
        String postalCode,
        String phoneNumber,
        String fax,
        String email,
        String website,
        String ico,
        List<String> category,
        String specialization,
        String careForm,
        String careType,
        String substitute,
        Double lat,
        Double lng) {
}
