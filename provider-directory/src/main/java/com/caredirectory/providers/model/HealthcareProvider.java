package com.caredirectory.providers.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Provider record as parsed from the open-data register and stored in healthcare_provider.
 *
 * Categories are held by taxonomy value, not by category row identity.
 */
@Data
@Builder
public class HealthcareProvider {

    // ── Key ─────────────────────────────────────────────────────────────────
    private Long locationId;
    private Long institutionId;

    // ── Description ─────────────────────────────────────────────────────────
    private String title;
    private String institutionType;
    private String specialization;
    private String careForm;
    private String careType;
    private String substitute;

    /** Values from {@link HealthcareCategory}, in taxonomy order */
    private List<String> category;

    // ── Address ─────────────────────────────────────────────────────────────
    private String street;
    private String houseNumber;
    private String city;
    private String postalCode;
    private Double lat;
    private Double lng;

    // ── Contact ─────────────────────────────────────────────────────────────
    private String phoneNumber;
    private String fax;
    private String email;
    private String website;
    private String ico;

    public HealthcareProviderId id() {
        return new HealthcareProviderId(locationId, institutionId);
    }

    public SimpleHealthcareProvider simplify() {
        return new SimpleHealthcareProvider(
                locationId, institutionId, title,
                street, houseNumber, city, postalCode,
                category == null ? List.of() : List.copyOf(category),
                specialization, lat, lng);
    }

    public HealthcareProviderDetail details() {
        return new HealthcareProviderDetail(
                locationId, institutionId, title, institutionType,
                street, houseNumber, city, postalCode,
                phoneNumber, fax, email, website, ico,
                category == null ? List.of() : List.copyOf(category),
                specialization, careForm, careType, substitute, lat, lng);
    }
}
