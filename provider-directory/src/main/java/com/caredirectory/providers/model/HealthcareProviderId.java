package com.caredirectory.providers.model;

/**
 * Composite key of a provider: one facility ({@code locationId}) run by one institution
 * ({@code institutionId}).
 */
public record HealthcareProviderId(Long locationId, Long institutionId) {
}
