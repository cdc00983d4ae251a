package com.caredirectory.providers.model;

import java.util.List;

public record HealthcareProviderDetailList(List<HealthcareProviderDetail> healthcareProvidersDetails) {
}
