package com.caredirectory.providers.model;

import java.util.List;

public record HealthcareProviderIdList(List<HealthcareProviderId> providersIds) {
}
