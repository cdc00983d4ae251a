package com.caredirectory.providers.model;

public record UpdateStatus(String lastUpdate, boolean updating) {
}
