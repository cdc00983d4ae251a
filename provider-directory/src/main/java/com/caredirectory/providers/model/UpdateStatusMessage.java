package com.caredirectory.providers.model;

public record UpdateStatusMessage(String message) {
}
