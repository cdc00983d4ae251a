package com.caredirectory.providers.model;

public enum RefreshTrigger {
    SCHEDULED, ON_DEMAND, STARTUP
}
