package com.healthion.bff.api.response;

public record WearableConnection(
    String id, String provider, String connectedAt, boolean isActive, String lastSync) {}
