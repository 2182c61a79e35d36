package com.healthion.bff.api.response;

public record WearableProvider(
    String name, String displayName, String iconUrl, boolean hasCloudApi, boolean isEnabled) {}
