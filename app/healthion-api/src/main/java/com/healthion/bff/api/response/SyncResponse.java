package com.healthion.bff.api.response;

public record SyncResponse(String status, String message, int syncedCount) {}
