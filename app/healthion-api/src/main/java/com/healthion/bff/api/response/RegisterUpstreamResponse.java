package com.healthion.bff.api.response;

public record RegisterUpstreamResponse(String upstreamUserId, boolean alreadyRegistered) {}
