package com.healthion.bff.api.response;

public record AuthorizationResponse(String authorizationUrl, String provider) {}
