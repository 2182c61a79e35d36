package com.healthion.bff.api.response;

public record TimeseriesDataPoint(String timestamp, String type, double value, String unit) {}
