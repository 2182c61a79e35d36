package com.healthion.bff.model;

public record DateRangeQuery(String startDate, String endDate, int limit, String cursor) {}
