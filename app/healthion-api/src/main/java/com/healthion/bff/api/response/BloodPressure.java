package com.healthion.bff.api.response;

public record BloodPressure(Integer systolicMmhg, Integer diastolicMmhg) {}
