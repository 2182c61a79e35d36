package com.healthion.bff.api.response;

public record SleepStages(
    Integer awakeSeconds, Integer lightSeconds, Integer deepSeconds, Integer remSeconds) {}
