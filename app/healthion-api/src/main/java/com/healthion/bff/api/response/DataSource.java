package com.healthion.bff.api.response;

/** データの取得元。provider が不明な場合は "unknown" になる。 */
public record DataSource(String provider, String device) {}
