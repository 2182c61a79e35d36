/*
 * どこで: app/healthion-api/src/main/java/com/healthion/bff/api/ApiErrorResponse.java
 * 何を: API エラー応答の共通 DTO
 * なぜ: エラー形式を統一し、フロントエンドで code により機械的に分岐できるようにするため
 */
package com.healthion.bff.api;

public record ApiErrorResponse(String code, String message) {}
