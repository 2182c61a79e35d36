/*
 * どこで: app/healthion-api/src/main/java/com/healthion/bff/model/UpstreamUser.java
 * 何を: upstream platform のユーザー表現(必要な項目のみ)
 */
package com.healthion.bff.model;

public record UpstreamUser(String id, String externalUserId, String email) {
}
