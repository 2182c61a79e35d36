/*
 * どこで: app/healthion-api/src/main/java/com/healthion/bff/model/UserRecord.java
 * 何を: users テーブル相当のドメインレコード
 * なぜ: API/Service/Repository 間でユーザー情報の受け渡しを明確にするため
 */
package com.healthion.bff.model;

import java.time.Instant;

public record UserRecord(
        String id,
        String externalIdentityId,
        String email,
        String upstreamUserId,
        Instant createdAt,
        Instant updatedAt) {

    public boolean isLinkedUpstream() {
        return upstreamUserId != null;
    }
}
