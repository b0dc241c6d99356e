/*
 * どこで: app/auth/src/main/java/com/example/auth/model/UserRecord.java
 * 何を: users テーブル相当のドメインレコード
 * なぜ: accessTokenHash か provider + thirdPartyId のどちらか一方で同定されるユーザーを表すため
 */
package com.example.auth.model;

import java.time.Instant;

public record UserRecord(
        String id,
        AuthProvider provider,
        String thirdPartyId,
        String accessTokenHash,
        Instant createdAt,
        Instant updatedAt) {
}
