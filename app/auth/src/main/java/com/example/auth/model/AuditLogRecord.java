/*
 * どこで: app/auth/src/main/java/com/example/auth/model/AuditLogRecord.java
 * 何を: audit_logs テーブル相当のドメインレコード
 * なぜ: signup ポリシー変更など運用操作を追跡するため
 */
package com.example.auth.model;

import java.time.Instant;

public record AuditLogRecord(
        String id,
        String actorUserId,
        String action,
        String target,
        String metadataJson,
        Instant createdAt) {
}
