package com.example.scheduler.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;

/** Redis に保存する JSON の形。フィールド名は既存の保存データと互換にしている。 */
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "JSON 変換専用の内部 record のため")
record StoredMessage(
    String id, String scheduleTo, Map<String, Object> payload, String webhookUrl) {}
