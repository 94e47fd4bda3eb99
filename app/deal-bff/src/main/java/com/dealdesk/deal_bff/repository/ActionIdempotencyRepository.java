/*
 * どこで: Deal-BFF データアクセス
 * 何を: action_idempotency の取得/保存/期限切れ削除を担う
 * なぜ: アクション結果をプロセス再起動後も再送応答として返せるようにするため
 */
package com.dealdesk.deal_bff.repository;

import static com.dealdesk.common.JdbcTimestampUtils.toInstant;
import static com.dealdesk.common.JdbcTimestampUtils.toTimestamp;

import com.dealdesk.deal_bff.model.IdempotencyRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ActionIdempotencyRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<IdempotencyRecord> findByKey(String idempotencyKey, Instant now) {
    final String sql =
        """
        SELECT idempotency_key, deal_id, action_type, actor_id, payload_hash, status_code,
               response_body::text AS response_body_text, appended_event_id, created_at, expires_at
        FROM action_idempotency
        WHERE idempotency_key = :idempotencyKey
          AND expires_at > :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("idempotencyKey", idempotencyKey)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int upsert(IdempotencyRecord record) {
    // 同一キーの同時書き込みは行ロックで直列化され、後勝ちになる。
    final String sql =
        """
        INSERT INTO action_idempotency (
          idempotency_key,
          deal_id,
          action_type,
          actor_id,
          payload_hash,
          status_code,
          response_body,
          appended_event_id,
          created_at,
          expires_at
        ) VALUES (
          :idempotencyKey,
          :dealId,
          :actionType,
          :actorId,
          :payloadHash,
          :statusCode,
          :responseBody::jsonb,
          :appendedEventId,
          :createdAt,
          :expiresAt
        )
        ON CONFLICT (idempotency_key) DO UPDATE
          SET
            status_code       = EXCLUDED.status_code,
            response_body     = EXCLUDED.response_body,
            appended_event_id = EXCLUDED.appended_event_id,
            created_at        = EXCLUDED.created_at,
            expires_at        = EXCLUDED.expires_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("idempotencyKey", record.idempotencyKey())
            .addValue("dealId", record.dealId())
            .addValue("actionType", record.actionType())
            .addValue("actorId", record.actorId())
            .addValue("payloadHash", record.payloadHash())
            .addValue("statusCode", record.statusCode())
            .addValue("responseBody", record.responseBodyJson())
            .addValue("appendedEventId", record.appendedEventId())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("expiresAt", toTimestamp(record.expiresAt()));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM action_idempotency
        WHERE expires_at <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private IdempotencyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new IdempotencyRecord(
        rs.getString("idempotency_key"),
        rs.getString("deal_id"),
        rs.getString("action_type"),
        rs.getString("actor_id"),
        rs.getString("payload_hash"),
        rs.getInt("status_code"),
        rs.getString("response_body_text"),
        rs.getString("appended_event_id"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("expires_at")));
  }
}
