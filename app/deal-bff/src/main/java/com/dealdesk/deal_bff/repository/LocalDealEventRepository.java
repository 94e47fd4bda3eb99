/*
 * どこで: Deal-BFF データアクセス
 * 何を: deal_events (ローカル監査チェーン) の追記と取得を担う
 * なぜ: 連番とハッシュ連結を DB 上で一貫させるため
 */
package com.dealdesk.deal_bff.repository;

import static com.dealdesk.common.JdbcTimestampUtils.toInstant;
import static com.dealdesk.common.JdbcTimestampUtils.toTimestamp;

import com.dealdesk.deal_bff.model.LocalDealEventRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class LocalDealEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockDeal(long lockKey) {
    // 同一 deal への追記をトランザクション内で直列化し、連番と previous_hash の競合を防ぐ。
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public Optional<LocalDealEventRecord> findLatest(String dealId) {
    final String sql =
        """
        SELECT id, deal_id, sequence_number, event_type, event_data::text AS event_data_text,
               actor_id, previous_hash, event_hash, occurred_at
        FROM deal_events
        WHERE deal_id = :dealId
        ORDER BY sequence_number DESC
        LIMIT 1
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("dealId", dealId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<LocalDealEventRecord> findByDealId(String dealId) {
    final String sql =
        """
        SELECT id, deal_id, sequence_number, event_type, event_data::text AS event_data_text,
               actor_id, previous_hash, event_hash, occurred_at
        FROM deal_events
        WHERE deal_id = :dealId
        ORDER BY sequence_number ASC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("dealId", dealId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public void insert(LocalDealEventRecord record) {
    final String sql =
        """
        INSERT INTO deal_events (
          id,
          deal_id,
          sequence_number,
          event_type,
          event_data,
          actor_id,
          previous_hash,
          event_hash,
          occurred_at
        ) VALUES (
          :id,
          :dealId,
          :sequenceNumber,
          :eventType,
          :eventData::jsonb,
          :actorId,
          :previousHash,
          :eventHash,
          :occurredAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", UUID.fromString(record.id()))
            .addValue("dealId", record.dealId())
            .addValue("sequenceNumber", record.sequenceNumber())
            .addValue("eventType", record.eventType())
            .addValue("eventData", record.eventDataJson())
            .addValue("actorId", record.actorId())
            .addValue("previousHash", record.previousHash())
            .addValue("eventHash", record.eventHash())
            .addValue("occurredAt", toTimestamp(record.occurredAt()));
    jdbcTemplate.update(sql, params);
  }

  private LocalDealEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new LocalDealEventRecord(
        rs.getString("id"),
        rs.getString("deal_id"),
        rs.getLong("sequence_number"),
        rs.getString("event_type"),
        rs.getString("event_data_text"),
        rs.getString("actor_id"),
        rs.getString("previous_hash"),
        rs.getString("event_hash"),
        toInstant(rs.getTimestamp("occurred_at")));
  }
}
