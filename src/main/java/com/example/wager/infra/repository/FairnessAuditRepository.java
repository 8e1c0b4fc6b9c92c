package com.example.wager.infra.repository;

import java.sql.Timestamp;
import java.util.List;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.wager.application.domain.round.AuditEventType;
import com.example.wager.application.domain.round.RoundAuditEvent;

import lombok.RequiredArgsConstructor;

/**
 * 公平性稽核資料表 (fairness_audit)，只追加不修改
 */
@Repository
@RequiredArgsConstructor
public class FairnessAuditRepository {

	private static final int MAX_DETAIL_LENGTH = 1024;

	private final JdbcTemplate jdbcTemplate;

	public void append(RoundAuditEvent event) {
		jdbcTemplate.update(
				"INSERT INTO fairness_audit (round_id, player_id, event_type, detail, recorded_at) VALUES (?, ?, ?, ?, ?)",
				event.roundId(), event.playerId(), event.type().name(), detail(event),
				Timestamp.from(event.recordedAt()));
	}

	public List<RoundAuditEvent> findByRound(String roundId) {
		return jdbcTemplate.query(
				"SELECT round_id, player_id, event_type, detail, recorded_at FROM fairness_audit WHERE round_id = ? ORDER BY id ASC",
				(rs, rowNum) -> new RoundAuditEvent(rs.getString("round_id"), rs.getString("player_id"),
						AuditEventType.valueOf(rs.getString("event_type")), rs.getString("detail"),
						rs.getTimestamp("recorded_at").toInstant()),
				roundId);
	}

	private static String detail(RoundAuditEvent event) {
		String detail = event.detail();
		return detail == null || detail.length() <= MAX_DETAIL_LENGTH ? detail
				: detail.substring(0, MAX_DETAIL_LENGTH);
	}
}
