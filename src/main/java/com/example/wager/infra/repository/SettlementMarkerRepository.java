package com.example.wager.infra.repository;

import java.sql.Timestamp;
import java.time.Instant;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>結算冪等標記 (settled_rounds)</h1>
 * <p>
 * <b>職責：</b> 利用主鍵唯一性限制實現「已結算」標記。標記與餘額異動在同一交易內寫入， 因此檢查與設定是同一個原子動作
 * (check-and-set)，重複投遞或重啟後重播都不會再動到餘額。
 * </p>
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class SettlementMarkerRepository {

	private final JdbcTemplate jdbcTemplate;

	/**
	 * 嘗試佔位
	 *
	 * @return {@code true} 代表取得結算權；{@code false} 代表此回合已結算過
	 */
	public boolean tryMarkAsSettled(String roundId, String playerId, long payout, Instant settledAt) {
		String sql = "INSERT INTO settled_rounds (round_id, player_id, payout, settled_at) VALUES (?, ?, ?, ?)";
		try {
			return jdbcTemplate.update(sql, roundId, playerId, payout, Timestamp.from(settledAt)) > 0;
		} catch (DuplicateKeyException e) {
			log.info(">>> [Idempotency] 回合 {} 已有結算標記", roundId);
			return false;
		}
	}
}
