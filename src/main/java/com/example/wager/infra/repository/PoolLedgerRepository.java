package com.example.wager.infra.repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import lombok.RequiredArgsConstructor;

/**
 * 資金池餘額 (pool_ledger)
 * <p>
 * 多筆結算共同修改的唯一資源。更新一律以 compare-and-set 完成，資料庫保證更新後餘額不為負， 不做讀取後再寫回。
 * </p>
 */
@Repository
@RequiredArgsConstructor
public class PoolLedgerRepository {

	private final JdbcTemplate jdbcTemplate;

	/**
	 * balance += delta，且 balance + delta >= 0
	 *
	 * @return false 代表餘額不足，未更新
	 */
	public boolean applyDelta(String poolId, long delta, Instant now) {
		String sql = "UPDATE pool_ledger SET balance = balance + ?, updated_at = ? WHERE pool_id = ? AND balance >= ?";
		return jdbcTemplate.update(sql, delta, Timestamp.from(now), poolId, -delta) > 0;
	}

	public Optional<Long> findBalance(String poolId) {
		List<Long> rows = jdbcTemplate.queryForList("SELECT balance FROM pool_ledger WHERE pool_id = ?", Long.class,
				poolId);
		return rows.stream().findFirst();
	}

	public boolean insertIfAbsent(String poolId, long balance, Instant now) {
		try {
			return jdbcTemplate.update("INSERT INTO pool_ledger (pool_id, balance, updated_at) VALUES (?, ?, ?)",
					poolId, balance, Timestamp.from(now)) > 0;
		} catch (DuplicateKeyException e) {
			return false;
		}
	}
}
