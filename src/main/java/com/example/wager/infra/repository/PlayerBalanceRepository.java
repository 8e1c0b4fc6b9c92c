package com.example.wager.infra.repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.wager.application.shared.projection.PlayerBalanceProjection;

import lombok.RequiredArgsConstructor;

/**
 * 玩家餘額資料表 (player_balances)，所有異動都是帶條件的單一 UPDATE
 */
@Repository
@RequiredArgsConstructor
public class PlayerBalanceRepository {

	private final JdbcTemplate jdbcTemplate;

	/**
	 * available -> reserved，可用餘額不足時不更新
	 */
	public boolean reserve(String playerId, long amount) {
		String sql = """
				UPDATE player_balances SET available = available - ?, reserved = reserved + ?, updated_at = ?
				WHERE player_id = ? AND available >= ?
				""";
		return jdbcTemplate.update(sql, amount, amount, now(), playerId, amount) > 0;
	}

	/**
	 * reserved -> available
	 */
	public boolean release(String playerId, long amount) {
		String sql = """
				UPDATE player_balances SET available = available + ?, reserved = reserved - ?, updated_at = ?
				WHERE player_id = ? AND reserved >= ?
				""";
		return jdbcTemplate.update(sql, amount, amount, now(), playerId, amount) > 0;
	}

	/**
	 * 消耗保留的下注金額並入帳派彩
	 */
	public boolean settle(String playerId, long wager, long payout) {
		String sql = """
				UPDATE player_balances SET reserved = reserved - ?, available = available + ?, updated_at = ?
				WHERE player_id = ? AND reserved >= ?
				""";
		return jdbcTemplate.update(sql, wager, payout, now(), playerId, wager) > 0;
	}

	public void deposit(String playerId, long amount) {
		String update = "UPDATE player_balances SET available = available + ?, updated_at = ? WHERE player_id = ?";
		if (jdbcTemplate.update(update, amount, now(), playerId) > 0) {
			return;
		}
		try {
			jdbcTemplate.update(
					"INSERT INTO player_balances (player_id, available, reserved, updated_at) VALUES (?, ?, 0, ?)",
					playerId, amount, now());
		} catch (DuplicateKeyException e) {
			// 併發建立，改走更新
			jdbcTemplate.update(update, amount, now(), playerId);
		}
	}

	public Optional<PlayerBalanceProjection> find(String playerId) {
		List<PlayerBalanceProjection> rows = jdbcTemplate.query(
				"SELECT player_id, available, reserved FROM player_balances WHERE player_id = ?",
				(rs, rowNum) -> new PlayerBalanceProjection(rs.getString("player_id"), rs.getLong("available"),
						rs.getLong("reserved")),
				playerId);
		return rows.stream().findFirst();
	}

	private static Timestamp now() {
		return Timestamp.from(Instant.now());
	}
}
