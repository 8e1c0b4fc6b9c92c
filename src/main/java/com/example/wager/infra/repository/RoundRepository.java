package com.example.wager.infra.repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import com.example.wager.application.domain.fairness.CoinChoice;
import com.example.wager.application.domain.fairness.Commitment;
import com.example.wager.application.domain.fairness.Nonce;
import com.example.wager.application.domain.round.Round;
import com.example.wager.application.domain.round.RoundState;
import com.example.wager.application.domain.round.SettlementStatus;

import lombok.RequiredArgsConstructor;

/**
 * <h1>回合資料表 (rounds)</h1>
 * <p>
 * 同時扮演結算管線的持久化佇列：state = RESOLVED 且 settlement_status 為 PENDING / FAILED_PENDING_RETRY
 * 的列，在 next_attempt_at 到期後會被 Watcher 重新發布。
 * </p>
 */
@Repository
@RequiredArgsConstructor
public class RoundRepository {

	private static final String COLUMNS = """
			round_id, player_id, session_id, house_edge_bps, state, wager, choice, commitment,
			player_nonce, house_nonce, outcome, player_won, payout, settlement_status, settlement_attempts,
			next_attempt_at, last_error, created_at, committed_at, revealed_at, settled_at, closed_at, last_activity_at
			""";

	private static final RowMapper<Round> ROW_MAPPER = RoundRepository::mapRow;

	private final JdbcTemplate jdbcTemplate;

	public void insert(Round round) {
		String sql = "INSERT INTO rounds (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
		jdbcTemplate.update(sql, round.getRoundId(), round.getPlayerId(), round.getSessionId(),
				round.getHouseEdgeBps(), round.getState().name(), round.getWager(), wire(round.getChoice()),
				hex(round.getCommitment()), hex(round.getPlayerNonce()), hex(round.getHouseNonce()),
				wire(round.getOutcome()), round.isPlayerWon(), round.getPayout(), round.getSettlementStatus().name(),
				round.getSettlementAttempts(), ts(round.getNextAttemptAt()), round.getLastError(),
				ts(round.getCreatedAt()), ts(round.getCommittedAt()), ts(round.getRevealedAt()),
				ts(round.getSettledAt()), ts(round.getClosedAt()), ts(round.getLastActivityAt()));
	}

	private static final String UPDATE_SQL = """
			UPDATE rounds SET state = ?, player_nonce = ?, house_nonce = ?, outcome = ?, player_won = ?, payout = ?,
				settlement_status = ?, settlement_attempts = ?, next_attempt_at = ?, last_error = ?,
				revealed_at = ?, settled_at = ?, closed_at = ?, last_activity_at = ?
			WHERE round_id = ?
			""";

	/**
	 * 覆寫可變欄位
	 *
	 * @return 受影響列數
	 */
	public int update(Round round) {
		return jdbcTemplate.update(UPDATE_SQL, updateArgs(round));
	}

	/**
	 * 只在資料庫中的回合仍為開放狀態時覆寫。開放回合可能同時被連線與回收任務關閉，只有一方會成功。
	 *
	 * @return 受影響列數 (0 表示回合已被其他流程關閉)
	 */
	public int updateIfOpen(Round round) {
		String sql = UPDATE_SQL.stripTrailing() + " AND state IN ('AWAITING_COMMITMENT', 'AWAITING_REVEAL')";
		return jdbcTemplate.update(sql, updateArgs(round));
	}

	/**
	 * 在結算交易內將回合標記為 SETTLED，只接受仍為 RESOLVED 的列
	 */
	public int markSettled(String roundId, Instant settledAt) {
		String sql = """
				UPDATE rounds SET state = 'SETTLED', settlement_status = 'SETTLED', settled_at = ?, closed_at = ?,
					next_attempt_at = NULL, last_error = NULL
				WHERE round_id = ? AND state = 'RESOLVED'
				""";
		Timestamp at = ts(settledAt);
		return jdbcTemplate.update(sql, at, at, roundId);
	}

	public Optional<Round> findById(String roundId) {
		List<Round> rows = jdbcTemplate.query("SELECT " + COLUMNS + " FROM rounds WHERE round_id = ?", ROW_MAPPER,
				roundId);
		return rows.stream().findFirst();
	}

	public List<Round> findRecentByPlayer(String playerId, int limit) {
		String sql = "SELECT " + COLUMNS + " FROM rounds WHERE player_id = ? ORDER BY created_at DESC LIMIT ?";
		return jdbcTemplate.query(sql, ROW_MAPPER, playerId, limit);
	}

	public List<Round> findDueForSettlement(Instant now, int limit) {
		String sql = """
				SELECT %s FROM rounds
				WHERE state = 'RESOLVED'
				  AND settlement_status IN ('PENDING', 'FAILED_PENDING_RETRY')
				  AND next_attempt_at <= ?
				ORDER BY next_attempt_at ASC
				LIMIT ?
				""".formatted(COLUMNS);
		return jdbcTemplate.query(sql, ROW_MAPPER, ts(now), limit);
	}

	/**
	 * 最後活動時間早於 cutoff 的開放回合
	 */
	public List<Round> findStaleOpen(Instant cutoff, int limit) {
		String sql = """
				SELECT %s FROM rounds
				WHERE state IN ('AWAITING_COMMITMENT', 'AWAITING_REVEAL')
				  AND last_activity_at < ?
				ORDER BY last_activity_at ASC
				LIMIT ?
				""".formatted(COLUMNS);
		return jdbcTemplate.query(sql, ROW_MAPPER, ts(cutoff), limit);
	}

	private static Object[] updateArgs(Round round) {
		return new Object[] { round.getState().name(), hex(round.getPlayerNonce()), hex(round.getHouseNonce()),
				wire(round.getOutcome()), round.isPlayerWon(), round.getPayout(), round.getSettlementStatus().name(),
				round.getSettlementAttempts(), ts(round.getNextAttemptAt()), round.getLastError(),
				ts(round.getRevealedAt()), ts(round.getSettledAt()), ts(round.getClosedAt()),
				ts(round.getLastActivityAt()), round.getRoundId() };
	}

	private static Round mapRow(ResultSet rs, int rowNum) throws SQLException {
		return Round.restore().roundId(rs.getString("round_id")).playerId(rs.getString("player_id"))
				.sessionId(rs.getString("session_id")).houseEdgeBps(rs.getInt("house_edge_bps"))
				.state(RoundState.valueOf(rs.getString("state"))).wager(rs.getLong("wager"))
				.choice(choice(rs.getString("choice"))).commitment(commitment(rs.getString("commitment")))
				.playerNonce(nonce(rs.getString("player_nonce"))).houseNonce(nonce(rs.getString("house_nonce")))
				.outcome(choice(rs.getString("outcome"))).playerWon(rs.getBoolean("player_won"))
				.payout(rs.getLong("payout"))
				.settlementStatus(SettlementStatus.valueOf(rs.getString("settlement_status")))
				.settlementAttempts(rs.getInt("settlement_attempts"))
				.nextAttemptAt(instant(rs.getTimestamp("next_attempt_at"))).lastError(rs.getString("last_error"))
				.createdAt(instant(rs.getTimestamp("created_at")))
				.committedAt(instant(rs.getTimestamp("committed_at")))
				.revealedAt(instant(rs.getTimestamp("revealed_at")))
				.settledAt(instant(rs.getTimestamp("settled_at"))).closedAt(instant(rs.getTimestamp("closed_at")))
				.lastActivityAt(instant(rs.getTimestamp("last_activity_at"))).build();
	}

	private static String wire(CoinChoice choice) {
		return choice == null ? null : choice.getWireValue();
	}

	private static String hex(Object value) {
		return value == null ? null : value.toString();
	}

	private static CoinChoice choice(String value) {
		return value == null ? null : CoinChoice.fromWire(value);
	}

	private static Commitment commitment(String value) {
		return value == null ? null : new Commitment(value);
	}

	private static Nonce nonce(String value) {
		return value == null ? null : new Nonce(value);
	}

	static Timestamp ts(Instant instant) {
		return instant == null ? null : Timestamp.from(instant);
	}

	static Instant instant(Timestamp timestamp) {
		return timestamp == null ? null : timestamp.toInstant();
	}
}
