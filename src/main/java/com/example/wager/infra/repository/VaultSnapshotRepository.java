package com.example.wager.infra.repository;

import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.wager.application.domain.vault.VaultSnapshot;

import lombok.RequiredArgsConstructor;

/**
 * 金庫快照資料表 (vault_snapshots)
 * <p>
 * total_assets / total_shares 可能超過 BIGINT 範圍，以十進位字串保存。
 * </p>
 */
@Repository
@RequiredArgsConstructor
public class VaultSnapshotRepository {

	private static final String COLUMNS = "id, total_assets, total_shares, asset_decimals, share_decimals, share_price, block_number, captured_at";

	private final JdbcTemplate jdbcTemplate;

	public void save(VaultSnapshot snapshot) {
		String sql = """
				INSERT INTO vault_snapshots (total_assets, total_shares, asset_decimals, share_decimals, share_price, block_number, captured_at)
				VALUES (?, ?, ?, ?, ?, ?, ?)
				""";
		jdbcTemplate.update(sql, snapshot.getTotalAssets().toString(), snapshot.getTotalShares().toString(),
				snapshot.getAssetDecimals(), snapshot.getShareDecimals(), snapshot.getSharePrice(),
				snapshot.getBlockNumber() == null ? null : snapshot.getBlockNumber().toString(),
				Timestamp.from(snapshot.getCapturedAt()));
	}

	public Optional<VaultSnapshot> findLatest() {
		List<VaultSnapshot> rows = jdbcTemplate.query(
				"SELECT " + COLUMNS + " FROM vault_snapshots ORDER BY captured_at DESC, id DESC LIMIT 1",
				VaultSnapshotRepository::mapRow);
		return rows.stream().findFirst();
	}

	public List<VaultSnapshot> findSince(Instant since) {
		return jdbcTemplate.query(
				"SELECT " + COLUMNS + " FROM vault_snapshots WHERE captured_at >= ? ORDER BY captured_at ASC, id ASC",
				VaultSnapshotRepository::mapRow, Timestamp.from(since));
	}

	public int deleteOlderThan(Instant cutoff) {
		return jdbcTemplate.update("DELETE FROM vault_snapshots WHERE captured_at < ?", Timestamp.from(cutoff));
	}

	private static VaultSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
		String blockNumber = rs.getString("block_number");
		return VaultSnapshot.builder().id(rs.getLong("id")).totalAssets(new BigInteger(rs.getString("total_assets")))
				.totalShares(new BigInteger(rs.getString("total_shares"))).assetDecimals(rs.getInt("asset_decimals"))
				.shareDecimals(rs.getInt("share_decimals"))
				.sharePrice(rs.getBigDecimal("share_price").setScale(VaultSnapshot.PRICE_SCALE))
				.blockNumber(blockNumber == null ? null : new BigInteger(blockNumber))
				.capturedAt(rs.getTimestamp("captured_at").toInstant()).build();
	}
}
