package com.example.wager.application.domain.vault;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * 對外公開的最新快照，附帶查詢當下的過期旗標
 */
public record VaultSnapshotView(BigInteger totalAssets, BigInteger totalShares, BigDecimal sharePrice,
		Instant capturedAt, boolean isStale) {
}
