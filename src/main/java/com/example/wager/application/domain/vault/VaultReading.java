package com.example.wager.application.domain.vault;

import java.math.BigInteger;

/**
 * 從外部帳本 (金庫合約) 讀到的原始數值
 *
 * @param totalAssets 資金池總資產 (asset 最小單位)
 * @param totalShares 流通中的份額總量 (share 最小單位)
 * @param blockNumber 讀取時的區塊高度，未知時為 null
 */
public record VaultReading(BigInteger totalAssets, BigInteger totalShares, BigInteger blockNumber) {

	public VaultReading {
		if (totalAssets == null || totalShares == null || totalAssets.signum() < 0 || totalShares.signum() < 0) {
			throw new IllegalArgumentException("金庫數值不可為空或負數");
		}
	}
}
