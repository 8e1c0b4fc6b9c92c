package com.example.wager.application.port;

import com.example.wager.application.domain.vault.VaultReading;

/**
 * 外部託管帳本 (金庫合約) 的唯讀查詢介面
 */
public interface VaultLedgerPort {

	/**
	 * @throws com.example.wager.application.domain.error.TransientInfrastructureException 讀取失敗
	 */
	VaultReading fetch();
}
