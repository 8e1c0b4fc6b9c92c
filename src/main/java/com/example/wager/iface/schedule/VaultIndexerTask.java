package com.example.wager.iface.schedule;

import java.time.Duration;

import org.springframework.stereotype.Component;

import com.example.wager.application.service.VaultLedgerCache;
import com.example.wager.config.config.WagerProperties;

import lombok.RequiredArgsConstructor;

/**
 * 金庫索引：固定間隔向金庫合約拉取 totalAssets / totalSupply 並更新快取
 */
@Component
@RequiredArgsConstructor
public class VaultIndexerTask implements SupervisedTask {

	private final VaultLedgerCache vaultLedgerCache;
	private final WagerProperties properties;

	@Override
	public String name() {
		return "vault-indexer";
	}

	@Override
	public Duration interval() {
		return properties.getVault().getRefreshInterval();
	}

	@Override
	public void runOnce() {
		vaultLedgerCache.refresh();
	}
}
