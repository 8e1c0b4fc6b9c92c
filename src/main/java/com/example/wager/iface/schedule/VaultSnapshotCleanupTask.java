package com.example.wager.iface.schedule;

import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.example.wager.application.service.VaultLedgerCache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 金庫快照保留期限清理
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VaultSnapshotCleanupTask {

	private final VaultLedgerCache vaultLedgerCache;

	/**
	 * Cron 表達式：秒 分 時 日 月 週 (每天凌晨 3:00)
	 */
	@Scheduled(cron = "${wager.vault.cleanup-cron:0 0 3 * * ?}")
	public void cleanupExpiredSnapshots() {
		log.info(">>> [Cleanup] 開始清理過期金庫快照...");
		try {
			int deletedRows = vaultLedgerCache.purgeExpired();
			log.info(">>> [Cleanup] 清理完成，共移除 {} 筆快照", deletedRows);
		} catch (DataAccessException e) {
			log.error(">>> [Cleanup] 清理過程發生異常: {}", e.getMessage());
		}
	}
}
