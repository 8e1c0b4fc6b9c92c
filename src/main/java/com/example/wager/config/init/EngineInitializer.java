package com.example.wager.config.init;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.example.wager.application.port.PoolLedgerPort;
import com.example.wager.application.service.VaultLedgerCache;
import com.example.wager.config.config.WagerProperties;
import com.example.wager.iface.schedule.AbandonedRoundReaper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class EngineInitializer {

	private final PoolLedgerPort poolLedger;
	private final VaultLedgerCache vaultLedgerCache;
	private final AbandonedRoundReaper abandonedRoundReaper;
	private final WagerProperties properties;

	@EventListener(ApplicationReadyEvent.class)
	public void init() {
		String poolId = properties.getPool().getId();
		log.info(">>> [系統初始化] 檢查資金池 {} 是否存在...", poolId);

		if (poolLedger.initializeIfAbsent(properties.getPool().getInitialBalance())) {
			log.warn("資金池 {} 尚未存在，已以初始餘額 {} 建立", poolId, properties.getPool().getInitialBalance());
		} else {
			log.info("資金池 {} 已存在，目前餘額 {}", poolId, poolLedger.currentBalance());
		}

		// 以資料庫中最新的快照預熱金庫快取
		vaultLedgerCache.prime();

		reclaimAbandonedRounds();
	}

	/**
	 * 上一個程序留下的開放回合全部過期並退回保留金額
	 */
	private void reclaimAbandonedRounds() {
		int batchSize = properties.getGateway().getAbandonedRoundBatchSize();
		int total = 0;
		try {
			int expired;
			do {
				expired = abandonedRoundReaper.reap();
				total += expired;
			} while (expired >= batchSize);
		} catch (DataAccessException e) {
			log.error(">>> [系統初始化] 回收開放回合失敗，交由背景任務重試 (已回收 {} 筆)", total, e);
			return;
		}
		log.info(">>> [系統初始化] 已回收 {} 個上次程序留下的開放回合", total);
	}
}
