package com.example.wager.application.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.example.wager.application.domain.error.TransientInfrastructureException;
import com.example.wager.application.domain.vault.VaultReading;
import com.example.wager.application.domain.vault.VaultSnapshot;
import com.example.wager.application.domain.vault.VaultSnapshotView;
import com.example.wager.application.port.VaultLedgerPort;
import com.example.wager.application.port.VaultSnapshotRepositoryPort;
import com.example.wager.config.config.WagerProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 金庫帳本快取 (Vault Ledger Cache)
 *
 * <p>
 * 唯一能修改金庫快照狀態的元件。由背景任務定期呼叫 {@link #refresh()}：
 * <ul>
 * <li>讀取失敗時保留最後一份成功的快照 (stale-but-available)，不阻塞下游</li>
 * <li>記憶體中的最新快照每次成功都會更新，資料庫只在數值有意義地變動時才寫入</li>
 * <li>查詢時依當下時間判斷是否過期，結算管線據此決定是否信任</li>
 * </ul>
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VaultLedgerCache {

	/**
	 * 歷史查詢回傳的最大點數
	 */
	public static final int MAX_HISTORY_POINTS = 168;

	private final VaultLedgerPort vaultLedger;
	private final VaultSnapshotRepositoryPort snapshotRepository;
	private final WagerProperties properties;
	private final Clock clock;

	private final Deque<VaultSnapshot> history = new ArrayDeque<>();

	private volatile VaultSnapshot latest;
	private VaultSnapshot lastPersisted;

	/**
	 * 啟動時以資料庫中最新的快照預熱
	 */
	public synchronized void prime() {
		if (latest != null) {
			return;
		}
		snapshotRepository.findLatest().ifPresent(snapshot -> {
			this.latest = snapshot;
			this.lastPersisted = snapshot;
			history.addLast(snapshot);
			log.info(">>> [Vault] 以既有快照預熱 (CapturedAt: {}, SharePrice: {})", snapshot.getCapturedAt(),
					snapshot.getSharePrice());
		});
	}

	/**
	 * 向外部帳本讀取一次並更新快取
	 *
	 * @return 本次產生的快照；讀取失敗時為空，並保留上一份快照
	 */
	public synchronized Optional<VaultSnapshot> refresh() {
		VaultReading reading;
		try {
			reading = vaultLedger.fetch();
		} catch (TransientInfrastructureException e) {
			log.warn(">>> [Vault] 帳本讀取失敗，保留上一份快照: {}", e.getMessage());
			return Optional.empty();
		}

		WagerProperties.Vault config = properties.getVault();
		VaultSnapshot snapshot = VaultSnapshot.capture(reading, config.getAssetDecimals(), config.getShareDecimals(),
				clock.instant());
		this.latest = snapshot;
		history.addLast(snapshot);
		while (history.size() > config.getHistorySize()) {
			history.removeFirst();
		}

		if (snapshot.differsMeaningfullyFrom(lastPersisted, config.getPriceChangeThreshold(),
				config.getMinPersistInterval())) {
			try {
				snapshotRepository.save(snapshot);
				this.lastPersisted = snapshot;
				log.debug(">>> [Vault] 快照已寫入 (TotalAssets: {}, SharePrice: {})", snapshot.getTotalAssets(),
						snapshot.getSharePrice());
			} catch (DataAccessException e) {
				log.warn(">>> [Vault] 快照寫入失敗，下次更新時重試: {}", e.getMessage());
			}
		}
		return Optional.of(snapshot);
	}

	/**
	 * 最新快照與查詢當下的過期旗標
	 */
	public Optional<VaultSnapshotView> latestSnapshot() {
		VaultSnapshot current = latest;
		if (current == null) {
			return Optional.empty();
		}
		return Optional.of(new VaultSnapshotView(current.getTotalAssets(), current.getTotalShares(),
				current.getSharePrice(), current.getCapturedAt(), isStale(current)));
	}

	/**
	 * 只回傳未過期的快照，供結算時的償付能力檢查使用
	 */
	public Optional<VaultSnapshot> freshSnapshot() {
		VaultSnapshot current = latest;
		return current == null || isStale(current) ? Optional.empty() : Optional.of(current);
	}

	/**
	 * 記憶體中的近期快照，由舊到新
	 */
	public synchronized List<VaultSnapshot> recentHistory() {
		return new ArrayList<>(history);
	}

	/**
	 * 指定期間內已持久化的快照，超過 {@link #MAX_HISTORY_POINTS} 點時等距抽樣
	 */
	public List<VaultSnapshot> history(Duration period) {
		List<VaultSnapshot> rows = snapshotRepository.findSince(clock.instant().minus(period));
		return downsample(rows, MAX_HISTORY_POINTS);
	}

	static List<VaultSnapshot> downsample(List<VaultSnapshot> rows, int maxPoints) {
		if (rows.size() <= maxPoints) {
			return rows;
		}
		List<VaultSnapshot> sampled = new ArrayList<>(maxPoints);
		for (int i = 0; i < maxPoints - 1; i++) {
			sampled.add(rows.get((int) ((long) i * (rows.size() - 1) / (maxPoints - 1))));
		}
		// 最後一點一律保留
		sampled.add(rows.get(rows.size() - 1));
		return sampled;
	}

	/**
	 * 刪除保留期限之前的快照
	 */
	public int purgeExpired() {
		Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getVault().getRetentionDays()));
		return snapshotRepository.deleteOlderThan(cutoff);
	}

	private boolean isStale(VaultSnapshot snapshot) {
		return snapshot.isStale(clock.instant(), properties.getVault().getStalenessThreshold());
	}
}
