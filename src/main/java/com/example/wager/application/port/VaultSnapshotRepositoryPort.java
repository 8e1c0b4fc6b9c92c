package com.example.wager.application.port;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.example.wager.application.domain.vault.VaultSnapshot;

/**
 * 金庫快照儲存埠
 */
public interface VaultSnapshotRepositoryPort {

	void save(VaultSnapshot snapshot);

	Optional<VaultSnapshot> findLatest();

	/**
	 * 指定時間之後的快照，依時間由舊到新
	 */
	List<VaultSnapshot> findSince(Instant since);

	/**
	 * 清理過舊的快照
	 *
	 * @return 刪除筆數
	 */
	int deleteOlderThan(Instant cutoff);
}
