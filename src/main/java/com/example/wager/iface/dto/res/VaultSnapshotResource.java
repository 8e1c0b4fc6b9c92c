package com.example.wager.iface.dto.res;

import java.time.Instant;

import com.example.wager.application.domain.vault.VaultSnapshot;
import com.example.wager.application.domain.vault.VaultSnapshotView;

/**
 * 金庫快照，數值以十進位字串表示避免精度遺失
 */
public record VaultSnapshotResource(String totalAssets, String totalShares, String sharePrice, Instant capturedAt,
		Boolean isStale) {

	public static VaultSnapshotResource from(VaultSnapshotView view) {
		return new VaultSnapshotResource(view.totalAssets().toString(), view.totalShares().toString(),
				view.sharePrice().toPlainString(), view.capturedAt(), view.isStale());
	}

	/**
	 * 歷史資料點不帶過期旗標
	 */
	public static VaultSnapshotResource from(VaultSnapshot snapshot) {
		return new VaultSnapshotResource(snapshot.getTotalAssets().toString(), snapshot.getTotalShares().toString(),
				snapshot.getSharePrice().toPlainString(), snapshot.getCapturedAt(), null);
	}
}
