package com.example.wager.application.domain.vault;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * 金庫快照 (Vault Snapshot)
 *
 * <p>
 * 份額價格 = (totalAssets / 10^assetDecimals) / (totalShares / 10^shareDecimals)。 asset 與 share
 * 的精度可能不同，必須先各自換算為標準單位再相除；總份額為 0 時價格定義為面額 1.0。
 * </p>
 */
@Data
@Builder
@AllArgsConstructor
public class VaultSnapshot {

	/**
	 * 價格計算保留的小數位數
	 */
	public static final int PRICE_SCALE = 18;

	/**
	 * 無份額時的面額價格
	 */
	public static final BigDecimal PAR_PRICE = BigDecimal.ONE.setScale(PRICE_SCALE);

	private Long id;
	private BigInteger totalAssets;
	private BigInteger totalShares;
	private int assetDecimals;
	private int shareDecimals;
	private BigDecimal sharePrice;
	private BigInteger blockNumber;
	private Instant capturedAt;

	/**
	 * 由帳本讀數建立快照並計算份額價格
	 */
	public static VaultSnapshot capture(VaultReading reading, int assetDecimals, int shareDecimals,
			Instant capturedAt) {
		return VaultSnapshot.builder().totalAssets(reading.totalAssets()).totalShares(reading.totalShares())
				.assetDecimals(assetDecimals).shareDecimals(shareDecimals)
				.sharePrice(computeSharePrice(reading.totalAssets(), reading.totalShares(), assetDecimals,
						shareDecimals))
				.blockNumber(reading.blockNumber()).capturedAt(capturedAt).build();
	}

	public static BigDecimal computeSharePrice(BigInteger totalAssets, BigInteger totalShares, int assetDecimals,
			int shareDecimals) {
		if (totalShares.signum() == 0) {
			return PAR_PRICE;
		}
		BigDecimal assets = new BigDecimal(totalAssets, assetDecimals);
		BigDecimal shares = new BigDecimal(totalShares, shareDecimals);
		return assets.divide(shares, PRICE_SCALE, RoundingMode.DOWN);
	}

	public boolean isStale(Instant now, Duration threshold) {
		return capturedAt.plus(threshold).isBefore(now);
	}

	/**
	 * 與上一份快照相比是否值得寫入資料庫
	 *
	 * @param previous             上一份已持久化的快照，可為 null
	 * @param priceChangeThreshold 相對價格變化門檻 (例如 0.0001 = 0.01%)
	 * @param minInterval          即使數值不變，超過此間隔也要寫入
	 */
	public boolean differsMeaningfullyFrom(VaultSnapshot previous, BigDecimal priceChangeThreshold,
			Duration minInterval) {
		if (previous == null) {
			return true;
		}
		if (!totalAssets.equals(previous.getTotalAssets())) {
			return true;
		}
		if (previous.getSharePrice().signum() != 0) {
			BigDecimal change = sharePrice.subtract(previous.getSharePrice()).abs()
					.divide(previous.getSharePrice(), PRICE_SCALE, RoundingMode.HALF_UP);
			if (change.compareTo(priceChangeThreshold) > 0) {
				return true;
			}
		}
		return previous.getCapturedAt().plus(minInterval).isBefore(capturedAt);
	}
}
