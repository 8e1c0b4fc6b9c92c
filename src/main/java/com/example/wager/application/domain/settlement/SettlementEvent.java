package com.example.wager.application.domain.settlement;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 作為結算 Disruptor 的 Event 載體
 *
 * <p>
 * RingBuffer 會重複使用同一批實例，因此發布時必須覆寫全部欄位。 真正的回合資料以資料庫為準，載體只攜帶識別與日誌需要的資訊。
 * </p>
 */
@Data
@NoArgsConstructor
public class SettlementEvent {

	private String roundId; // 冪等鍵

	private String playerId; // 派彩收款人

	private long payout; // 交付時的派彩金額 (僅供日誌，實際以重新推導為準)

	private String source; // GATEWAY / WATCHER

	private SettlementOutcome outcome; // 由 SettlementHandler 填入

	private String detail; // 失敗原因或補充說明

	public void reset(String roundId, String playerId, long payout, String source) {
		this.roundId = roundId;
		this.playerId = playerId;
		this.payout = payout;
		this.source = source;
		this.outcome = null;
		this.detail = null;
	}
}
