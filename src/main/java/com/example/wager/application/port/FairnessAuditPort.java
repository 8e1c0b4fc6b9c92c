package com.example.wager.application.port;

import java.util.List;

import com.example.wager.application.domain.round.RoundAuditEvent;

/**
 * 公平性稽核日誌 Port
 */
public interface FairnessAuditPort {

	/**
	 * 追加一筆稽核事件。失敗時僅記錄日誌，不得阻斷遊戲流程。
	 */
	void record(RoundAuditEvent event);

	/**
	 * 批次追加 (結算 Journal 於每批結束時呼叫)
	 */
	default void recordAll(List<RoundAuditEvent> events) {
		events.forEach(this::record);
	}

	/**
	 * 取得單一回合的所有稽核事件 (依時間排序)
	 */
	List<RoundAuditEvent> findByRound(String roundId);
}
