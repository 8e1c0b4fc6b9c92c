package com.example.wager.application.domain.round;

import java.time.Instant;

/**
 * 公平性稽核事件：回合生命週期中的每一個事實都會留下一筆
 *
 * @param roundId    回合 ID
 * @param playerId   玩家
 * @param type       事件類型
 * @param detail     補充資訊 (承諾、nonce、結果、錯誤原因等)
 * @param recordedAt 發生時間
 */
public record RoundAuditEvent(String roundId, String playerId, AuditEventType type, String detail,
		Instant recordedAt) {

	public static RoundAuditEvent of(Round round, AuditEventType type, String detail, Instant now) {
		return new RoundAuditEvent(round.getRoundId(), round.getPlayerId(), type, detail, now);
	}
}
