package com.example.wager.application.shared.dto;

import java.util.List;

import com.example.wager.application.domain.round.RoundAuditEvent;

/**
 * 結算狀態查詢回應 DTO
 */
public record SettlementStatusGettenData(String roundId, String playerId, String state, String settlementStatus,
		int attempts, String payout, String lastError, List<RoundAuditEvent> history) {
}
