package com.example.wager.iface.dto.res;

import java.time.Instant;

import com.example.wager.application.domain.fairness.CoinChoice;
import com.example.wager.application.domain.round.Round;

/**
 * 回合歷史的一筆紀錄，包含事後稽核所需的承諾與雙方 nonce
 */
public record RoundSummaryResource(String roundId, String state, String settlementStatus, String wager,
		String choice, String outcome, Boolean playerWon, String payout, String commitment, String playerNonce,
		String houseNonce, Instant createdAt, Instant settledAt) {

	public static RoundSummaryResource from(Round round) {
		boolean revealed = round.getOutcome() != null;
		return new RoundSummaryResource(round.getRoundId(), round.getState().name(),
				round.getSettlementStatus().name(), String.valueOf(round.getWager()), wire(round.getChoice()),
				wire(round.getOutcome()), revealed ? round.isPlayerWon() : null,
				revealed ? String.valueOf(round.getPayout()) : null, text(round.getCommitment()),
				text(round.getPlayerNonce()), text(round.getHouseNonce()), round.getCreatedAt(), round.getSettledAt());
	}

	private static String wire(CoinChoice choice) {
		return choice == null ? null : choice.getWireValue();
	}

	private static String text(Object value) {
		return value == null ? null : value.toString();
	}
}
