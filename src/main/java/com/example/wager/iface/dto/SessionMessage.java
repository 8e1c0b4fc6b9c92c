package com.example.wager.iface.dto;

import java.time.Instant;
import java.util.Map;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.round.Round;

/**
 * 推送給玩家的訊息 {type, payload}。金額一律以十進位字串表示。
 */
public record SessionMessage(String type, Object payload) {

	public static SessionMessage connected(String playerId, Instant serverTime) {
		return new SessionMessage("connected", new Connected(playerId, serverTime.toString()));
	}

	public static SessionMessage committed(Round round) {
		return new SessionMessage("committed", new Committed(round.getRoundId(), String.valueOf(round.getWager()),
				round.getChoice().getWireValue()));
	}

	public static SessionMessage resolved(Round round) {
		return new SessionMessage("resolved",
				new Resolved(round.getRoundId(), round.getOutcome().getWireValue(), String.valueOf(round.getPayout()),
						round.isPlayerWon(), round.getPlayerNonce().hex(), round.getHouseNonce().hex()));
	}

	public static SessionMessage voided(String roundId, ErrorCode code, String message) {
		return new SessionMessage("voided", new Voided(roundId, code.name(), message));
	}

	public static SessionMessage expired(String roundId, String reason) {
		return new SessionMessage("expired", new Expired(roundId, reason));
	}

	public static SessionMessage error(ErrorCode code, String message) {
		return new SessionMessage("error", new Error(code.name(), message));
	}

	public static SessionMessage pong() {
		return new SessionMessage("pong", Map.of());
	}

	public record Connected(String playerId, String serverTime) {
	}

	public record Committed(String roundId, String wager, String choice) {
	}

	public record Resolved(String roundId, String outcome, String payout, boolean playerWon, String playerNonce,
			String houseNonce) {
	}

	public record Voided(String roundId, String code, String message) {
	}

	public record Expired(String roundId, String reason) {
	}

	public record Error(String code, String message) {
	}
}
