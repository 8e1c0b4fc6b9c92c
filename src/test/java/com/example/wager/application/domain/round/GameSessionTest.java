package com.example.wager.application.domain.round;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.ValidationException;
import com.example.wager.application.domain.fairness.CoinChoice;
import com.example.wager.application.domain.fairness.FairnessPrimitives;
import com.example.wager.application.domain.fairness.Nonce;

class GameSessionTest {

	private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

	@Test
	@DisplayName("同一 Session 同時只能有一個未結束的回合")
	void secondRoundIsRejectedWhileFirstIsOpen() {
		GameSession session = new GameSession("player-1", NOW);
		session.attach(committedRound(session, Nonce.parse("0x" + "11".repeat(32))));

		assertThatThrownBy(session::ensureNoOpenRound).isInstanceOf(ValidationException.class)
				.extracting(e -> ((ValidationException) e).getCode()).isEqualTo(ErrorCode.ROUND_ALREADY_OPEN);
	}

	@Test
	@DisplayName("RESOLVED 但未交付的回合仍佔用槽位，交付後才釋放")
	void resolvedRoundHoldsSlotUntilHandedOff() {
		GameSession session = new GameSession("player-1", NOW);
		Nonce nonce = FairnessPrimitives.generateNonce();
		Round round = committedRound(session, nonce);
		session.attach(round);
		round.reveal(nonce, FairnessPrimitives::generateNonce, NOW);

		session.release();
		assertThat(session.pendingHandoff()).contains(round);
		assertThatThrownBy(session::ensureNoOpenRound).isInstanceOf(ValidationException.class);

		round.handOff(NOW);
		session.release();
		assertThat(session.getCurrentRound()).isNull();
		session.ensureNoOpenRound();
	}

	@Test
	@DisplayName("閒置超過上限的開放回合視為逾時")
	void inactivityDetection() {
		GameSession session = new GameSession("player-1", NOW);
		session.attach(committedRound(session, FairnessPrimitives.generateNonce()));

		assertThat(session.isRoundInactive(NOW.plusSeconds(30), Duration.ofSeconds(60))).isFalse();
		assertThat(session.isRoundInactive(NOW.plusSeconds(61), Duration.ofSeconds(60))).isTrue();
	}

	@Test
	@DisplayName("沒有等待揭示的回合時拒絕 reveal")
	void revealWithoutOpenRound() {
		GameSession session = new GameSession("player-1", NOW);

		assertThatThrownBy(session::requireRevealableRound).isInstanceOf(ValidationException.class)
				.extracting(e -> ((ValidationException) e).getCode()).isEqualTo(ErrorCode.NO_OPEN_ROUND);
	}

	private static Round committedRound(GameSession session, Nonce nonce) {
		Round round = Round.open(session.getPlayerId(), session.getSessionId(), 200, NOW);
		round.acceptCommitment(100L, CoinChoice.HEADS,
				FairnessPrimitives.createCommitment(100L, CoinChoice.HEADS, nonce), NOW);
		return round;
	}
}
