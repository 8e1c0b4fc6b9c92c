package com.example.wager.application.domain.round;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.wager.application.domain.error.FairnessViolationException;
import com.example.wager.application.domain.error.ValidationException;
import com.example.wager.application.domain.fairness.CoinChoice;
import com.example.wager.application.domain.fairness.Commitment;
import com.example.wager.application.domain.fairness.FairnessPrimitives;
import com.example.wager.application.domain.fairness.Nonce;

/**
 * <h1>回合狀態機測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 回合只能沿著 AWAITING_COMMITMENT → AWAITING_REVEAL → RESOLVED → SETTLED 前進。
 * <b>Given</b> 一個剛開啟的回合
 * <b>When</b>  依序接受承諾、揭示、交付與結算
 * <b>Then</b>  每一步的狀態與欄位都正確，任何越級轉換都被拒絕
 * </pre>
 */
class RoundTest {

	private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

	@Test
	@DisplayName("完整生命週期：承諾、揭示、交付、結算")
	void fullLifecycle() {
		Nonce playerNonce = FairnessPrimitives.generateNonce();
		Nonce houseNonce = FairnessPrimitives.generateNonce();
		Commitment commitment = FairnessPrimitives.createCommitment(1_000L, CoinChoice.HEADS, playerNonce);

		Round round = Round.open("player-1", "session-1", 200, NOW);
		assertThat(round.getState()).isEqualTo(RoundState.AWAITING_COMMITMENT);
		assertThat(round.getHouseNonce()).isNull();

		round.acceptCommitment(1_000L, CoinChoice.HEADS, commitment, NOW);
		assertThat(round.getState()).isEqualTo(RoundState.AWAITING_REVEAL);
		assertThat(round.getHouseNonce()).isNull();

		round.reveal(playerNonce, () -> houseNonce, NOW.plusSeconds(1));
		CoinChoice expected = FairnessPrimitives.deriveResult(playerNonce, houseNonce);
		assertThat(round.getState()).isEqualTo(RoundState.RESOLVED);
		assertThat(round.getOutcome()).isEqualTo(expected);
		assertThat(round.isPlayerWon()).isEqualTo(expected == CoinChoice.HEADS);
		assertThat(round.getPayout()).isEqualTo(round.isPlayerWon() ? 1_960L : 0L);

		round.handOff(NOW.plusSeconds(30));
		assertThat(round.getSettlementStatus()).isEqualTo(SettlementStatus.PENDING);
		assertThat(round.isHandedOff()).isTrue();

		round.markSettled(NOW.plusSeconds(2));
		assertThat(round.getState()).isEqualTo(RoundState.SETTLED);
		assertThat(round.getSettlementStatus()).isEqualTo(SettlementStatus.SETTLED);
		assertThat(round.getNextAttemptAt()).isNull();
	}

	@Test
	@DisplayName("揭示的 nonce 不符時回合作廢，仍會留下莊家 nonce 供稽核")
	void mismatchedRevealVoidsRound() {
		Nonce playerNonce = FairnessPrimitives.generateNonce();
		Round round = Round.open("player-1", "session-1", 200, NOW);
		round.acceptCommitment(1_000L, CoinChoice.TAILS,
				FairnessPrimitives.createCommitment(1_000L, CoinChoice.TAILS, playerNonce), NOW);

		assertThatThrownBy(() -> round.reveal(FairnessPrimitives.generateNonce(), FairnessPrimitives::generateNonce,
				NOW)).isInstanceOf(FairnessViolationException.class);

		assertThat(round.getState()).isEqualTo(RoundState.VOIDED);
		assertThat(round.getOutcome()).isNull();
		assertThat(round.getHouseNonce()).isNotNull();
		assertThat(round.getClosedAt()).isEqualTo(NOW);
	}

	@Test
	@DisplayName("越級轉換被拒絕")
	void illegalTransitionsAreRejected() {
		Round round = Round.open("player-1", "session-1", 200, NOW);

		assertThatThrownBy(() -> round.reveal(FairnessPrimitives.generateNonce(), FairnessPrimitives::generateNonce,
				NOW)).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> round.markSettled(NOW)).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> round.acceptCommitment(0L, CoinChoice.HEADS,
				FairnessPrimitives.createCommitment(0L, CoinChoice.HEADS, FairnessPrimitives.generateNonce()), NOW))
				.isInstanceOf(ValidationException.class);

		round.expire(NOW, "INACTIVITY");
		assertThat(round.getState()).isEqualTo(RoundState.EXPIRED);
		assertThatThrownBy(() -> round.expire(NOW, "DISCONNECT")).isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("結算失敗依序排定重試，次數用盡後升級人工介入")
	void settlementFailuresEscalate() {
		Round round = resolvedRound();
		round.handOff(NOW);

		round.recordSettlementFailure("INSUFFICIENT_LIQUIDITY", NOW.plusSeconds(2), false);
		assertThat(round.getSettlementStatus()).isEqualTo(SettlementStatus.FAILED_PENDING_RETRY);
		assertThat(round.getSettlementAttempts()).isEqualTo(1);
		assertThat(round.getNextAttemptAt()).isEqualTo(NOW.plusSeconds(2));

		round.recordSettlementFailure("INSUFFICIENT_LIQUIDITY", null, true);
		assertThat(round.getSettlementStatus()).isEqualTo(SettlementStatus.MANUAL_INTERVENTION);
		assertThat(round.getState()).isEqualTo(RoundState.RESOLVED);
		assertThat(round.getNextAttemptAt()).isNull();
	}

	@Test
	@DisplayName("過長的錯誤訊息截斷至欄位上限，嘗試次數照常累計")
	void longSettlementErrorIsTruncated() {
		Round round = resolvedRound();
		round.handOff(NOW);

		round.recordSettlementFailure("INFRASTRUCTURE_ERROR: " + "x".repeat(2_000), NOW.plusSeconds(2), false);

		assertThat(round.getLastError()).hasSize(Round.MAX_ERROR_LENGTH).startsWith("INFRASTRUCTURE_ERROR: ")
				.endsWith("...");
		assertThat(round.getSettlementAttempts()).isEqualTo(1);

		round.escalate("稽核不符: " + "y".repeat(1_000));
		assertThat(round.getLastError()).hasSize(Round.MAX_ERROR_LENGTH);
	}

	@Test
	@DisplayName("持久化失敗時撤回交付，讓回合可以重新交付")
	void abortHandOffRestoresPendingSlot() {
		Round round = resolvedRound();
		round.handOff(NOW);

		round.abortHandOff();

		assertThat(round.getSettlementStatus()).isEqualTo(SettlementStatus.NONE);
		assertThat(round.isHandedOff()).isFalse();
	}

	private static Round resolvedRound() {
		Nonce playerNonce = FairnessPrimitives.generateNonce();
		Round round = Round.open("player-1", "session-1", 200, NOW);
		round.acceptCommitment(1_000L, CoinChoice.HEADS,
				FairnessPrimitives.createCommitment(1_000L, CoinChoice.HEADS, playerNonce), NOW);
		round.reveal(playerNonce, FairnessPrimitives::generateNonce, NOW);
		return round;
	}
}
