package com.example.wager.application.domain.round;

import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.FairnessViolationException;
import com.example.wager.application.domain.error.ValidationException;
import com.example.wager.application.domain.fairness.CoinChoice;
import com.example.wager.application.domain.fairness.Commitment;
import com.example.wager.application.domain.fairness.FairnessPrimitives;
import com.example.wager.application.domain.fairness.Nonce;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 回合聚合根 (Round Aggregate)
 *
 * <p>
 * 封裝單一下注的狀態機。所有狀態轉換都必須經過此類別的方法，呼叫端無法跳過任何一步：
 * <ul>
 * <li>莊家 nonce 只會在 {@link #reveal} 中、且承諾已被接受後才產生</li>
 * <li>只有通過承諾驗證的回合才能進入 RESOLVED</li>
 * <li>只有 RESOLVED 的回合才能進入 SETTLED</li>
 * </ul>
 * 回合一旦 RESOLVED 即不可變，唯一會繼續前進的是 {@link SettlementStatus}。
 * </p>
 */
@Getter
@Builder(builderMethodName = "restore")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Round {

	/**
	 * last_error 欄位長度上限
	 */
	public static final int MAX_ERROR_LENGTH = 512;

	private final String roundId;
	private final String playerId;
	private final String sessionId;
	private final int houseEdgeBps;

	private RoundState state;

	private long wager;
	private CoinChoice choice;
	private Commitment commitment;

	private Nonce playerNonce;
	private Nonce houseNonce;
	private CoinChoice outcome;
	private boolean playerWon;
	private long payout;

	@Builder.Default
	private SettlementStatus settlementStatus = SettlementStatus.NONE;
	private int settlementAttempts;
	private Instant nextAttemptAt;
	private String lastError;

	private Instant createdAt;
	private Instant committedAt;
	private Instant revealedAt;
	private Instant settledAt;
	private Instant closedAt;
	private Instant lastActivityAt;

	/**
	 * 開啟一個新回合，狀態為 AWAITING_COMMITMENT
	 */
	public static Round open(String playerId, String sessionId, int houseEdgeBps, Instant now) {
		return Round.restore().roundId(UUID.randomUUID().toString()).playerId(playerId).sessionId(sessionId)
				.houseEdgeBps(houseEdgeBps).state(RoundState.AWAITING_COMMITMENT).createdAt(now).lastActivityAt(now)
				.build();
	}

	/**
	 * AWAITING_COMMITMENT --submitCommitment--> AWAITING_REVEAL
	 *
	 * @throws ValidationException 金額非正數
	 */
	public void acceptCommitment(long wager, CoinChoice choice, Commitment commitment, Instant now) {
		requireState(RoundState.AWAITING_COMMITMENT);
		if (wager <= 0) {
			throw new ValidationException(ErrorCode.INVALID_WAGER, "下注金額必須為正數: " + wager);
		}
		if (choice == null || commitment == null) {
			throw new ValidationException(ErrorCode.INVALID_MESSAGE, "缺少選項或承諾");
		}
		this.wager = wager;
		this.choice = choice;
		this.commitment = commitment;
		this.committedAt = now;
		this.lastActivityAt = now;
		this.state = RoundState.AWAITING_REVEAL;
	}

	/**
	 * AWAITING_REVEAL --reveal--> RESOLVED (或 VOIDED)
	 *
	 * <pre>
	 * 1. 產生莊家 nonce (此時承諾已經鎖定)
	 * 2. 以玩家揭示的 nonce 驗證承諾
	 * 3. 推導結果並計算派彩
	 * </pre>
	 *
	 * @param revealedNonce    玩家揭示的 nonce
	 * @param houseNonceSource 莊家 nonce 來源
	 * @throws FairnessViolationException 承諾驗證失敗，回合已轉為 VOIDED
	 */
	public void reveal(Nonce revealedNonce, Supplier<Nonce> houseNonceSource, Instant now) {
		requireState(RoundState.AWAITING_REVEAL);
		this.houseNonce = houseNonceSource.get();
		this.playerNonce = revealedNonce;
		this.revealedAt = now;
		this.lastActivityAt = now;

		if (!FairnessPrimitives.verifyCommitment(commitment, wager, choice, revealedNonce)) {
			this.state = RoundState.VOIDED;
			this.closedAt = now;
			throw new FairnessViolationException(roundId, "揭示的 nonce 與承諾不符，回合作廢");
		}

		this.outcome = FairnessPrimitives.deriveResult(revealedNonce, houseNonce);
		this.playerWon = outcome == choice;
		this.payout = FairnessPrimitives.calculatePayout(wager, playerWon, houseEdgeBps);
		this.state = RoundState.RESOLVED;
	}

	/**
	 * 開放中的回合因逾時或斷線而過期
	 */
	public void expire(Instant now, String reason) {
		if (!state.isOpen()) {
			throw new IllegalStateException("回合 " + roundId + " 狀態為 " + state + "，無法過期");
		}
		this.state = RoundState.EXPIRED;
		this.lastError = truncate(reason);
		this.closedAt = now;
	}

	/**
	 * RESOLVED 回合交付結算管線 (已寫入持久化佇列)
	 */
	public void handOff(Instant firstAttemptAt) {
		requireState(RoundState.RESOLVED);
		if (settlementStatus == SettlementStatus.NONE) {
			this.settlementStatus = SettlementStatus.PENDING;
			this.nextAttemptAt = firstAttemptAt;
		}
	}

	/**
	 * 持久化佇列寫入失敗時撤回交付，回合留在 Session 上等待重新交付
	 */
	public void abortHandOff() {
		requireState(RoundState.RESOLVED);
		if (settlementStatus == SettlementStatus.PENDING && settlementAttempts == 0) {
			this.settlementStatus = SettlementStatus.NONE;
			this.nextAttemptAt = null;
		}
	}

	/**
	 * RESOLVED --settle--> SETTLED
	 */
	public void markSettled(Instant now) {
		requireState(RoundState.RESOLVED);
		this.state = RoundState.SETTLED;
		this.settlementStatus = SettlementStatus.SETTLED;
		this.settledAt = now;
		this.closedAt = now;
		this.lastError = null;
		this.nextAttemptAt = null;
	}

	/**
	 * 記錄一次結算失敗。嘗試次數達上限時升級為人工介入，不會自動沖銷已承諾的派彩。
	 */
	public void recordSettlementFailure(String error, Instant retryAt, boolean exhausted) {
		requireState(RoundState.RESOLVED);
		this.settlementAttempts++;
		this.lastError = truncate(error);
		if (exhausted) {
			this.settlementStatus = SettlementStatus.MANUAL_INTERVENTION;
			this.nextAttemptAt = null;
		} else {
			this.settlementStatus = SettlementStatus.FAILED_PENDING_RETRY;
			this.nextAttemptAt = retryAt;
		}
	}

	/**
	 * 稽核不符等不可重試的情況，直接升級為人工介入
	 */
	public void escalate(String error) {
		requireState(RoundState.RESOLVED);
		this.settlementStatus = SettlementStatus.MANUAL_INTERVENTION;
		this.lastError = truncate(error);
		this.nextAttemptAt = null;
	}

	public boolean isHandedOff() {
		return settlementStatus != SettlementStatus.NONE;
	}

	/**
	 * 淨流出 = 派彩 - 下注 (正值代表資金池需要付出)
	 */
	public long netPoolOutflow() {
		return payout - wager;
	}

	private static String truncate(String error) {
		if (error == null || error.length() <= MAX_ERROR_LENGTH) {
			return error;
		}
		return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
	}

	private void requireState(RoundState expected) {
		if (state != expected) {
			throw new IllegalStateException("回合 " + roundId + " 狀態為 " + state + "，預期為 " + expected);
		}
	}
}
