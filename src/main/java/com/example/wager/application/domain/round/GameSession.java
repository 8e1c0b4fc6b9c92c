package com.example.wager.application.domain.round;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.ValidationException;

import lombok.Getter;

/**
 * 玩家連線的 Session 狀態
 *
 * <p>
 * 一條連線對應一個 GameSession，由該連線的單一處理任務獨佔修改 (見 SessionMailbox)。 同一時間最多只有一個「未結束」的回合：
 * <ul>
 * <li>開放中的回合 (AWAITING_COMMITMENT / AWAITING_REVEAL)</li>
 * <li>已 RESOLVED 但尚未寫入結算佇列的回合</li>
 * </ul>
 * 第二次 submitCommitment 會被拒絕，不會排隊。
 * </p>
 */
@Getter
public class GameSession {

	private final String sessionId;
	private final String playerId;
	private final Instant connectedAt;

	private Round currentRound;

	public GameSession(String playerId, Instant connectedAt) {
		this.sessionId = UUID.randomUUID().toString();
		this.playerId = playerId;
		this.connectedAt = connectedAt;
	}

	/**
	 * 確認目前沒有未結束的回合
	 *
	 * @throws ValidationException 已有回合進行中
	 */
	public void ensureNoOpenRound() {
		if (currentRound != null && !isClosed(currentRound)) {
			throw new ValidationException(ErrorCode.ROUND_ALREADY_OPEN, "回合 " + currentRound.getRoundId() + " 尚未結束");
		}
	}

	/**
	 * 附掛一個已被持久化確認的新回合
	 */
	public void attach(Round round) {
		ensureNoOpenRound();
		if (!round.getPlayerId().equals(playerId)) {
			throw new IllegalArgumentException("回合玩家與 Session 玩家不一致");
		}
		this.currentRound = round;
	}

	/**
	 * 取得等待揭示的回合
	 */
	public Round requireRevealableRound() {
		if (currentRound == null || currentRound.getState() != RoundState.AWAITING_REVEAL) {
			throw new ValidationException(ErrorCode.NO_OPEN_ROUND, "沒有等待揭示的回合");
		}
		return currentRound;
	}

	/**
	 * 開放中的回合 (尚未揭示)
	 */
	public Optional<Round> openRound() {
		return Optional.ofNullable(currentRound).filter(r -> r.getState().isOpen());
	}

	/**
	 * 已 RESOLVED 但尚未交付結算的回合，斷線時必須先交付才能丟棄 Session
	 */
	public Optional<Round> pendingHandoff() {
		return Optional.ofNullable(currentRound)
				.filter(r -> r.getState() == RoundState.RESOLVED && !r.isHandedOff());
	}

	/**
	 * 判斷開放中的回合是否已閒置超過上限
	 */
	public boolean isRoundInactive(Instant now, Duration inactivityWindow) {
		return openRound().map(r -> r.getLastActivityAt().plus(inactivityWindow).isBefore(now)).orElse(false);
	}

	/**
	 * 回合已到終態或已交付結算，釋放 Session 的回合槽位
	 */
	public void release() {
		if (currentRound != null && isClosed(currentRound)) {
			this.currentRound = null;
		}
	}

	private boolean isClosed(Round round) {
		return round.getState().isTerminal() || round.isHandedOff();
	}
}
