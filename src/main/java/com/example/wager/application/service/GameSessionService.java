package com.example.wager.application.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.FairnessViolationException;
import com.example.wager.application.domain.error.RoundTimeoutException;
import com.example.wager.application.domain.error.TransientInfrastructureException;
import com.example.wager.application.domain.error.ValidationException;
import com.example.wager.application.domain.fairness.CoinChoice;
import com.example.wager.application.domain.fairness.Commitment;
import com.example.wager.application.domain.fairness.FairnessPrimitives;
import com.example.wager.application.domain.fairness.Nonce;
import com.example.wager.application.domain.round.AuditEventType;
import com.example.wager.application.domain.round.GameSession;
import com.example.wager.application.domain.round.Round;
import com.example.wager.application.domain.round.RoundAuditEvent;
import com.example.wager.application.port.FairnessAuditPort;
import com.example.wager.application.port.PlayerBalancePort;
import com.example.wager.application.port.RoundRepositoryPort;
import com.example.wager.application.port.SettlementQueuePort;
import com.example.wager.config.config.WagerProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 回合生命週期的應用服務
 *
 * <p>
 * 只由持有該 {@link GameSession} 的連線任務呼叫，同一個 Session 不會有兩個執行緒同時進入。
 * 每一個方法在回傳前都已把狀態寫入資料庫：
 * <ul>
 * <li>submitCommitment：保留下注金額並新增回合，兩者同一交易</li>
 * <li>reveal：RESOLVED 回合寫入持久化佇列 (PENDING) 後才發布到結算管線</li>
 * <li>expire：回合轉為 EXPIRED 並退回保留金額</li>
 * </ul>
 * 開放回合的關閉一律以「資料庫中仍為開放狀態」為條件，連線與 {@link #expireAbandonedRounds} 同時關閉同一回合時只有一方會退款。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameSessionService {

	public static final String SOURCE_GATEWAY = "GATEWAY";
	public static final String REASON_ABANDONED = "ABANDONED";

	private final RoundRepositoryPort roundRepository;
	private final PlayerBalancePort playerBalance;
	private final SettlementQueuePort settlementQueue;
	private final FairnessAuditPort fairnessAudit;
	private final TransactionTemplate transactionTemplate;
	private final WagerProperties properties;
	private final Clock clock;

	/**
	 * 接受玩家承諾，開啟新回合
	 *
	 * @throws ValidationException              輸入錯誤、已有回合進行中或餘額不足
	 * @throws TransientInfrastructureException 持久化失敗，沒有任何狀態被改變
	 */
	public Round submitCommitment(GameSession session, long wager, String choice, String commitment) {
		if (wager <= 0 || wager > properties.getFairness().getMaxWager()) {
			throw new ValidationException(ErrorCode.INVALID_WAGER,
					"下注金額必須介於 1 與 " + properties.getFairness().getMaxWager() + " 之間: " + wager);
		}
		CoinChoice parsedChoice = CoinChoice.fromWire(choice);
		Commitment parsedCommitment = Commitment.parse(commitment);
		session.ensureNoOpenRound();

		Instant now = clock.instant();
		Round round = Round.open(session.getPlayerId(), session.getSessionId(),
				properties.getFairness().getHouseEdgeBps(), now);
		round.acceptCommitment(wager, parsedChoice, parsedCommitment, now);

		try {
			Boolean reserved = transactionTemplate.execute(status -> {
				if (!playerBalance.reserve(round.getPlayerId(), wager)) {
					return false;
				}
				roundRepository.insert(round);
				return true;
			});
			if (!Boolean.TRUE.equals(reserved)) {
				throw new ValidationException(ErrorCode.INSUFFICIENT_BALANCE, "可用餘額不足以下注 " + wager);
			}
		} catch (DataAccessException e) {
			log.error(">>> [Session] 回合寫入失敗 (Player: {})", session.getPlayerId(), e);
			throw new TransientInfrastructureException("回合寫入失敗，請稍後再試", e);
		}

		session.attach(round);
		fairnessAudit.record(RoundAuditEvent.of(round, AuditEventType.COMMITTED,
				"wager=" + wager + ",choice=" + parsedChoice.getWireValue() + ",commitment=" + parsedCommitment, now));
		log.info(">>> [Session] 承諾已接受 (Round: {}, Player: {}, Wager: {})", round.getRoundId(),
				round.getPlayerId(), wager);
		return round;
	}

	/**
	 * 玩家揭示 nonce，產生莊家 nonce 並推導結果
	 *
	 * @throws ValidationException              nonce 格式錯誤或沒有等待揭示的回合
	 * @throws RoundTimeoutException            回合已閒置逾時，已轉為 EXPIRED
	 * @throws FairnessViolationException       承諾驗證失敗，回合已作廢
	 * @throws TransientInfrastructureException 結果已產生但交付失敗，回合留在 Session 上等待重新交付
	 */
	public Round reveal(GameSession session, String nonce) {
		Nonce playerNonce = Nonce.parse(nonce);
		Round round = session.requireRevealableRound();
		Instant now = clock.instant();

		if (session.isRoundInactive(now, properties.getGateway().getRoundInactivityTimeout())) {
			expire(session, round, "INACTIVITY", now);
			throw new RoundTimeoutException(round.getRoundId(), "回合閒置逾時，已過期");
		}

		try {
			round.reveal(playerNonce, FairnessPrimitives::generateNonce, now);
		} catch (FairnessViolationException e) {
			log.error(">>> [Fairness] 承諾驗證失敗，回合作廢 (Round: {}, Player: {})", round.getRoundId(),
					round.getPlayerId());
			if (closeAndReleaseQuietly(round)) {
				fairnessAudit.record(RoundAuditEvent.of(round, AuditEventType.VOIDED, "commitment="
						+ round.getCommitment() + ",revealedNonce=" + playerNonce + ",houseNonce="
						+ round.getHouseNonce(), now));
			}
			session.release();
			throw e;
		}

		fairnessAudit.record(RoundAuditEvent.of(round, AuditEventType.RESOLVED,
				"playerNonce=" + round.getPlayerNonce() + ",houseNonce=" + round.getHouseNonce() + ",outcome="
						+ round.getOutcome().getWireValue() + ",payout=" + round.getPayout(),
				now));
		handOff(session, round);
		return round;
	}

	/**
	 * 重新交付先前寫入失敗的 RESOLVED 回合
	 *
	 * @return 本次成功交付的回合
	 */
	public Optional<Round> retryHandOff(GameSession session) {
		Optional<Round> pending = session.pendingHandoff();
		if (pending.isEmpty()) {
			return Optional.empty();
		}
		try {
			handOff(session, pending.get());
			return pending;
		} catch (TransientInfrastructureException e) {
			log.warn(">>> [Session] 重新交付仍失敗 (Round: {})", pending.get().getRoundId());
			return Optional.empty();
		} catch (RoundTimeoutException e) {
			return Optional.empty();
		}
	}

	/**
	 * 讓 Session 上開放中的回合過期 (逾時或斷線)
	 *
	 * @return 被過期的回合
	 */
	public Optional<Round> expireOpenRound(GameSession session, String reason) {
		Optional<Round> open = session.openRound();
		open.ifPresent(round -> expire(session, round, reason, clock.instant()));
		return open;
	}

	/**
	 * 過期沒有任何連線持有的開放回合，並退回保留金額
	 *
	 * <p>
	 * 涵蓋程序重啟前留下的回合，以及斷線清理時寫入失敗的回合。
	 * </p>
	 *
	 * @param cutoff 最後活動時間早於此值的開放回合才會被過期
	 * @return 本次過期的回合數
	 * @throws org.springframework.dao.DataAccessException 讀寫失敗，由呼叫端的下一個週期重試
	 */
	public int expireAbandonedRounds(Instant cutoff, int limit) {
		Instant now = clock.instant();
		int expired = 0;
		for (Round round : roundRepository.findStaleOpen(cutoff, limit)) {
			round.expire(now, REASON_ABANDONED);
			if (!closeAndRelease(round)) {
				continue;
			}
			fairnessAudit.record(RoundAuditEvent.of(round, AuditEventType.EXPIRED, "reason=" + REASON_ABANDONED, now));
			log.warn(">>> [Session] 回收無人持有的回合 {} (Player: {}, Released: {})", round.getRoundId(),
					round.getPlayerId(), round.getWager());
			expired++;
		}
		return expired;
	}

	/**
	 * 判斷 Session 上的開放回合是否已閒置逾時
	 */
	public boolean isRoundInactive(GameSession session) {
		return session.isRoundInactive(clock.instant(), properties.getGateway().getRoundInactivityTimeout());
	}

	private void handOff(GameSession session, Round round) {
		round.handOff(clock.instant().plus(properties.getSettlement().getRecoveryGrace()));
		boolean persisted;
		try {
			persisted = roundRepository.updateIfOpen(round);
		} catch (DataAccessException e) {
			round.abortHandOff();
			log.error(">>> [Session] RESOLVED 回合寫入持久化佇列失敗 (Round: {})", round.getRoundId(), e);
			throw new TransientInfrastructureException("結果已產生，結算交付暫時失敗，將自動重試", e);
		}
		session.release();
		if (!persisted) {
			log.error(">>> [Session] 回合 {} 交付前已被回收為 EXPIRED，結果不予結算", round.getRoundId());
			throw new RoundTimeoutException(round.getRoundId(), "回合已逾時回收");
		}

		// 佇列已滿時由 SettlementRetryWatcher 於寬限時間後撿起
		if (!settlementQueue.publish(round, SOURCE_GATEWAY)) {
			log.warn(">>> [Session] 結算佇列已滿，交由 Watcher 處理 (Round: {})", round.getRoundId());
		}
		log.info(">>> [Session] 回合已交付結算 (Round: {}, Outcome: {}, Payout: {})", round.getRoundId(),
				round.getOutcome(), round.getPayout());
	}

	private void expire(GameSession session, Round round, String reason, Instant now) {
		round.expire(now, reason);
		if (closeAndReleaseQuietly(round)) {
			fairnessAudit.record(RoundAuditEvent.of(round, AuditEventType.EXPIRED, "reason=" + reason, now));
		}
		session.release();
		log.info(">>> [Session] 回合已過期 (Round: {}, Reason: {})", round.getRoundId(), reason);
	}

	/**
	 * 回合寫入終態並退回保留的下注金額 (同一交易)，只有資料庫中仍為開放狀態的回合會被寫入
	 *
	 * @return false 表示回合已被其他流程關閉，沒有退款
	 */
	private boolean closeAndRelease(Round round) {
		Boolean closed = transactionTemplate.execute(status -> {
			if (!roundRepository.updateIfOpen(round)) {
				return false;
			}
			if (round.getWager() > 0) {
				playerBalance.release(round.getPlayerId(), round.getWager());
			}
			return true;
		});
		return Boolean.TRUE.equals(closed);
	}

	/**
	 * 連線路徑使用：寫入失敗只記錄，Session 仍會收到終態訊息，保留金額由回收任務退回
	 */
	private boolean closeAndReleaseQuietly(Round round) {
		try {
			boolean closed = closeAndRelease(round);
			if (!closed) {
				log.warn(">>> [Session] 回合 {} 已被其他流程關閉，略過退款", round.getRoundId());
			}
			return closed;
		} catch (DataAccessException e) {
			log.error(">>> [Session] 回合 {} 終態寫入失敗，保留金額 {} 由回收任務退回", round.getRoundId(), round.getWager(), e);
			return false;
		}
	}
}
