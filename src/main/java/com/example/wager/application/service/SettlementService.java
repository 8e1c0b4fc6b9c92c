package com.example.wager.application.service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.example.wager.application.domain.error.SolvencyException;
import com.example.wager.application.domain.error.TransientInfrastructureException;
import com.example.wager.application.domain.error.WagerException;
import com.example.wager.application.domain.fairness.CoinChoice;
import com.example.wager.application.domain.fairness.FairnessPrimitives;
import com.example.wager.application.domain.round.Round;
import com.example.wager.application.domain.round.RoundState;
import com.example.wager.application.domain.round.SettlementStatus;
import com.example.wager.application.domain.settlement.RetryPolicy;
import com.example.wager.application.domain.settlement.SettlementEvent;
import com.example.wager.application.domain.settlement.SettlementOutcome;
import com.example.wager.application.domain.vault.VaultSnapshot;
import com.example.wager.application.port.PoolLedgerPort;
import com.example.wager.application.port.RoundRepositoryPort;
import com.example.wager.config.config.WagerProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 結算管線的業務邏輯，只在 Disruptor 的 SettlementHandler 執行緒上被呼叫 (單一寫入者)
 *
 * <pre>
 * 1. 以資料庫中的回合為準 (事件載體只攜帶 roundId)
 * 2. 以持久化的 nonce 重新驗證承諾、推導結果與派彩，任何不符即升級人工介入
 * 3. 資金池需要付出時檢查金庫快照 (新鮮度與曝險上限)
 * 4. 交由 {@link PoolLedgerPort} 以單一交易套用餘額變動 (冪等)
 * 5. 失敗時依退避策略排定重試，次數用盡後升級人工介入，絕不自動沖銷
 * 6. 結果寫回事件載體，由下游 SettlementJournalHandler 寫入稽核日誌
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementService {

	private final RoundRepositoryPort roundRepository;
	private final PoolLedgerPort poolLedger;
	private final VaultLedgerCache vaultLedgerCache;
	private final WagerProperties properties;
	private final Clock clock;

	/**
	 * 結算事件載體指向的回合，並將結果寫回載體供下游 Journal 使用
	 */
	public SettlementOutcome settle(SettlementEvent event) {
		String roundId = event.getRoundId();
		Optional<Round> found = roundRepository.findById(roundId);
		if (found.isEmpty()) {
			log.warn(">>> [Settlement] 找不到回合 {} (Source: {})", roundId, event.getSource());
			return complete(event, SettlementOutcome.SKIPPED, "回合不存在");
		}
		Round round = found.get();
		Instant now = clock.instant();

		if (round.getState() == RoundState.SETTLED) {
			log.debug(">>> [Settlement] 回合 {} 已結算，略過重複投遞", roundId);
			return complete(event, SettlementOutcome.DUPLICATE, null);
		}
		if (round.getState() != RoundState.RESOLVED || !round.isHandedOff()
				|| round.getSettlementStatus() == SettlementStatus.MANUAL_INTERVENTION) {
			log.debug(">>> [Settlement] 回合 {} 狀態 {}/{} 不需結算", roundId, round.getState(),
					round.getSettlementStatus());
			return complete(event, SettlementOutcome.SKIPPED, round.getState() + "/" + round.getSettlementStatus());
		}
		if (round.getSettlementStatus() == SettlementStatus.FAILED_PENDING_RETRY && round.getNextAttemptAt() != null
				&& round.getNextAttemptAt().isAfter(now)) {
			// 退避時間未到，重複投遞一律略過
			return complete(event, SettlementOutcome.SKIPPED, "retryAt=" + round.getNextAttemptAt());
		}

		Optional<String> mismatch = reverify(round);
		if (mismatch.isPresent()) {
			return escalate(event, round, "稽核不符: " + mismatch.get());
		}

		try {
			checkSolvency(round);
			SettlementOutcome outcome = poolLedger.applySettlement(round, now);
			if (outcome == SettlementOutcome.APPLIED) {
				log.info(">>> [Settlement] 結算完成 (Round: {}, Player: {}, Payout: {}, Source: {})", roundId,
						round.getPlayerId(), round.getPayout(), event.getSource());
				return complete(event, outcome,
						"payout=" + round.getPayout() + ",attempts=" + (round.getSettlementAttempts() + 1));
			}
			log.info(">>> [Settlement] 冪等標記已存在，略過 (Round: {})", roundId);
			return complete(event, outcome, null);
		} catch (SolvencyException | TransientInfrastructureException e) {
			return recordFailure(event, round, e, now);
		} catch (DataAccessException e) {
			return recordFailure(event, round,
					new TransientInfrastructureException("資料庫寫入失敗: " + e.getMessage(), e), now);
		}
	}

	/**
	 * 以持久化的欄位重新推導，確保不會結算未通過驗證或金額被竄改的回合
	 */
	private Optional<String> reverify(Round round) {
		if (!FairnessPrimitives.verifyCommitment(round.getCommitment(), round.getWager(), round.getChoice(),
				round.getPlayerNonce())) {
			return Optional.of("承諾驗證失敗");
		}
		if (round.getHouseNonce() == null) {
			return Optional.of("缺少莊家 nonce");
		}
		CoinChoice outcome = FairnessPrimitives.deriveResult(round.getPlayerNonce(), round.getHouseNonce());
		if (outcome != round.getOutcome()) {
			return Optional.of("開獎結果不符");
		}
		boolean won = outcome == round.getChoice();
		if (won != round.isPlayerWon()) {
			return Optional.of("輸贏判定不符");
		}
		long expected = FairnessPrimitives.calculatePayout(round.getWager(), won, round.getHouseEdgeBps());
		if (expected != round.getPayout()) {
			return Optional.of("派彩金額不符 (expected=" + expected + ", actual=" + round.getPayout() + ")");
		}
		return Optional.empty();
	}

	/**
	 * 淨流出為正時才需要金庫快照：快照過期視為暫時性故障，超過曝險上限視為流動性不足
	 */
	private void checkSolvency(Round round) {
		long netOutflow = round.netPoolOutflow();
		if (netOutflow <= 0) {
			return;
		}
		WagerProperties.Settlement config = properties.getSettlement();
		Optional<VaultSnapshot> snapshot = vaultLedgerCache.freshSnapshot();
		if (snapshot.isEmpty()) {
			if (config.isRequireFreshSnapshot()) {
				throw new TransientInfrastructureException("金庫快照不存在或已過期，暫緩付款");
			}
			return;
		}
		BigInteger limit = snapshot.get().getTotalAssets().multiply(BigInteger.valueOf(config.getMaxPayoutExposureBps()))
				.divide(BigInteger.valueOf(FairnessPrimitives.BPS_BASE));
		if (BigInteger.valueOf(netOutflow).compareTo(limit) > 0) {
			throw new SolvencyException("淨流出 " + netOutflow + " 超過金庫曝險上限 " + limit);
		}
	}

	private SettlementOutcome recordFailure(SettlementEvent event, Round round, WagerException error, Instant now) {
		RetryPolicy policy = properties.getSettlement().retryPolicy();
		int failed = round.getSettlementAttempts() + 1;
		boolean exhausted = policy.isExhausted(failed);
		Instant retryAt = now.plus(policy.delayAfter(failed));
		round.recordSettlementFailure(error.getCode() + ": " + error.getMessage(), retryAt, exhausted);
		persistQuietly(round);

		if (exhausted) {
			log.error(">>> [Settlement] 重試 {} 次仍失敗，升級人工介入 (Round: {}, Payout: {}): {}", failed,
					round.getRoundId(), round.getPayout(), error.getMessage());
			return complete(event, SettlementOutcome.ESCALATED, "attempts=" + failed + ",error=" + error.getMessage());
		}
		log.warn(">>> [Settlement] 結算失敗，第 {} 次重試排定於 {} (Round: {}): {}", failed, retryAt, round.getRoundId(),
				error.getMessage());
		return complete(event, SettlementOutcome.RETRY_SCHEDULED,
				"attempts=" + failed + ",retryAt=" + retryAt + ",error=" + error.getMessage());
	}

	private SettlementOutcome escalate(SettlementEvent event, Round round, String reason) {
		round.escalate(reason);
		persistQuietly(round);
		log.error(">>> [Settlement] {}，升級人工介入 (Round: {})", reason, round.getRoundId());
		return complete(event, SettlementOutcome.ESCALATED, reason);
	}

	private static SettlementOutcome complete(SettlementEvent event, SettlementOutcome outcome, String detail) {
		event.setOutcome(outcome);
		event.setDetail(detail);
		return outcome;
	}

	/**
	 * 失敗狀態寫不進去時，舊的 next_attempt_at 仍在，Watcher 會再次撿起
	 */
	private void persistQuietly(Round round) {
		try {
			roundRepository.update(round);
		} catch (DataAccessException e) {
			log.error(">>> [Settlement] 回合 {} 狀態寫入失敗", round.getRoundId(), e);
		}
	}
}
