package com.example.wager.infra.adapter;

import java.time.Instant;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.wager.application.domain.error.SolvencyException;
import com.example.wager.application.domain.error.TransientInfrastructureException;
import com.example.wager.application.domain.round.Round;
import com.example.wager.application.domain.settlement.SettlementOutcome;
import com.example.wager.application.port.PoolLedgerPort;
import com.example.wager.config.config.WagerProperties;
import com.example.wager.infra.repository.PlayerBalanceRepository;
import com.example.wager.infra.repository.PoolLedgerRepository;
import com.example.wager.infra.repository.RoundRepository;
import com.example.wager.infra.repository.SettlementMarkerRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 以單一資料庫交易套用結算
 *
 * <pre>
 * 1. settled_rounds 佔位 (主鍵衝突 = 已結算，整筆 no-op)
 * 2. pool_ledger compare-and-set：balance += wager - payout，更新後不得為負
 * 3. player_balances：消耗保留的下注金額、入帳派彩
 * 4. rounds：RESOLVED -> SETTLED
 * </pre>
 *
 * 任何一步失敗都會讓整筆交易回滾，冪等標記也不會留下。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PoolLedgerAdapter implements PoolLedgerPort {

	private final SettlementMarkerRepository markerRepository;
	private final PoolLedgerRepository poolLedgerRepository;
	private final PlayerBalanceRepository playerBalanceRepository;
	private final RoundRepository roundRepository;
	private final TransactionTemplate transactionTemplate;
	private final WagerProperties properties;

	@Override
	public SettlementOutcome applySettlement(Round round, Instant now) {
		String poolId = properties.getPool().getId();
		Boolean applied = transactionTemplate.execute(status -> {
			if (!markerRepository.tryMarkAsSettled(round.getRoundId(), round.getPlayerId(), round.getPayout(), now)) {
				return false;
			}
			long delta = round.getWager() - round.getPayout();
			if (!poolLedgerRepository.applyDelta(poolId, delta, now)) {
				throw new SolvencyException("資金池 " + poolId + " 餘額不足以支付淨流出 " + (-delta));
			}
			if (!playerBalanceRepository.settle(round.getPlayerId(), round.getWager(), round.getPayout())) {
				throw new TransientInfrastructureException("玩家 " + round.getPlayerId() + " 的保留金額不足 " + round.getWager());
			}
			if (roundRepository.markSettled(round.getRoundId(), now) == 0) {
				throw new TransientInfrastructureException("回合 " + round.getRoundId() + " 已不是 RESOLVED");
			}
			return true;
		});

		if (!Boolean.TRUE.equals(applied)) {
			return SettlementOutcome.DUPLICATE;
		}
		round.markSettled(now);
		return SettlementOutcome.APPLIED;
	}

	@Override
	public long currentBalance() {
		return poolLedgerRepository.findBalance(properties.getPool().getId()).orElse(0L);
	}

	@Override
	public boolean initializeIfAbsent(long initialBalance) {
		boolean created = poolLedgerRepository.insertIfAbsent(properties.getPool().getId(), initialBalance,
				Instant.now());
		if (created) {
			log.info(">>> [Pool] 資金池 {} 已建立，初始餘額 {}", properties.getPool().getId(), initialBalance);
		}
		return created;
	}
}
