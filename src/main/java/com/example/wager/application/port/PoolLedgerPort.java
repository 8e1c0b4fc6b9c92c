package com.example.wager.application.port;

import java.time.Instant;

import com.example.wager.application.domain.round.Round;
import com.example.wager.application.domain.settlement.SettlementOutcome;

/**
 * 資金池帳本 Port
 */
public interface PoolLedgerPort {

	/**
	 * 以單一交易原子地套用結算：
	 *
	 * <pre>
	 * 1. 寫入冪等標記 (已存在則整筆 no-op，回傳 DUPLICATE)
	 * 2. 條件式更新資金池餘額：balance += wager - payout，且更新後不得為負
	 * 3. 消耗玩家保留金額並入帳派彩
	 * 4. 回合轉為 SETTLED
	 * </pre>
	 *
	 * @throws com.example.wager.application.domain.error.SolvencyException 資金池餘額不足，整筆交易回滾
	 */
	SettlementOutcome applySettlement(Round round, Instant now);

	long currentBalance();

	/**
	 * 資金池不存在時以初始餘額建立
	 *
	 * @return true 代表本次有建立
	 */
	boolean initializeIfAbsent(long initialBalance);
}
