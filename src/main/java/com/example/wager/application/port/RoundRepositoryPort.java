package com.example.wager.application.port;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.example.wager.application.domain.round.Round;

/**
 * 回合持久化 Port
 * <p>
 * 回合紀錄同時是結算管線的持久化佇列：RESOLVED 且結算狀態為 PENDING / FAILED_PENDING_RETRY 的列即為待處理項目。
 * </p>
 */
public interface RoundRepositoryPort {

	/**
	 * 新增回合 (承諾被接受時呼叫，回傳即代表已持久化確認)
	 */
	void insert(Round round);

	/**
	 * 覆寫回合的可變欄位
	 */
	void update(Round round);

	/**
	 * 只在持久化的回合仍為開放狀態時覆寫
	 *
	 * @return false 表示回合已被其他流程關閉，本次沒有寫入
	 */
	boolean updateIfOpen(Round round);

	Optional<Round> findById(String roundId);

	/**
	 * 玩家最近的回合，新到舊
	 */
	List<Round> findRecentByPlayer(String playerId, int limit);

	/**
	 * 到期需要 (重新) 結算的回合
	 *
	 * @param now   目前時間，next_attempt_at 小於等於此值者視為到期
	 * @param limit 單次掃描上限
	 */
	List<Round> findDueForSettlement(Instant now, int limit);

	/**
	 * 最後活動時間早於 cutoff、仍為開放狀態的回合
	 */
	List<Round> findStaleOpen(Instant cutoff, int limit);
}
