package com.example.wager.application.port;

import java.util.Optional;

import com.example.wager.application.shared.projection.PlayerBalanceProjection;

/**
 * 玩家餘額 Port，所有變更皆以條件式更新 (compare-and-set) 完成
 */
public interface PlayerBalancePort {

	/**
	 * 將可用餘額移入保留區
	 *
	 * @return false 代表可用餘額不足，未做任何變更
	 */
	boolean reserve(String playerId, long amount);

	/**
	 * 將保留金額退回可用餘額 (回合逾時或作廢)
	 */
	void release(String playerId, long amount);

	void deposit(String playerId, long amount);

	Optional<PlayerBalanceProjection> find(String playerId);
}
