package com.example.wager.iface.dto.res;

import com.example.wager.application.shared.projection.PlayerBalanceProjection;

/**
 * 玩家餘額，金額以十進位字串表示
 */
public record PlayerBalanceResource(String playerId, String available, String reserved) {

	public static PlayerBalanceResource from(PlayerBalanceProjection projection) {
		return new PlayerBalanceResource(projection.playerId(), String.valueOf(projection.available()),
				String.valueOf(projection.reserved()));
	}
}
