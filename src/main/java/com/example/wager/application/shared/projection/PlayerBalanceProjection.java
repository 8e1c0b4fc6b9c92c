package com.example.wager.application.shared.projection;

/**
 * 玩家餘額讀取模型
 *
 * @param playerId  玩家
 * @param available 可用餘額
 * @param reserved  下注中被保留的金額
 */
public record PlayerBalanceProjection(String playerId, long available, long reserved) {
}
