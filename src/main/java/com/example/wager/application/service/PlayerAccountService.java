package com.example.wager.application.service;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.ValidationException;
import com.example.wager.application.domain.round.Round;
import com.example.wager.application.port.PlayerBalancePort;
import com.example.wager.application.port.RoundRepositoryPort;
import com.example.wager.application.shared.projection.PlayerBalanceProjection;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 玩家餘額與回合歷史
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerAccountService {

	public static final int MAX_HISTORY = 100;

	/**
	 * 與 player_balances / rounds 的 player_id 欄位長度一致
	 */
	public static final int MAX_PLAYER_ID_LENGTH = 64;

	private static final Pattern PLAYER_ID_FORMAT = Pattern
			.compile("^[A-Za-z0-9_:.\\-]{1," + MAX_PLAYER_ID_LENGTH + "}$");

	private final PlayerBalancePort playerBalance;
	private final RoundRepositoryPort roundRepository;

	public static boolean isValidPlayerId(String playerId) {
		return playerId != null && PLAYER_ID_FORMAT.matcher(playerId).matches();
	}

	public PlayerBalanceProjection deposit(String playerId, long amount) {
		if (!isValidPlayerId(playerId)) {
			throw new ValidationException(ErrorCode.INVALID_MESSAGE,
					"玩家識別碼格式錯誤或超過 " + MAX_PLAYER_ID_LENGTH + " 字元");
		}
		if (amount <= 0) {
			throw new ValidationException(ErrorCode.INVALID_WAGER, "存入金額必須為正數: " + amount);
		}
		playerBalance.deposit(playerId, amount);
		log.info(">>> [Player] 玩家 {} 存入 {}", playerId, amount);
		return playerBalance.find(playerId).orElseThrow();
	}

	public Optional<PlayerBalanceProjection> getBalance(String playerId) {
		return playerBalance.find(playerId);
	}

	/**
	 * 最近的回合，新到舊
	 */
	public List<Round> recentRounds(String playerId, int limit) {
		return roundRepository.findRecentByPlayer(playerId, Math.max(1, Math.min(limit, MAX_HISTORY)));
	}
}
