package com.example.wager.infra.adapter;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.wager.application.port.PlayerBalancePort;
import com.example.wager.application.shared.projection.PlayerBalanceProjection;
import com.example.wager.infra.repository.PlayerBalanceRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class PlayerBalanceAdapter implements PlayerBalancePort {

	private final PlayerBalanceRepository playerBalanceRepository;

	@Override
	public boolean reserve(String playerId, long amount) {
		return playerBalanceRepository.reserve(playerId, amount);
	}

	@Override
	public void release(String playerId, long amount) {
		if (!playerBalanceRepository.release(playerId, amount)) {
			log.error(">>> [Balance] 玩家 {} 保留金額不足以退回 {}，需人工核對", playerId, amount);
		}
	}

	@Override
	public void deposit(String playerId, long amount) {
		playerBalanceRepository.deposit(playerId, amount);
	}

	@Override
	public Optional<PlayerBalanceProjection> find(String playerId) {
		return playerBalanceRepository.find(playerId);
	}
}
