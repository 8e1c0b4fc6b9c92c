package com.example.wager.infra.adapter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.stereotype.Component;

import com.example.wager.application.domain.round.Round;
import com.example.wager.application.port.RoundRepositoryPort;
import com.example.wager.infra.repository.RoundRepository;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class RoundRepositoryAdapter implements RoundRepositoryPort {

	private final RoundRepository roundRepository;

	@Override
	public void insert(Round round) {
		roundRepository.insert(round);
	}

	@Override
	public void update(Round round) {
		if (roundRepository.update(round) == 0) {
			throw new EmptyResultDataAccessException("回合不存在: " + round.getRoundId(), 1);
		}
	}

	@Override
	public boolean updateIfOpen(Round round) {
		return roundRepository.updateIfOpen(round) == 1;
	}

	@Override
	public Optional<Round> findById(String roundId) {
		return roundRepository.findById(roundId);
	}

	@Override
	public List<Round> findRecentByPlayer(String playerId, int limit) {
		return roundRepository.findRecentByPlayer(playerId, limit);
	}

	@Override
	public List<Round> findDueForSettlement(Instant now, int limit) {
		return roundRepository.findDueForSettlement(now, limit);
	}

	@Override
	public List<Round> findStaleOpen(Instant cutoff, int limit) {
		return roundRepository.findStaleOpen(cutoff, limit);
	}
}
