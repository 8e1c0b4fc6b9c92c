package com.example.wager.application.service;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.example.wager.application.port.FairnessAuditPort;
import com.example.wager.application.port.RoundRepositoryPort;
import com.example.wager.application.shared.dto.SettlementStatusGettenData;

import lombok.RequiredArgsConstructor;

/**
 * 結算狀態查詢服務
 */
@Service
@RequiredArgsConstructor
public class SettlementQueryService {

	private final RoundRepositoryPort roundRepository;
	private final FairnessAuditPort fairnessAudit;

	public Optional<SettlementStatusGettenData> getStatus(String roundId) {
		return roundRepository.findById(roundId)
				.map(round -> new SettlementStatusGettenData(round.getRoundId(), round.getPlayerId(),
						round.getState().name(), round.getSettlementStatus().name(), round.getSettlementAttempts(),
						String.valueOf(round.getPayout()), round.getLastError(),
						fairnessAudit.findByRound(roundId)));
	}
}
