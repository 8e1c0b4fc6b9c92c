package com.example.wager.infra.adapter;

import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.example.wager.application.domain.round.RoundAuditEvent;
import com.example.wager.application.port.FairnessAuditPort;
import com.example.wager.infra.repository.FairnessAuditRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 未啟用 EventStoreDB 時，稽核事件寫入 fairness_audit 資料表
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "wager.audit.event-store.enabled", havingValue = "false", matchIfMissing = true)
public class JdbcFairnessAuditAdapter implements FairnessAuditPort {

	private final FairnessAuditRepository auditRepository;

	@Override
	public void record(RoundAuditEvent event) {
		try {
			auditRepository.append(event);
		} catch (DataAccessException e) {
			log.error(">>> [Audit] 稽核事件寫入失敗 (Round: {}, Type: {}): {}", event.roundId(), event.type(),
					e.getMessage());
		}
	}

	@Override
	public List<RoundAuditEvent> findByRound(String roundId) {
		return auditRepository.findByRound(roundId);
	}
}
