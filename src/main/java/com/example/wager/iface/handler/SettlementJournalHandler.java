package com.example.wager.iface.handler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.example.wager.application.domain.round.AuditEventType;
import com.example.wager.application.domain.round.RoundAuditEvent;
import com.example.wager.application.domain.settlement.SettlementEvent;
import com.example.wager.application.port.FairnessAuditPort;
import com.lmax.disruptor.EventHandler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 結算日誌處理器 (Disruptor 第二階段)
 * <p>
 * 收集同一批次中會留下稽核紀錄的結算結果，批次結束時一次寫入公平性稽核日誌。 稽核寫入失敗只記錄錯誤，不影響結算結果。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementJournalHandler implements EventHandler<SettlementEvent> {

	private final FairnessAuditPort fairnessAudit;
	private final Clock clock;
	private final List<RoundAuditEvent> journalBuffer = new ArrayList<>();

	@Override
	public void onEvent(SettlementEvent event, long sequence, boolean endOfBatch) {
		AuditEventType type = toAuditType(event);
		if (type != null) {
			journalBuffer.add(
					new RoundAuditEvent(event.getRoundId(), event.getPlayerId(), type, event.getDetail(), clock.instant()));
		}
		if (endOfBatch) {
			flush();
		}
	}

	private void flush() {
		if (journalBuffer.isEmpty()) {
			return;
		}
		try {
			fairnessAudit.recordAll(List.copyOf(journalBuffer));
		} catch (RuntimeException e) {
			log.error(">>> [Journal] 稽核日誌寫入失敗，共 {} 筆", journalBuffer.size(), e);
		} finally {
			journalBuffer.clear();
		}
	}

	private static AuditEventType toAuditType(SettlementEvent event) {
		if (event.getOutcome() == null) {
			return null;
		}
		return switch (event.getOutcome()) {
		case APPLIED -> AuditEventType.SETTLED;
		case RETRY_SCHEDULED -> AuditEventType.SETTLEMENT_RETRY;
		case ESCALATED -> AuditEventType.MANUAL_INTERVENTION;
		case DUPLICATE, SKIPPED -> null;
		};
	}
}
