package com.example.wager.iface.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.example.wager.application.domain.round.AuditEventType;
import com.example.wager.application.domain.round.RoundAuditEvent;
import com.example.wager.application.domain.settlement.SettlementEvent;
import com.example.wager.application.domain.settlement.SettlementOutcome;
import com.example.wager.application.port.FairnessAuditPort;

class SettlementJournalHandlerTest {

	private FairnessAuditPort fairnessAudit;
	private SettlementJournalHandler handler;

	@BeforeEach
	void setUp() {
		fairnessAudit = mock(FairnessAuditPort.class);
		handler = new SettlementJournalHandler(fairnessAudit, Clock.systemUTC());
	}

	@Test
	@DisplayName("批次結束時一次寫入，重複與略過的結果不留紀錄")
	@SuppressWarnings("unchecked")
	void flushesOncePerBatch() {
		handler.onEvent(event("r-1", SettlementOutcome.APPLIED), 1, false);
		handler.onEvent(event("r-2", SettlementOutcome.DUPLICATE), 2, false);
		verify(fairnessAudit, never()).recordAll(anyList());

		handler.onEvent(event("r-3", SettlementOutcome.RETRY_SCHEDULED), 3, false);
		handler.onEvent(event("r-4", SettlementOutcome.ESCALATED), 4, true);

		ArgumentCaptor<List<RoundAuditEvent>> captor = ArgumentCaptor.forClass(List.class);
		verify(fairnessAudit).recordAll(captor.capture());
		assertThat(captor.getValue()).extracting(RoundAuditEvent::type).containsExactly(AuditEventType.SETTLED,
				AuditEventType.SETTLEMENT_RETRY, AuditEventType.MANUAL_INTERVENTION);
	}

	@Test
	@DisplayName("稽核寫入失敗不會往外拋")
	void auditFailureIsContained() {
		doThrow(new IllegalStateException("audit store down")).when(fairnessAudit).recordAll(anyList());

		handler.onEvent(event("r-1", SettlementOutcome.APPLIED), 1, true);
		handler.onEvent(event("r-2", SettlementOutcome.SKIPPED), 2, true);

		verify(fairnessAudit).recordAll(anyList());
	}

	private static SettlementEvent event(String roundId, SettlementOutcome outcome) {
		SettlementEvent event = new SettlementEvent();
		event.reset(roundId, "player-1", 0L, "TEST");
		event.setOutcome(outcome);
		return event;
	}
}
