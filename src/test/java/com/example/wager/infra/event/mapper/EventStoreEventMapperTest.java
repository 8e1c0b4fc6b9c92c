package com.example.wager.infra.event.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.eventstore.dbclient.EventData;
import com.example.wager.application.domain.round.AuditEventType;
import com.example.wager.application.domain.round.RoundAuditEvent;

import tools.jackson.databind.json.JsonMapper;

class EventStoreEventMapperTest {

	private final EventStoreEventMapper<RoundAuditEvent> mapper = new EventStoreEventMapper<>(
			JsonMapper.builder().build(), RoundAuditEvent.class, event -> event.type().name());

	@Test
	@DisplayName("EventStore 事件型別取自稽核類型，內容可還原")
	void eventTypeFollowsAuditType() {
		RoundAuditEvent event = new RoundAuditEvent("round-1", "player-1", AuditEventType.SETTLED, "payout=1960",
				Instant.parse("2026-01-01T00:00:00Z"));

		EventData data = mapper.toEventData(event);

		assertThat(data.getEventType()).isEqualTo("SETTLED");
		assertThat(data.getContentType()).isEqualTo("application/json");
		assertThat(mapper.decode(data.getEventData())).isEqualTo(event);
	}

	@Test
	@DisplayName("損毀的事件資料以 IllegalStateException 回報")
	void corruptedPayloadFails() {
		assertThatThrownBy(() -> mapper.decode("{not json".getBytes(StandardCharsets.UTF_8)))
				.isInstanceOf(IllegalStateException.class);
	}
}
