package com.example.wager.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.wager.application.domain.round.RoundAuditEvent;
import com.example.wager.infra.event.mapper.EventStoreEventMapper;

import tools.jackson.databind.ObjectMapper;

/**
 * 稽核事件的 EventStore 映射設定
 */
@Configuration
public class EventCodecConfiguration {

	/**
	 * EventStore 事件型別使用稽核類型 (COMMITTED / RESOLVED / SETTLED ...)
	 */
	@Bean
	public EventStoreEventMapper<RoundAuditEvent> roundAuditEventMapper(ObjectMapper objectMapper) {
		return new EventStoreEventMapper<>(objectMapper, RoundAuditEvent.class, event -> event.type().name());
	}
}
