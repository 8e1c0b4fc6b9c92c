package com.example.wager.infra.event.mapper;

import java.util.UUID;
import java.util.function.Function;

import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.ResolvedEvent;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * EventStore 專用的事件映射器
 *
 * <p>
 * 封裝 EventStoreDB 專屬結構，上層只處理稽核事件：
 * <ul>
 * <li>每筆事件產生唯一 ID (UUID)</li>
 * <li>EventStore 的事件型別由 typeResolver 決定 (例如稽核事件的 COMMITTED / SETTLED)</li>
 * <li>內容以 JSON 保存，編解碼失敗一律視為系統錯誤</li>
 * </ul>
 * </p>
 *
 * @param <T> 事件類型
 */
public class EventStoreEventMapper<T> {

	private final ObjectMapper objectMapper;
	private final Class<T> type;
	private final Function<T, String> typeResolver;

	public EventStoreEventMapper(ObjectMapper objectMapper, Class<T> type, Function<T, String> typeResolver) {
		this.objectMapper = objectMapper;
		this.type = type;
		this.typeResolver = typeResolver;
	}

	/**
	 * @throws IllegalStateException 序列化失敗
	 */
	public EventData toEventData(T event) {
		return EventData.builderAsJson(UUID.randomUUID(), typeResolver.apply(event), encode(event)).build();
	}

	/**
	 * @throws IllegalStateException 事件資料可能已損毀
	 */
	public T toDomainEvent(ResolvedEvent resolvedEvent) {
		return decode(resolvedEvent.getEvent().getEventData());
	}

	byte[] encode(T event) {
		try {
			return objectMapper.writeValueAsBytes(event);
		} catch (JacksonException e) {
			throw new IllegalStateException(type.getSimpleName() + " JSON 序列化失敗", e);
		}
	}

	T decode(byte[] data) {
		try {
			return objectMapper.readValue(data, type);
		} catch (JacksonException e) {
			throw new IllegalStateException(type.getSimpleName() + " JSON 反序列化失敗", e);
		}
	}
}
