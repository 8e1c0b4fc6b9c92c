package com.example.wager.infra.adapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.StreamNotFoundException;
import com.example.wager.application.domain.error.TransientInfrastructureException;
import com.example.wager.application.domain.round.RoundAuditEvent;
import com.example.wager.application.port.FairnessAuditPort;
import com.example.wager.infra.event.mapper.EventStoreEventMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 稽核事件寫入 EventStoreDB，每個回合一條 Stream：Round-{roundId}
 *
 * <p>
 * 寫入為非同步，失敗只記錄錯誤，不阻塞遊戲流程或結算管線。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "wager.audit.event-store.enabled", havingValue = "true")
public class EventStoreFairnessAuditAdapter implements FairnessAuditPort {

	private static final String STREAM_PREFIX = "Round-";

	private final EventStoreDBClient client;
	private final EventStoreEventMapper<RoundAuditEvent> mapper;

	@Override
	public void record(RoundAuditEvent event) {
		String streamName = STREAM_PREFIX + event.roundId();
		EventData eventData = mapper.toEventData(event);

		client.appendToStream(streamName, eventData).thenAccept(result -> {
			log.debug(">>> [Audit] EventStore 寫入成功: Stream={}, Version={}", streamName,
					result.getNextExpectedRevision());
		}).exceptionally(ex -> {
			log.error(">>> [Audit] EventStore 寫入失敗 (Stream: {}): {}", streamName, ex.getMessage());
			return null;
		});
	}

	/**
	 * 依回合分組後，每條 Stream 一次追加
	 */
	@Override
	public void recordAll(List<RoundAuditEvent> events) {
		Map<String, List<EventData>> byStream = new LinkedHashMap<>();
		events.forEach(event -> byStream.computeIfAbsent(STREAM_PREFIX + event.roundId(), k -> new ArrayList<>())
				.add(mapper.toEventData(event)));

		byStream.forEach((streamName, batch) -> client.appendToStream(streamName, batch.iterator())
				.exceptionally(ex -> {
					log.error(">>> [Audit] EventStore 批次寫入失敗 (Stream: {}, Size: {}): {}", streamName,
							batch.size(), ex.getMessage());
					return null;
				}));
	}

	@Override
	public List<RoundAuditEvent> findByRound(String roundId) {
		try {
			return client.readStream(STREAM_PREFIX + roundId, ReadStreamOptions.get().forwards().fromStart()).get()
					.getEvents().stream().map(mapper::toDomainEvent).toList();
		} catch (ExecutionException e) {
			if (e.getCause() instanceof StreamNotFoundException) {
				return List.of();
			}
			throw new TransientInfrastructureException("讀取稽核 Stream 失敗: " + roundId, e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TransientInfrastructureException("讀取稽核 Stream 被中斷: " + roundId, e);
		}
	}
}
