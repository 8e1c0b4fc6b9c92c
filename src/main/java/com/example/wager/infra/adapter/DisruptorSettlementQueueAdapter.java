package com.example.wager.infra.adapter;

import org.springframework.stereotype.Component;

import com.example.wager.application.domain.round.Round;
import com.example.wager.application.domain.settlement.SettlementEvent;
import com.example.wager.application.port.SettlementQueuePort;
import com.lmax.disruptor.RingBuffer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 結算佇列的 Disruptor 實作
 *
 * <p>
 * 以 tryPublishEvent 發布，RingBuffer 已滿時立即回傳 false 而不是阻塞連線任務； 回合已在資料庫中標記為
 * PENDING，Watcher 會在寬限時間後重新發布。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DisruptorSettlementQueueAdapter implements SettlementQueuePort {

	private final RingBuffer<SettlementEvent> settlementRingBuffer;

	@Override
	public boolean publish(Round round, String source) {
		boolean published = settlementRingBuffer.tryPublishEvent(
				(event, sequence) -> event.reset(round.getRoundId(), round.getPlayerId(), round.getPayout(), source));
		if (published) {
			log.debug(">>> [Bus] 回合 {} 已送入結算佇列 (Source: {})", round.getRoundId(), source);
		}
		return published;
	}
}
