package com.example.wager.iface.handler;

import org.springframework.stereotype.Component;

import com.example.wager.application.domain.settlement.SettlementEvent;
import com.example.wager.application.domain.settlement.SettlementOutcome;
import com.example.wager.application.service.SettlementService;
import com.lmax.disruptor.EventHandler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 結算業務處理器 (Disruptor 第一階段)
 *
 * <p>
 * 資金池的單一寫入者。事件載體只攜帶 roundId，實際的回合資料由 {@link SettlementService} 從資料庫讀取。
 * 與發起的連線完全脫鉤，連線中斷不會取消進行中的結算。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementHandler implements EventHandler<SettlementEvent> {

	private final SettlementService settlementService;

	@Override
	public void onEvent(SettlementEvent event, long sequence, boolean endOfBatch) {
		try {
			settlementService.settle(event);
		} catch (RuntimeException e) {
			// 未預期的錯誤：回合仍留在資料庫佇列中，到期後由 Watcher 重新發布
			log.error(">>> [Settlement] 回合 {} 處理時發生未預期錯誤 (Seq: {})", event.getRoundId(), sequence, e);
			event.setOutcome(SettlementOutcome.SKIPPED);
			event.setDetail(e.getMessage());
		}
	}
}
