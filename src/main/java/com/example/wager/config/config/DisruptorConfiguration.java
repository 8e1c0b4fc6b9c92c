package com.example.wager.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.wager.application.domain.settlement.SettlementEvent;
import com.example.wager.iface.handler.SettlementHandler;
import com.example.wager.iface.handler.SettlementJournalHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.util.DaemonThreadFactory;

import lombok.extern.slf4j.Slf4j;

/**
 * LMAX Disruptor 設定類 (結算管線)
 *
 * <p>
 * 資金池餘額是唯一會被多筆結算同時修改的資源，所有結算都經過同一個 RingBuffer， 由單一消費者執行緒依序處理
 * (Single Writer Principle)。
 * </p>
 *
 * <p>
 * Handler 串接順序：
 * <ol>
 * <li>{@link SettlementHandler}：重新驗證並以單一交易套用餘額變動</li>
 * <li>{@link SettlementJournalHandler}：將本批結算結果寫入公平性稽核日誌</li>
 * </ol>
 * </p>
 */
@Slf4j
@Configuration
public class DisruptorConfiguration {

	/**
	 * 建立並啟動結算 Disruptor，Spring 關閉時呼叫 shutdown 等待已發布的事件處理完畢
	 */
	@Bean(destroyMethod = "shutdown")
	public Disruptor<SettlementEvent> settlementDisruptor(WagerProperties properties,
			SettlementHandler settlementHandler, SettlementJournalHandler journalHandler) {

		// RingBuffer 容量需為 2 的次方
		Disruptor<SettlementEvent> disruptor = new Disruptor<>(SettlementEvent::new,
				properties.getSettlement().getRingBufferSize(), DaemonThreadFactory.INSTANCE);

		disruptor.handleEventsWith(settlementHandler).then(journalHandler);

		// 單筆事件失敗不可讓消費者執行緒停止，回合仍在資料庫佇列中，由 Watcher 重新發布
		disruptor.setDefaultExceptionHandler(new SettlementExceptionHandler());
		disruptor.start();
		log.info(">>> [Disruptor] 結算管線已啟動 (RingBuffer: {})", properties.getSettlement().getRingBufferSize());
		return disruptor;
	}

	/**
	 * 結算事件的唯一入口
	 */
	@Bean
	public RingBuffer<SettlementEvent> settlementRingBuffer(Disruptor<SettlementEvent> settlementDisruptor) {
		return settlementDisruptor.getRingBuffer();
	}

	static class SettlementExceptionHandler implements ExceptionHandler<SettlementEvent> {

		@Override
		public void handleEventException(Throwable ex, long sequence, SettlementEvent event) {
			log.error(">>> [Disruptor] 結算事件處理失敗 (Seq: {}, Round: {})", sequence,
					event == null ? null : event.getRoundId(), ex);
		}

		@Override
		public void handleOnStartException(Throwable ex) {
			log.error(">>> [Disruptor] 結算管線啟動失敗", ex);
		}

		@Override
		public void handleOnShutdownException(Throwable ex) {
			log.error(">>> [Disruptor] 結算管線關閉失敗", ex);
		}
	}
}
