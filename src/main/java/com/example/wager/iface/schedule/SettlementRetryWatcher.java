package com.example.wager.iface.schedule;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import org.springframework.stereotype.Component;

import com.example.wager.application.domain.round.Round;
import com.example.wager.application.port.RoundRepositoryPort;
import com.example.wager.application.port.SettlementQueuePort;
import com.example.wager.config.config.WagerProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 結算 Watcher 職責：從持久化佇列撿起到期的回合重新發布。
 *
 * <ul>
 * <li>程序重啟前尚未結算的回合</li>
 * <li>發布時 RingBuffer 已滿的回合</li>
 * <li>退避時間已到、等待重試的回合</li>
 * </ul>
 * 重複發布由冪等標記吸收。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementRetryWatcher implements SupervisedTask {

	public static final String SOURCE_WATCHER = "WATCHER";

	private final RoundRepositoryPort roundRepository;
	private final SettlementQueuePort settlementQueue;
	private final WagerProperties properties;
	private final Clock clock;

	@Override
	public String name() {
		return "settlement-watcher";
	}

	@Override
	public Duration interval() {
		return properties.getSettlement().getWatchInterval();
	}

	@Override
	public void runOnce() {
		watchForDueSettlements();
	}

	/**
	 * @return 本次重新發布的筆數
	 */
	public int watchForDueSettlements() {
		List<Round> due = roundRepository.findDueForSettlement(clock.instant(),
				properties.getSettlement().getWatchBatchSize());
		int published = 0;
		for (Round round : due) {
			if (!settlementQueue.publish(round, SOURCE_WATCHER)) {
				log.warn(">>> [Watcher] 結算佇列已滿，剩餘 {} 筆留待下次", due.size() - published);
				break;
			}
			published++;
			log.info(">>> [Watcher] 重新發布回合 {} (Status: {}, Attempts: {})", round.getRoundId(),
					round.getSettlementStatus(), round.getSettlementAttempts());
		}
		return published;
	}
}
