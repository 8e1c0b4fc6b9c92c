package com.example.wager.iface.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.springframework.stereotype.Component;

import com.example.wager.application.service.GameSessionService;
import com.example.wager.config.config.WagerProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * 開放回合回收任務
 *
 * <p>
 * 開放回合平常由持有它的連線過期 (巡檢或斷線)。沒有連線持有的開放回合由此任務過期並退回保留金額：
 * <ul>
 * <li>程序啟動前留下的回合：最後活動時間早於本程序啟動時間即可回收</li>
 * <li>其餘回合：閒置超過 round-inactivity-timeout + abandoned-round-grace</li>
 * </ul>
 * </p>
 */
@Slf4j
@Component
public class AbandonedRoundReaper implements SupervisedTask {

	private final GameSessionService gameSessionService;
	private final WagerProperties properties;
	private final Clock clock;
	private final Instant startedAt;

	public AbandonedRoundReaper(GameSessionService gameSessionService, WagerProperties properties, Clock clock) {
		this.gameSessionService = gameSessionService;
		this.properties = properties;
		this.clock = clock;
		this.startedAt = clock.instant();
	}

	@Override
	public String name() {
		return "abandoned-round-reaper";
	}

	@Override
	public Duration interval() {
		return properties.getGateway().getAbandonedRoundScanInterval();
	}

	@Override
	public void runOnce() {
		reap();
	}

	/**
	 * @return 本次回收的回合數
	 */
	public int reap() {
		Instant cutoff = cutoff(clock.instant());
		int expired = gameSessionService.expireAbandonedRounds(cutoff,
				properties.getGateway().getAbandonedRoundBatchSize());
		if (expired > 0) {
			log.info(">>> [Reaper] 已回收 {} 個無人持有的開放回合 (Cutoff: {})", expired, cutoff);
		}
		return expired;
	}

	Instant cutoff(Instant now) {
		WagerProperties.Gateway config = properties.getGateway();
		Instant idleCutoff = now.minus(config.getRoundInactivityTimeout()).minus(config.getAbandonedRoundGrace());
		return idleCutoff.isAfter(startedAt) ? idleCutoff : startedAt;
	}
}
