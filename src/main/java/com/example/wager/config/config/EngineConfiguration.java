package com.example.wager.config.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * 引擎共用的基礎元件
 */
@Configuration
public class EngineConfiguration {

	/**
	 * 所有逾時、退避與快照新鮮度的判斷都以同一個 {@link Clock} 為準
	 */
	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	/**
	 * 連線訊息的共用執行緒池。每條連線的訊息經由自己的 SessionMailbox 依序送入，同一條連線同一時間只會佔用一條執行緒。
	 */
	@Bean(destroyMethod = "shutdown")
	public ExecutorService sessionExecutor() {
		CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("session-");
		threadFactory.setDaemon(true);
		return Executors.newFixedThreadPool(Math.max(4, Runtime.getRuntime().availableProcessors() * 2),
				threadFactory);
	}
}
