package com.example.wager.config.config;

import java.math.BigDecimal;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.example.wager.application.domain.fairness.FairnessPrimitives;
import com.example.wager.application.domain.settlement.RetryPolicy;

import lombok.Data;

/**
 * 下注引擎設定 (對應 application.yml 中的 wager.*)
 */
@Data
@ConfigurationProperties(prefix = "wager")
public class WagerProperties {

	private Fairness fairness = new Fairness();
	private Gateway gateway = new Gateway();
	private Settlement settlement = new Settlement();
	private Pool pool = new Pool();
	private Vault vault = new Vault();
	private Tasks tasks = new Tasks();

	@Data
	public static class Fairness {
		/**
		 * 莊家優勢 (basis points)，每個回合建立時寫入，結算時以回合上的值重新計算
		 */
		private int houseEdgeBps = FairnessPrimitives.DEFAULT_HOUSE_EDGE_BPS;

		/**
		 * 單注上限 (最小貨幣單位)
		 */
		private long maxWager = 1_000_000_000L;
	}

	@Data
	public static class Gateway {
		/**
		 * 連線無流量超過此時間即送出 heartbeat
		 */
		private Duration heartbeatInterval = Duration.ofSeconds(15);

		/**
		 * heartbeat 送出後等待回應的上限，逾時即斷線
		 */
		private Duration heartbeatTimeout = Duration.ofSeconds(10);

		/**
		 * 開放中的回合無活動超過此時間即過期
		 */
		private Duration roundInactivityTimeout = Duration.ofSeconds(60);

		/**
		 * Session 巡檢頻率
		 */
		private Duration sweepInterval = Duration.ofSeconds(1);

		/**
		 * 沒有連線持有的開放回合 (例如程序重啟前留下的) 在閒置上限再加上此寬限後由回收任務過期
		 */
		private Duration abandonedRoundGrace = Duration.ofSeconds(30);

		private Duration abandonedRoundScanInterval = Duration.ofSeconds(15);

		private int abandonedRoundBatchSize = 100;

		/**
		 * 單一訊息最大位元組數
		 */
		private int sendBufferSizeLimit = 64 * 1024;

		/**
		 * 單次送出的逾時 (毫秒)
		 */
		private int sendTimeLimitMillis = 5_000;

		private String[] allowedOrigins = { "*" };
	}

	@Data
	public static class Settlement {
		/**
		 * RingBuffer 容量，必須為 2 的次方
		 */
		private int ringBufferSize = 1024;

		private int maxAttempts = 5;
		private Duration initialBackoff = Duration.ofSeconds(2);
		private Duration maxBackoff = Duration.ofMinutes(5);

		/**
		 * 交付後給正常路徑的寬限時間，超過後 Watcher 才會重新發布
		 */
		private Duration recoveryGrace = Duration.ofSeconds(30);

		/**
		 * 單一回合淨流出不得超過金庫總資產的比例 (basis points)
		 */
		private int maxPayoutExposureBps = 100;

		/**
		 * 資金池需要付出時，是否要求未過期的金庫快照
		 */
		private boolean requireFreshSnapshot = true;

		private Duration watchInterval = Duration.ofSeconds(5);

		private int watchBatchSize = 100;

		public RetryPolicy retryPolicy() {
			return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff);
		}
	}

	@Data
	public static class Pool {
		private String id = "HOUSE";
		private long initialBalance = 0L;
	}

	@Data
	public static class Vault {
		/**
		 * 關閉時不建立 web3j 帳本讀取器 (測試以替身取代)
		 */
		private boolean enabled = true;
		private String rpcUrl = "";
		private String contractAddress = "";
		private int assetDecimals = 6;
		private int shareDecimals = 9;
		private Duration refreshInterval = Duration.ofSeconds(15);
		private Duration stalenessThreshold = Duration.ofMinutes(2);
		private int historySize = 240;
		private Duration minPersistInterval = Duration.ofMinutes(5);
		private BigDecimal priceChangeThreshold = new BigDecimal("0.0001");
		private int retentionDays = 90;
	}

	@Data
	public static class Tasks {
		/**
		 * 是否啟動背景任務監督器 (測試時關閉，改由測試直接呼叫)
		 */
		private boolean enabled = true;
	}
}
