package com.example.wager.application.domain.settlement;

import java.time.Duration;

/**
 * 有上限的指數退避策略
 *
 * @param maxAttempts    最多嘗試次數 (含第一次)
 * @param initialBackoff 第一次失敗後的等待時間
 * @param maxBackoff     單次等待上限
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

	public RetryPolicy {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts 必須至少為 1");
		}
		if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
			throw new IllegalArgumentException("退避時間設定錯誤");
		}
	}

	/**
	 * 第 N 次失敗後的等待時間：initial * 2^(N-1)，不超過 maxBackoff
	 *
	 * @param failedAttempts 目前已失敗次數 (>= 1)
	 */
	public Duration delayAfter(int failedAttempts) {
		int exponent = Math.max(0, Math.min(failedAttempts - 1, 30));
		Duration delay = initialBackoff.multipliedBy(1L << exponent);
		return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
	}

	/**
	 * 失敗次數是否已達上限
	 */
	public boolean isExhausted(int failedAttempts) {
		return failedAttempts >= maxAttempts;
	}
}
