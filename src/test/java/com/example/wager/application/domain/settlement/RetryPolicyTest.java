package com.example.wager.application.domain.settlement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

	private final RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(2), Duration.ofSeconds(10));

	@Test
	@DisplayName("退避時間倍增並以上限封頂")
	void backoffDoublesUpToCap() {
		assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofSeconds(2));
		assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofSeconds(4));
		assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofSeconds(8));
		assertThat(policy.delayAfter(4)).isEqualTo(Duration.ofSeconds(10));
		assertThat(policy.delayAfter(64)).isEqualTo(Duration.ofSeconds(10));
	}

	@Test
	@DisplayName("失敗次數達上限即耗盡")
	void exhaustion() {
		assertThat(policy.isExhausted(4)).isFalse();
		assertThat(policy.isExhausted(5)).isTrue();
	}

	@Test
	@DisplayName("不合理的設定被拒絕")
	void invalidConfiguration() {
		assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(1)))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(5), Duration.ofSeconds(1)))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
