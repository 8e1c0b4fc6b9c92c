package com.example.wager.application.domain.settlement;

/**
 * 單次結算處理的結果，由 SettlementHandler 寫回 Disruptor 事件載體，供下游 Journal 使用
 */
public enum SettlementOutcome {
	APPLIED, // 成功套用餘額變動
	DUPLICATE, // 冪等標記已存在，本次為 no-op
	RETRY_SCHEDULED, // 失敗，已排定重試
	ESCALATED, // 升級人工介入
	SKIPPED // 回合不存在或狀態不符
}
