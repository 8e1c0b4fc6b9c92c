package com.example.wager.application.domain.round;

/**
 * 結算狀態，只會單調前進：NONE → PENDING → (FAILED_PENDING_RETRY)* → SETTLED / MANUAL_INTERVENTION
 */
public enum SettlementStatus {
	NONE, // 尚未交付結算
	PENDING, // 已寫入持久化佇列
	FAILED_PENDING_RETRY, // 失敗，等待退避後重試
	SETTLED, // 已套用經濟效果
	MANUAL_INTERVENTION // 重試耗盡或稽核不符，需人工介入
}
