package com.example.wager.application.domain.round;

/**
 * 公平性稽核事件類型
 */
public enum AuditEventType {
	COMMITTED, //
	RESOLVED, //
	VOIDED, //
	EXPIRED, //
	SETTLED, //
	SETTLEMENT_RETRY, //
	MANUAL_INTERVENTION
}
