package com.example.wager.application.domain.round;

/**
 * 回合狀態
 *
 * <pre>
 * AWAITING_COMMITMENT → AWAITING_REVEAL → RESOLVED → SETTLED
 *          └──────────────┴──→ EXPIRED / VOIDED
 * </pre>
 */
public enum RoundState {
	AWAITING_COMMITMENT, //
	AWAITING_REVEAL, //
	RESOLVED, //
	SETTLED, // 終態：結算完成
	EXPIRED, // 終態：逾時或斷線
	VOIDED; // 終態：承諾驗證失敗

	public boolean isOpen() {
		return this == AWAITING_COMMITMENT || this == AWAITING_REVEAL;
	}

	public boolean isTerminal() {
		return this == SETTLED || this == EXPIRED || this == VOIDED;
	}
}
