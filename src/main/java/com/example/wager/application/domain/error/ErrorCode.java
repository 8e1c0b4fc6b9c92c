package com.example.wager.application.domain.error;

/**
 * 對外回報的錯誤代碼 (出現在 WebSocket error 訊息與 REST 回應中)
 */
public enum ErrorCode {
	INVALID_MESSAGE, // 訊息格式錯誤
	UNKNOWN_TYPE, // 未知的訊息類型
	INVALID_WAGER, // 下注金額非正數或超過上限
	INVALID_CHOICE, // 不認得的選項
	INVALID_COMMITMENT, // 承諾雜湊格式錯誤
	INVALID_NONCE, // nonce 格式錯誤
	ROUND_ALREADY_OPEN, // 同一 Session 已有進行中的回合
	NO_OPEN_ROUND, // 沒有可揭示的回合
	INSUFFICIENT_BALANCE, // 玩家可用餘額不足
	FAIRNESS_VIOLATION, // 承諾與揭示不符
	ROUND_EXPIRED, // 回合逾時
	INFRASTRUCTURE_ERROR, // 資料庫 / 帳本暫時性故障
	INSUFFICIENT_LIQUIDITY, // 資金池流動性不足
	INTERNAL_ERROR
}
