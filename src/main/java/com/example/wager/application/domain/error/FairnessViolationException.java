package com.example.wager.application.domain.error;

import lombok.Getter;

/**
 * 承諾驗證失敗：回合作廢、永不重試，並且必須寫入稽核紀錄。
 */
@Getter
public class FairnessViolationException extends WagerException {

	private static final long serialVersionUID = 1L;

	private final String roundId;

	public FairnessViolationException(String roundId, String message) {
		super(ErrorCode.FAIRNESS_VIOLATION, message);
		this.roundId = roundId;
	}
}
