package com.example.wager.application.domain.error;

import lombok.Getter;

/**
 * 回合閒置逾時，回合轉為 EXPIRED 並釋放保留的下注金額。
 */
@Getter
public class RoundTimeoutException extends WagerException {

	private static final long serialVersionUID = 1L;

	private final String roundId;

	public RoundTimeoutException(String roundId, String message) {
		super(ErrorCode.ROUND_EXPIRED, message);
		this.roundId = roundId;
	}
}
