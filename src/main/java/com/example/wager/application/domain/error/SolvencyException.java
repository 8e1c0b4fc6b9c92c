package com.example.wager.application.domain.error;

/**
 * 資金池流動性不足以支付派彩。只會升級處理，永遠不會被靜默沖銷。
 */
public class SolvencyException extends WagerException {

	private static final long serialVersionUID = 1L;

	public SolvencyException(String message) {
		super(ErrorCode.INSUFFICIENT_LIQUIDITY, message);
	}
}
