package com.example.wager.application.domain.error;

/**
 * 帳本讀取或持久化寫入的暫時性故障，由呼叫端以退避策略重試。
 */
public class TransientInfrastructureException extends WagerException {

	private static final long serialVersionUID = 1L;

	public TransientInfrastructureException(String message) {
		super(ErrorCode.INFRASTRUCTURE_ERROR, message);
	}

	public TransientInfrastructureException(String message, Throwable cause) {
		super(ErrorCode.INFRASTRUCTURE_ERROR, message, cause);
	}
}
