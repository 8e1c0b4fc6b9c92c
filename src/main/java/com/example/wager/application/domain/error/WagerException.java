package com.example.wager.application.domain.error;

import lombok.Getter;

/**
 * 下注引擎的例外基底類別
 * <p>
 * 所有業務例外皆為 unchecked，並攜帶 {@link ErrorCode} 以便 Gateway 轉換為 error 訊息。
 * </p>
 */
@Getter
public abstract class WagerException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorCode code;

	protected WagerException(ErrorCode code, String message) {
		super(message);
		this.code = code;
	}

	protected WagerException(ErrorCode code, String message, Throwable cause) {
		super(message, cause);
		this.code = code;
	}
}
