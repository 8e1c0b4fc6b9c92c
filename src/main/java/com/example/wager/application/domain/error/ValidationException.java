package com.example.wager.application.domain.error;

/**
 * 輸入格式錯誤或超出範圍：立即拒絕，不改變任何狀態。
 */
public class ValidationException extends WagerException {

	private static final long serialVersionUID = 1L;

	public ValidationException(ErrorCode code, String message) {
		super(code, message);
	}
}
