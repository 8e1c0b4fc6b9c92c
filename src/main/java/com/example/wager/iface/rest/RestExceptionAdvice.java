package com.example.wager.iface.rest;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.ValidationException;
import com.example.wager.application.domain.error.WagerException;

import lombok.extern.slf4j.Slf4j;

/**
 * REST 端點的錯誤回應格式 {code, message}
 */
@Slf4j
@RestControllerAdvice
public class RestExceptionAdvice {

	@ExceptionHandler(ValidationException.class)
	public ResponseEntity<Map<String, String>> handleValidation(ValidationException e) {
		return ResponseEntity.badRequest().body(Map.of("code", e.getCode().name(), "message", e.getMessage()));
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ResponseEntity<Map<String, String>> handleInvalidArgument(MethodArgumentNotValidException e) {
		String message = e.getBindingResult().getFieldErrors().stream().findFirst()
				.map(error -> error.getField() + ": " + error.getDefaultMessage()).orElse("請求格式錯誤");
		return ResponseEntity.badRequest().body(Map.of("code", ErrorCode.INVALID_MESSAGE.name(), "message", message));
	}

	@ExceptionHandler(WagerException.class)
	public ResponseEntity<Map<String, String>> handleWager(WagerException e) {
		log.warn(">>> [Rest] 請求失敗 ({}): {}", e.getCode(), e.getMessage());
		return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
				.body(Map.of("code", e.getCode().name(), "message", e.getMessage()));
	}
}
