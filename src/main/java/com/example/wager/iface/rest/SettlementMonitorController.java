package com.example.wager.iface.rest;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.wager.application.service.SettlementQueryService;

import lombok.RequiredArgsConstructor;

/**
 * 結算狀態監控 API
 */
@RestController
@RequestMapping("/api/settlements")
@RequiredArgsConstructor
public class SettlementMonitorController {

	private final SettlementQueryService settlementQueryService;

	/**
	 * 查詢回合結算狀態 GET /api/settlements/{roundId}
	 */
	@GetMapping("/{roundId}")
	public ResponseEntity<?> getSettlementStatus(@PathVariable String roundId) {
		return settlementQueryService.getStatus(roundId).<ResponseEntity<?>>map(ResponseEntity::ok)
				.orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
						.body(Map.of("message", "找不到該回合紀錄", "roundId", roundId)));
	}
}
