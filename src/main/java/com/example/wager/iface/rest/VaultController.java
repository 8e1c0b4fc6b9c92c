package com.example.wager.iface.rest;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.wager.application.domain.error.ErrorCode;
import com.example.wager.application.domain.error.ValidationException;
import com.example.wager.application.service.VaultLedgerCache;
import com.example.wager.iface.dto.res.VaultSnapshotResource;

import lombok.RequiredArgsConstructor;

/**
 * 金庫估值查詢
 */
@RestController
@RequestMapping("/api/vault")
@RequiredArgsConstructor
public class VaultController {

	private static final Map<String, Duration> PERIODS = Map.of("1d", Duration.ofDays(1), "7d", Duration.ofDays(7),
			"30d", Duration.ofDays(30));

	private final VaultLedgerCache vaultLedgerCache;

	@GetMapping("/latest")
	public ResponseEntity<?> latest() {
		return vaultLedgerCache.latestSnapshot().<ResponseEntity<?>>map(view -> ResponseEntity.ok(VaultSnapshotResource.from(view)))
				.orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", "尚無金庫快照")));
	}

	/**
	 * 歷史估值 GET /api/vault/history?period=1d|7d|30d
	 */
	@GetMapping("/history")
	public ResponseEntity<List<VaultSnapshotResource>> history(@RequestParam(defaultValue = "7d") String period) {
		Duration window = PERIODS.get(period);
		if (window == null) {
			throw new ValidationException(ErrorCode.INVALID_MESSAGE, "period 必須為 1d、7d 或 30d");
		}
		return ResponseEntity
				.ok(vaultLedgerCache.history(window).stream().map(VaultSnapshotResource::from).toList());
	}

	/**
	 * 記憶體中的近期快照 (含尚未持久化的最新幾筆)，由舊到新
	 */
	@GetMapping("/recent")
	public ResponseEntity<List<VaultSnapshotResource>> recent() {
		return ResponseEntity
				.ok(vaultLedgerCache.recentHistory().stream().map(VaultSnapshotResource::from).toList());
	}
}
