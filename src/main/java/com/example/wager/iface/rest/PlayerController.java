package com.example.wager.iface.rest;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.wager.application.service.PlayerAccountService;
import com.example.wager.iface.dto.req.DepositResource;
import com.example.wager.iface.dto.res.PlayerBalanceResource;
import com.example.wager.iface.dto.res.PlayerQueriedResource;
import com.example.wager.iface.dto.res.RoundSummaryResource;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 玩家餘額與回合歷史
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/players")
public class PlayerController {

	private final PlayerAccountService playerAccountService;

	/**
	 * 存入可下注餘額
	 */
	@PostMapping("/{id}/deposit")
	public ResponseEntity<PlayerQueriedResource> deposit(@PathVariable String id,
			@Valid @RequestBody DepositResource request) {
		PlayerBalanceResource balance = PlayerBalanceResource
				.from(playerAccountService.deposit(id, request.getAmount()));
		return ResponseEntity.ok(new PlayerQueriedResource("200", "存款成功", balance));
	}

	@GetMapping("/{id}")
	public ResponseEntity<?> getBalance(@PathVariable String id) {
		return playerAccountService.getBalance(id)
				.<ResponseEntity<?>>map(projection -> ResponseEntity
						.ok(new PlayerQueriedResource("200", "查詢成功", PlayerBalanceResource.from(projection))))
				.orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
						.body(Map.of("message", "找不到該玩家", "playerId", id)));
	}

	/**
	 * 最近的回合 (新到舊，最多 100 筆)
	 */
	@GetMapping("/{id}/rounds")
	public ResponseEntity<List<RoundSummaryResource>> getRounds(@PathVariable String id,
			@RequestParam(defaultValue = "20") int limit) {
		return ResponseEntity
				.ok(playerAccountService.recentRounds(id, limit).stream().map(RoundSummaryResource::from).toList());
	}
}
