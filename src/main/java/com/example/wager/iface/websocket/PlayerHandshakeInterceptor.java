package com.example.wager.iface.websocket;

import java.security.Principal;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import com.example.wager.application.service.PlayerAccountService;

import lombok.extern.slf4j.Slf4j;

/**
 * 握手時決定玩家身分：優先使用已認證的 Principal，否則取 query 參數 address (錢包位址)。 身分缺漏、格式錯誤或超過 64 字元時拒絕連線。
 */
@Slf4j
@Component
public class PlayerHandshakeInterceptor implements HandshakeInterceptor {

	public static final String PLAYER_ID = "playerId";

	@Override
	public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler,
			Map<String, Object> attributes) {
		String playerId = resolvePlayerId(request);
		if (!PlayerAccountService.isValidPlayerId(playerId)) {
			log.warn(">>> [Gateway] 拒絕未識別身分的連線: {}", request.getRemoteAddress());
			response.setStatusCode(HttpStatus.UNAUTHORIZED);
			return false;
		}
		attributes.put(PLAYER_ID, playerId);
		return true;
	}

	@Override
	public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler,
			Exception exception) {
		// no-op
	}

	private String resolvePlayerId(ServerHttpRequest request) {
		Principal principal = request.getPrincipal();
		if (principal != null) {
			return principal.getName();
		}
		return UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst("address");
	}
}
