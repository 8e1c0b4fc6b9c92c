package com.example.wager.config.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.example.wager.iface.websocket.GameSessionWebSocketHandler;
import com.example.wager.iface.websocket.PlayerHandshakeInterceptor;

import lombok.RequiredArgsConstructor;

/**
 * 即時遊戲 Gateway 的 WebSocket 端點
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfiguration implements WebSocketConfigurer {

	public static final String GAME_ENDPOINT = "/ws/game";

	private final GameSessionWebSocketHandler gameSessionWebSocketHandler;
	private final PlayerHandshakeInterceptor playerHandshakeInterceptor;
	private final WagerProperties properties;

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		registry.addHandler(gameSessionWebSocketHandler, GAME_ENDPOINT).addInterceptors(playerHandshakeInterceptor)
				.setAllowedOriginPatterns(properties.getGateway().getAllowedOrigins());
	}
}
