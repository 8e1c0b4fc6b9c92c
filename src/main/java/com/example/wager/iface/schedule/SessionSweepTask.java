package com.example.wager.iface.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import com.example.wager.config.config.WagerProperties;
import com.example.wager.iface.websocket.GameMessageDispatcher;
import com.example.wager.iface.websocket.GameSessionWebSocketHandler;
import com.example.wager.iface.websocket.SessionConnection;
import com.example.wager.iface.websocket.SessionRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 連線巡檢
 *
 * <pre>
 * 1. 超過 heartbeat-interval 沒有任何流量：送出 heartbeat (WebSocket ping)
 * 2. heartbeat 送出後超過 heartbeat-timeout 仍無回應：斷線並清理
 * 3. 開放中的回合閒置逾時：於該連線的信箱中過期回合
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionSweepTask implements SupervisedTask {

	private final SessionRegistry registry;
	private final GameSessionWebSocketHandler gatewayHandler;
	private final GameMessageDispatcher dispatcher;
	private final WagerProperties properties;
	private final Clock clock;

	@Override
	public String name() {
		return "session-sweep";
	}

	@Override
	public Duration interval() {
		return properties.getGateway().getSweepInterval();
	}

	@Override
	public void runOnce() {
		sweep();
	}

	public void sweep() {
		Instant now = clock.instant();
		WagerProperties.Gateway config = properties.getGateway();
		for (SessionConnection connection : registry.connections()) {
			if (connection.isHeartbeatOverdue(now, config.getHeartbeatTimeout())) {
				log.warn(">>> [Sweep] 玩家 {} heartbeat 逾時，中斷連線", connection.getPlayerId());
				connection.close(CloseStatus.SESSION_NOT_RELIABLE);
				gatewayHandler.cleanup(connection);
				continue;
			}
			if (connection.isIdle(now, config.getHeartbeatInterval())) {
				connection.sendHeartbeat(now);
			}
			connection.getMailbox().submit(() -> dispatcher.sweep(connection));
		}
	}
}
