package com.example.wager.iface.websocket;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.springframework.stereotype.Component;

/**
 * 以玩家身分為鍵的連線登記表
 *
 * <p>
 * 每位玩家最多一條連線：新連線登記時會取代並回傳舊連線，由呼叫端負責關閉與清理。 移除時比對連線實例，舊連線的清理不會誤刪新連線。
 * </p>
 */
@Component
public class SessionRegistry {

	private final ConcurrentMap<String, SessionConnection> connections = new ConcurrentHashMap<>();

	/**
	 * @return 被取代的舊連線
	 */
	public Optional<SessionConnection> register(SessionConnection connection) {
		return Optional.ofNullable(connections.put(connection.getPlayerId(), connection));
	}

	public boolean remove(SessionConnection connection) {
		return connections.remove(connection.getPlayerId(), connection);
	}

	public Optional<SessionConnection> find(String playerId) {
		return Optional.ofNullable(connections.get(playerId));
	}

	public Collection<SessionConnection> connections() {
		return List.copyOf(connections.values());
	}

	public int size() {
		return connections.size();
	}
}
