package com.example.wager.iface.schedule;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import com.example.wager.config.config.WagerProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * 背景任務監督器
 *
 * <p>
 * 金庫索引、結算 Watcher、連線巡檢與開放回合回收都由此統一啟動與停止：
 * <ul>
 * <li>隨 Spring 容器啟動 / 關閉 (SmartLifecycle)</li>
 * <li>每次執行的例外都被捕捉並記錄連續失敗次數，任務不會因此停止 (restart-on-failure)</li>
 * <li>恢復成功時記錄一次恢復訊息</li>
 * </ul>
 * </p>
 */
@Slf4j
@Component
public class BackgroundTaskSupervisor implements SmartLifecycle {

	private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

	private final List<SupervisedTask> tasks;
	private final boolean enabled;
	private final Map<String, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();

	private volatile ScheduledExecutorService executor;

	public BackgroundTaskSupervisor(List<SupervisedTask> tasks, WagerProperties properties) {
		this.tasks = tasks;
		this.enabled = properties.getTasks().isEnabled();
		tasks.forEach(task -> consecutiveFailures.put(task.name(), new AtomicInteger()));
	}

	@Override
	public synchronized void start() {
		if (executor != null) {
			return;
		}
		if (!enabled) {
			log.info(">>> [Supervisor] 背景任務已停用 (wager.tasks.enabled=false)");
			return;
		}
		CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("supervised-");
		threadFactory.setDaemon(true);
		ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(Math.max(1, tasks.size()),
				threadFactory);
		for (SupervisedTask task : tasks) {
			long intervalMillis = task.interval().toMillis();
			scheduler.scheduleWithFixedDelay(() -> runSupervised(task), intervalMillis, intervalMillis,
					TimeUnit.MILLISECONDS);
			log.info(">>> [Supervisor] 啟動任務 {} (Interval: {})", task.name(), task.interval());
		}
		this.executor = scheduler;
	}

	@Override
	public synchronized void stop() {
		ScheduledExecutorService current = executor;
		if (current == null) {
			return;
		}
		this.executor = null;
		current.shutdown();
		try {
			if (!current.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				log.warn(">>> [Supervisor] 任務未在 {} 秒內結束，強制停止", SHUTDOWN_TIMEOUT_SECONDS);
				current.shutdownNow();
			}
		} catch (InterruptedException e) {
			current.shutdownNow();
			Thread.currentThread().interrupt();
		}
		log.info(">>> [Supervisor] 背景任務已停止");
	}

	@Override
	public boolean isRunning() {
		return executor != null;
	}

	/**
	 * 執行一次任務並更新失敗計數；任何例外都不會往外拋，排程因此不會被取消
	 */
	void runSupervised(SupervisedTask task) {
		AtomicInteger failures = consecutiveFailures.computeIfAbsent(task.name(), k -> new AtomicInteger());
		try {
			task.runOnce();
			int previous = failures.getAndSet(0);
			if (previous > 0) {
				log.info(">>> [Supervisor] 任務 {} 在連續失敗 {} 次後恢復", task.name(), previous);
			}
		} catch (Exception e) {
			int count = failures.incrementAndGet();
			log.error(">>> [Supervisor] 任務 {} 執行失敗 (連續 {} 次)", task.name(), count, e);
		}
	}

	public int consecutiveFailures(String taskName) {
		AtomicInteger failures = consecutiveFailures.get(taskName);
		return failures == null ? 0 : failures.get();
	}
}
