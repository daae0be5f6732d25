package com.example.exercise.infra.shard;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.example.exercise.application.domain.exercise.query.UserScopedQuery;
import com.example.exercise.application.port.UserExercisesJournalPort;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.util.DaemonThreadFactory;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>分片區域 (Shard Region)</h1>
 * <p>
 * 行程內的實體放置層：每個分片各有一個 Disruptor 與單一消費者 {@link ShardEntityHandler}。
 * 同一使用者的所有訊息經 {@link ShardRouter} 落在同一分片而被序列化處理；不同分片之間完全並行。
 * </p>
 */
@Slf4j
public class ShardRegion {

	private final ShardRouter router;
	private final List<Disruptor<ShardMessage>> disruptors = new ArrayList<>();
	private final List<RingBuffer<ShardMessage>> ringBuffers = new ArrayList<>();
	private final List<ShardEntityHandler> handlers = new ArrayList<>();

	/**
	 * @param router         分片路由器
	 * @param journal        事件日誌讀取 Port
	 * @param clock          時鐘，用於閒置判定
	 * @param ringBufferSize 每個分片的 RingBuffer 容量 (2 的次方)
	 * @param passivateAfter 閒置多久後移除實體
	 * @param readBatchSize  單次讀取事件上限
	 */
	public ShardRegion(ShardRouter router, UserExercisesJournalPort journal, Clock clock, int ringBufferSize,
			Duration passivateAfter, int readBatchSize) {
		if (readBatchSize <= 0) {
			throw new IllegalArgumentException("readBatchSize 必須大於 0: " + readBatchSize);
		}
		this.router = router;
		for (int i = 0; i < router.getShardCount(); i++) {
			ShardEntityHandler handler = new ShardEntityHandler(String.valueOf(i), journal, clock, passivateAfter,
					readBatchSize);
			Disruptor<ShardMessage> disruptor = new Disruptor<>(ShardMessage::new, ringBufferSize,
					DaemonThreadFactory.INSTANCE);
			disruptor.handleEventsWith(handler);
			handler.attach(disruptor.getRingBuffer());
			disruptor.start();

			disruptors.add(disruptor);
			ringBuffers.add(disruptor.getRingBuffer());
			handlers.add(handler);
		}
		log.info(">>> [Shard] 分片區域已啟動，分片數: {}，閒置移除: {}", router.getShardCount(), passivateAfter);
	}

	/**
	 * 將查詢投遞給使用者所屬分片上的實體 (必要時建立並重播)。
	 *
	 * @return 查詢結果；實體重播失敗時以例外完成
	 */
	public CompletableFuture<Object> ask(UserScopedQuery query) {
		RouteKey routeKey = router.route(query);
		CompletableFuture<Object> reply = new CompletableFuture<>();
		ringBuffers.get(Integer.parseInt(routeKey.shardId())).publishEvent((message, sequence) -> {
			message.setType(ShardMessageType.DELIVER);
			message.setEntityId(routeKey.entityId());
			message.setQuery(query);
			message.setReply(reply);
		});
		return reply;
	}

	/**
	 * 通知所有分片為存活實體發起續讀
	 */
	public void refreshAll() {
		broadcast(ShardMessageType.REFRESH);
	}

	/**
	 * 通知所有分片移除閒置實體
	 */
	public void passivateIdle() {
		broadcast(ShardMessageType.PASSIVATE);
	}

	public int liveEntityCount() {
		return handlers.stream().mapToInt(ShardEntityHandler::liveEntityCount).sum();
	}

	public boolean isLive(UserScopedQuery query) {
		RouteKey routeKey = router.route(query);
		return handlers.get(Integer.parseInt(routeKey.shardId())).isLive(routeKey.entityId());
	}

	public void shutdown() {
		log.info(">>> [Shard] 分片區域停止中...");
		disruptors.forEach(Disruptor::halt);
	}

	private void broadcast(ShardMessageType type) {
		ringBuffers.forEach(ringBuffer -> ringBuffer.publishEvent((message, sequence) -> message.setType(type)));
	}
}
