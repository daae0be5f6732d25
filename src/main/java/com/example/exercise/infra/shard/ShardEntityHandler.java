package com.example.exercise.infra.shard;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

import com.example.exercise.application.domain.exercise.aggregate.UserExercisesStatistics;
import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;
import com.example.exercise.application.domain.exercise.event.JournalEntry;
import com.example.exercise.application.domain.exercise.query.UserExerciseExplicitClassificationExamples;
import com.example.exercise.application.domain.exercise.query.UserGetExerciseSuggestions;
import com.example.exercise.application.domain.exercise.query.UserScopedQuery;
import com.example.exercise.application.port.UserExercisesJournalPort;
import com.example.exercise.infra.shard.UserExercisesStatisticsEntity.PendingQuery;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>分片實體處理器 (Shard Entity Handler)</h1>
 * <p>
 * 每個分片一個實例，作為該分片 Disruptor 的唯一消費者。 分片內所有實體的狀態只在此執行緒上變更 (Single Writer Principle)。
 * </p>
 *
 * <h2>處理流程：</h2>
 * <ul>
 * <li><b>DELIVER</b>：找出或建立實體。新實體先從序號 0 完整重播，期間查詢暫存，重播完成後才回答。</li>
 * <li><b>REFRESH</b>：為每個閒置中的實體發起非同步續讀。</li>
 * <li><b>APPLY</b>：非同步讀取的結果回到本執行緒依序套用；過期結果直接丟棄。</li>
 * <li><b>PASSIVATE</b>：移除超過閒置時間的實體，狀態可由重播重建。</li>
 * </ul>
 * <p>
 * 讀取事件日誌不會阻塞本執行緒，查詢永遠以記憶體中的狀態立即回答。
 * </p>
 */
@Slf4j
public class ShardEntityHandler implements EventHandler<ShardMessage> {

	private final String shardId;
	private final UserExercisesJournalPort journal;
	private final Clock clock;
	private final Duration passivateAfter;
	private final int readBatchSize;

	/**
	 * 只由本分片執行緒寫入；使用 ConcurrentHashMap 讓監控端可安全讀取大小
	 */
	private final Map<String, UserExercisesStatisticsEntity> entities = new ConcurrentHashMap<>();

	private RingBuffer<ShardMessage> ringBuffer;

	public ShardEntityHandler(String shardId, UserExercisesJournalPort journal, Clock clock, Duration passivateAfter,
			int readBatchSize) {
		this.shardId = shardId;
		this.journal = journal;
		this.clock = clock;
		this.passivateAfter = passivateAfter;
		this.readBatchSize = readBatchSize;
	}

	/**
	 * 綁定所屬 RingBuffer，非同步讀取完成後經由它把結果送回本執行緒。 必須在 Disruptor 啟動前呼叫。
	 */
	void attach(RingBuffer<ShardMessage> ringBuffer) {
		this.ringBuffer = ringBuffer;
	}

	int liveEntityCount() {
		return entities.size();
	}

	boolean isLive(String entityId) {
		return entities.containsKey(entityId);
	}

	@Override
	public void onEvent(ShardMessage message, long sequence, boolean endOfBatch) {
		try {
			switch (message.getType()) {
			case DELIVER -> deliver(message);
			case APPLY -> applyEntries(message);
			case REFRESH -> refresh();
			case PASSIVATE -> passivate();
			default -> log.warn(">>> [Shard {}] 未知訊息類型: {}", shardId, message.getType());
			}
		} catch (Exception e) {
			// 單一訊息失敗不可中斷整個分片的消費者
			log.error(">>> [Shard {}] 處理訊息失敗 (Seq: {}, Entity: {})", shardId, sequence, message.getEntityId(), e);
			if (message.getReply() != null) {
				message.getReply().completeExceptionally(e);
			}
		} finally {
			message.clear();
		}
	}

	private void deliver(ShardMessage message) {
		UserScopedQuery query = message.getQuery();
		String entityId = message.getEntityId();
		Instant now = clock.instant();

		UserExercisesStatisticsEntity entity = entities.get(entityId);
		if (entity == null) {
			entity = new UserExercisesStatisticsEntity(query.userId(), now);
			entities.put(entityId, entity);
			entity.stash(query, message.getReply());
			log.info(">>> [Recovery] Shard {} 建立實體 {}，從 Revision 0 開始重播", shardId, entityId);
			startRead(entityId, entity);
			return;
		}

		entity.touch(now);
		if (entity.isRecovering()) {
			entity.stash(query, message.getReply());
			return;
		}
		answer(entity.getStatistics(), query, message.getReply());
	}

	private void answer(UserExercisesStatistics statistics, UserScopedQuery query, CompletableFuture<Object> reply) {
		if (query instanceof UserExerciseExplicitClassificationExamples examples) {
			reply.complete(statistics.classificationExamples(examples.sessionId(), examples.muscleGroupKeys()));
		} else if (query instanceof UserGetExerciseSuggestions) {
			reply.complete(statistics.suggestions());
		} else {
			reply.completeExceptionally(new IllegalArgumentException("不支援的查詢: " + query.getClass().getSimpleName()));
		}
	}

	private void refresh() {
		entities.forEach((entityId, entity) -> {
			if (!entity.isRecovering() && !entity.isReadInFlight()) {
				startRead(entityId, entity);
			}
		});
	}

	/**
	 * 發起非同步讀取，完成後 (不論成功或失敗) 以 APPLY 訊息送回本分片。
	 * <p>
	 * 回送在其他執行緒上進行，避免本執行緒在 RingBuffer 已滿時等待自己。
	 * </p>
	 */
	private void startRead(String entityId, UserExercisesStatisticsEntity entity) {
		UserId userId = entity.getUserId();
		long fromRevision = entity.getStatistics().nextRevision();
		entity.setReadInFlight(true);

		CompletableFuture<List<JournalEntry>> read;
		try {
			read = journal.readFrom(userId, fromRevision, readBatchSize);
		} catch (RuntimeException e) {
			read = CompletableFuture.failedFuture(e);
		}

		read.whenCompleteAsync((entries, failure) -> ringBuffer.publishEvent((message, sequence) -> {
			message.setType(ShardMessageType.APPLY);
			message.setEntityId(entityId);
			message.setEntity(entity);
			message.setFromRevision(fromRevision);
			message.setEntries(entries);
			message.setFailure(failure);
		}));
	}

	private void applyEntries(ShardMessage message) {
		String entityId = message.getEntityId();
		UserExercisesStatisticsEntity entity = message.getEntity();
		if (entities.get(entityId) != entity) {
			log.debug(">>> [Shard {}] 實體 {} 已被移除或重建，丟棄過期讀取結果", shardId, entityId);
			return;
		}
		entity.setReadInFlight(false);

		if (message.getFailure() != null) {
			fail(entityId, entity, unwrap(message.getFailure()));
			return;
		}

		UserExercisesStatistics statistics = entity.getStatistics();
		if (message.getFromRevision() != statistics.nextRevision()) {
			log.debug(">>> [Shard {}] 實體 {} 讀取起點 {} 已過期 (目前 {})", shardId, entityId, message.getFromRevision(),
					statistics.nextRevision());
			return;
		}

		List<JournalEntry> entries = message.getEntries();
		try {
			statistics.applyAll(entries);
		} catch (RuntimeException e) {
			fail(entityId, entity, e);
			return;
		}

		if (!entries.isEmpty()) {
			entity.touch(clock.instant());
			log.debug(">>> [Refresh] 實體 {} 套用 {} 筆事件，目前 Revision {}", entityId, entries.size(),
					statistics.getVersion());
		}

		// 讀滿一批代表可能還有更多事件，繼續補齊
		if (entries.size() >= readBatchSize) {
			startRead(entityId, entity);
			return;
		}

		if (entity.isRecovering()) {
			List<PendingQuery> pending = entity.finishRecovery();
			log.info(">>> [Recovery] 實體 {} 重播完成 (Revision {})，回覆 {} 筆暫存查詢", entityId, statistics.getVersion(),
					pending.size());
			pending.forEach(p -> answer(statistics, p.query(), p.reply()));
		}
	}

	/**
	 * 實體狀態不可信：移除實體並讓暫存查詢失敗，下次存取時重建
	 */
	private void fail(String entityId, UserExercisesStatisticsEntity entity, Throwable cause) {
		entities.remove(entityId);
		List<PendingQuery> pending = entity.drainStash();
		log.error(">>> [Shard {}] 實體 {} 重播失敗，已移除 (暫存查詢 {} 筆): {}", shardId, entityId, pending.size(),
				cause.getMessage(), cause);
		pending.forEach(p -> p.reply().completeExceptionally(cause));
	}

	private void passivate() {
		Instant threshold = clock.instant().minus(passivateAfter);
		Iterator<Map.Entry<String, UserExercisesStatisticsEntity>> it = entities.entrySet().iterator();
		while (it.hasNext()) {
			Map.Entry<String, UserExercisesStatisticsEntity> e = it.next();
			if (e.getValue().isIdleSince(threshold) && e.getValue().getStash().isEmpty()) {
				it.remove();
				log.info(">>> [Passivate] Shard {} 移除閒置實體 {} (最後活動: {})", shardId, e.getKey(),
						e.getValue().getLastActivity());
			}
		}
	}

	private static Throwable unwrap(Throwable failure) {
		return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
	}
}
