package com.example.exercise.infra.shard;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.example.exercise.application.domain.exercise.event.JournalEntry;
import com.example.exercise.application.domain.exercise.query.UserScopedQuery;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 作為分片 Disruptor 的訊息載體 (預先配置、重複使用)
 */
@Data
@NoArgsConstructor
public class ShardMessage {

	private ShardMessageType type;

	private String entityId;

	// --- DELIVER ---

	private UserScopedQuery query;

	private CompletableFuture<Object> reply;

	// --- APPLY ---

	private UserExercisesStatisticsEntity entity; // 發起讀取時的實體，用於丟棄過期結果

	private long fromRevision;

	private List<JournalEntry> entries;

	private Throwable failure;

	/**
	 * 處理完畢後清空引用，避免 RingBuffer 槽位持有舊物件
	 */
	public void clear() {
		type = null;
		entityId = null;
		query = null;
		reply = null;
		entity = null;
		fromRevision = 0;
		entries = null;
		failure = null;
	}
}
