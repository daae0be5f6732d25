package com.example.exercise.infra.shard;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.example.exercise.application.domain.exercise.aggregate.UserExercisesStatistics;
import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;
import com.example.exercise.application.domain.exercise.query.UserScopedQuery;

import lombok.Getter;
import lombok.Setter;

/**
 * 分片上的一個存活實體：統計視圖加上生命週期資訊。 只由所屬分片的消費者執行緒存取。
 */
@Getter
public class UserExercisesStatisticsEntity {

	record PendingQuery(UserScopedQuery query, CompletableFuture<Object> reply) {
	}

	private final UserExercisesStatistics statistics;

	private Instant lastActivity;

	/**
	 * 建立後首次完整重播完成前為 true，期間的查詢先暫存
	 */
	private boolean recovering = true;

	@Setter
	private boolean readInFlight;

	private final List<PendingQuery> stash = new ArrayList<>();

	public UserExercisesStatisticsEntity(UserId userId, Instant createdAt) {
		this.statistics = new UserExercisesStatistics(userId);
		this.lastActivity = createdAt;
	}

	public UserId getUserId() {
		return statistics.getUserId();
	}

	public void touch(Instant now) {
		this.lastActivity = now;
	}

	public boolean isIdleSince(Instant threshold) {
		return lastActivity.isBefore(threshold);
	}

	public void stash(UserScopedQuery query, CompletableFuture<Object> reply) {
		stash.add(new PendingQuery(query, reply));
	}

	/**
	 * 結束恢復並取出暫存查詢
	 */
	public List<PendingQuery> finishRecovery() {
		recovering = false;
		return drainStash();
	}

	public List<PendingQuery> drainStash() {
		List<PendingQuery> drained = new ArrayList<>(stash);
		stash.clear();
		return drained;
	}
}
