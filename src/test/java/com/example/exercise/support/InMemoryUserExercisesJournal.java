package com.example.exercise.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;
import com.example.exercise.application.domain.exercise.event.JournalEntry;
import com.example.exercise.application.domain.exercise.event.UserExercisesEvent;
import com.example.exercise.application.port.UserExercisesJournalPort;

/**
 * 測試用的記憶體事件日誌，模擬每位使用者一條 Stream
 */
public class InMemoryUserExercisesJournal implements UserExercisesJournalPort {

	private final Map<UserId, List<UserExercisesEvent>> streams = new ConcurrentHashMap<>();

	/**
	 * 每次讀取的起始序號，依使用者記錄，用於驗證重播行為
	 */
	private final Map<UserId, List<Long>> reads = new ConcurrentHashMap<>();

	public void append(UserId userId, UserExercisesEvent... events) {
		streams.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>()).addAll(List.of(events));
	}

	public List<Long> readsOf(UserId userId) {
		return reads.getOrDefault(userId, List.of());
	}

	@Override
	public CompletableFuture<List<JournalEntry>> readFrom(UserId userId, long fromRevision, int maxCount) {
		reads.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>()).add(fromRevision);

		List<UserExercisesEvent> stream = streams.getOrDefault(userId, List.of());
		List<JournalEntry> entries = new ArrayList<>();
		for (long rev = fromRevision; rev < stream.size() && entries.size() < maxCount; rev++) {
			entries.add(JournalEntry.persisted(rev, stream.get((int) rev)));
		}
		return CompletableFuture.completedFuture(entries);
	}
}
