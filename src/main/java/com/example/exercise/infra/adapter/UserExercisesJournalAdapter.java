package com.example.exercise.infra.adapter;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.springframework.stereotype.Component;

import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.eventstore.dbclient.StreamNotFoundException;
import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;
import com.example.exercise.application.domain.exercise.event.JournalEntry;
import com.example.exercise.application.domain.exercise.event.UserExercisesEvent;
import com.example.exercise.application.domain.exercise.event.UserExercisesEventType;
import com.example.exercise.application.port.UserExercisesJournalPort;
import com.example.exercise.infra.event.mapper.EventStoreEventMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 使用者運動事件日誌轉接器 (EventStoreDB)
 * <p>
 * 讀取 "UserExercises-{userId}" Stream。已知的 eventType 以 JSON 解碼；未知的 eventType 不解碼，
 * 以 {@link UserExercisesEventType#UNKNOWN} 佔住其序號，確保序號連續。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserExercisesJournalAdapter implements UserExercisesJournalPort {

	private static final String STREAM_PREFIX = "UserExercises-";

	private final EventStoreDBClient client;
	private final EventStoreEventMapper<UserExercisesEvent> mapper;

	public static String streamName(UserId userId) {
		return STREAM_PREFIX + userId;
	}

	@Override
	public CompletableFuture<List<JournalEntry>> readFrom(UserId userId, long fromRevision, int maxCount) {
		String streamName = streamName(userId);
		ReadStreamOptions options = ReadStreamOptions.get().forwards().fromRevision(fromRevision).maxCount(maxCount);

		return client.readStream(streamName, options).thenApply(result -> {
			List<JournalEntry> entries = result.getEvents().stream().map(ResolvedEvent::getEvent)
					.map(this::toJournalEntry).toList();
			log.debug(">>> [EventStore] {} 從 Revision {} 讀取到 {} 筆事件", streamName, fromRevision, entries.size());
			return entries;
		}).exceptionally(ex -> {
			Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
			if (cause instanceof StreamNotFoundException) {
				// 尚未有任何事件的使用者
				return List.of();
			}
			throw new CompletionException(cause);
		});
	}

	/**
	 * 未知的 eventType 不解碼內容，直接以 UNKNOWN 佔住序號
	 */
	JournalEntry toJournalEntry(RecordedEvent recorded) {
		UserExercisesEventType type = UserExercisesEventType.fromEventTypeName(recorded.getEventType());

		UserExercisesEvent event;
		if (type == UserExercisesEventType.UNKNOWN) {
			event = UserExercisesEvent.unrecognized();
		} else {
			event = mapper.toDomainEvent(recorded);
			event.setType(type);
		}
		return JournalEntry.persisted(recorded.getRevision(), event);
	}
}
