package com.example.exercise.infra.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.RecordedEvent;
import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;
import com.example.exercise.application.domain.exercise.event.JournalEntry;
import com.example.exercise.application.domain.exercise.event.UserExercisesEvent;
import com.example.exercise.application.domain.exercise.event.UserExercisesEventType;
import com.example.exercise.infra.event.codec.EventJsonCodec;
import com.example.exercise.infra.event.mapper.EventStoreEventMapper;

import tools.jackson.databind.json.JsonMapper;

/**
 * <h2>事件日誌轉接器：EventStore 紀錄轉為日誌項目</h2>
 *
 * <pre>
 * <b>Given</b> EventStore 讀出的 RecordedEvent (eventType、revision、內容)
 * <b>When</b>  轉換為 JournalEntry
 * <b>Then</b>  已知類型解碼並帶入類型；未知類型不解碼，仍佔住自己的序號
 * </pre>
 */
class UserExercisesJournalAdapterTest {

	private final UserExercisesJournalAdapter adapter = new UserExercisesJournalAdapter(
			mock(EventStoreDBClient.class), new EventStoreEventMapper<>(
					new EventJsonCodec<>(JsonMapper.builder().build(), UserExercisesEvent.class)));

	private static RecordedEvent recorded(String eventType, long revision, String payload) {
		RecordedEvent recorded = mock(RecordedEvent.class);
		when(recorded.getEventType()).thenReturn(eventType);
		when(recorded.getRevision()).thenReturn(revision);
		when(recorded.getEventData()).thenReturn(payload.getBytes(StandardCharsets.UTF_8));
		return recorded;
	}

	@Test
	void streamNameIsPrefixedUserId() {
		UserId userId = UserId.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301");

		assertThat(UserExercisesJournalAdapter.streamName(userId))
				.isEqualTo("UserExercises-3f2504e0-4f89-11d3-9a0c-0305e82c3301");
	}

	@Test
	@DisplayName("已知類型：解碼內容並以 eventType 設定類型")
	void decodesKnownEventType() {
		UUID sessionId = UUID.randomUUID();

		JournalEntry entry = adapter
				.toJournalEntry(recorded("SessionEnded", 3, "{\"sessionId\":\"" + sessionId + "\"}"));

		assertThat(entry.revision()).isEqualTo(3);
		assertThat(entry.persistent()).isTrue();
		assertThat(entry.event().getType()).isEqualTo(UserExercisesEventType.SESSION_ENDED);
		assertThat(entry.event().getSessionId()).isEqualTo(sessionId);
	}

	@Test
	@DisplayName("未知類型：即使內容無法解析也不解碼，仍以 UNKNOWN 佔住序號")
	void unknownEventTypeKeepsItsRevisionWithoutDecoding() {
		JournalEntry entry = adapter.toJournalEntry(recorded("Foo", 7, "\u0000 not json at all"));

		assertThat(entry.revision()).isEqualTo(7);
		assertThat(entry.persistent()).isTrue();
		assertThat(entry.event().getType()).isEqualTo(UserExercisesEventType.UNKNOWN);
	}

	@Test
	@DisplayName("字面為 Unknown 的 eventType 同樣不解碼")
	void literalUnknownIsNotDecoded() {
		JournalEntry entry = adapter.toJournalEntry(recorded("Unknown", 0, "{broken"));

		assertThat(entry.event().getType()).isEqualTo(UserExercisesEventType.UNKNOWN);
	}

	@Test
	@DisplayName("已知類型但內容損毀：回報 IllegalStateException，由分片移除實體")
	void knownEventTypeWithCorruptedPayloadFails() {
		RecordedEvent corrupted = recorded("ExerciseObserved", 2, "{broken");

		assertThatThrownBy(() -> adapter.toJournalEntry(corrupted)).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("ExerciseObserved");
	}
}
