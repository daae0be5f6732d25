package com.example.exercise.infra.event.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.exercise.application.domain.exercise.aggregate.vo.Exercise;
import com.example.exercise.application.domain.exercise.aggregate.vo.Metric;
import com.example.exercise.application.domain.exercise.aggregate.vo.SessionProperties;
import com.example.exercise.application.domain.exercise.event.UserExercisesEvent;
import com.example.exercise.application.domain.exercise.suggestion.Suggestion;
import com.example.exercise.application.domain.exercise.suggestion.Suggestions;

import tools.jackson.databind.json.JsonMapper;

class EventJsonCodecTest {

	private final JsonMapper mapper = JsonMapper.builder().build();
	private final EventJsonCodec<UserExercisesEvent> codec = new EventJsonCodec<>(mapper, UserExercisesEvent.class);

	private static byte[] utf8(String json) {
		return json.getBytes(StandardCharsets.UTF_8);
	}

	@Test
	@DisplayName("解析 EventStore 中的 ExerciseObserved 內容")
	void decodesExerciseObservedPayload() {
		UUID sessionId = UUID.randomUUID();
		String json = """
				{"sessionId":"%s","metadata":{"device":"wrist"},
				 "exercise":{"name":"squat","intensity":0.7,"metric":{"value":20.0,"metricUnit":"kg"}}}
				""".formatted(sessionId);

		UserExercisesEvent event = codec.decode("ExerciseObserved", utf8(json));

		assertThat(event.getSessionId()).isEqualTo(sessionId);
		assertThat(event.getExercise()).isEqualTo(new Exercise("squat", 0.7, new Metric(20.0, "kg")));
		assertThat(event.getMetadata()).containsEntry("device", "wrist");
		assertThat(event.getType()).as("類型來自 eventType，不在內容中").isNull();
	}

	@Test
	@DisplayName("metadata 為任意巢狀結構時照樣解碼，內容原樣保留")
	void keepsNestedMetadataOpaque() {
		String json = """
				{"sessionId":"%s",
				 "metadata":{"location":{"wrist":"left"},"sampling":100,"axes":["x","y","z"]},
				 "exercise":{"name":"squat","intensity":0.7}}
				""".formatted(UUID.randomUUID());

		UserExercisesEvent event = codec.decode("ExerciseObserved", utf8(json));

		assertThat(event.getExercise().name()).isEqualTo("squat");
		assertThat(event.getMetadata()).containsEntry("location", Map.of("wrist", "left"))
				.containsEntry("sampling", 100).containsEntry("axes", List.of("x", "y", "z"));
	}

	@Test
	@DisplayName("SessionStarted 與 SuggestionsSet 內容可完整還原")
	void restoresSessionAndSuggestionPayloads() {
		SessionProperties properties = new SessionProperties(LocalDate.of(2026, 1, 5), List.of("legs", "core"), 0.6);
		UserExercisesEvent started = UserExercisesEvent.sessionStarted(UUID.randomUUID(), properties);
		UserExercisesEvent suggested = UserExercisesEvent.suggestionsSet(
				new Suggestions(List.of(new Suggestion(LocalDate.of(2026, 1, 7), "planner", properties))));

		UserExercisesEvent startedBack = codec.decode("SessionStarted", mapper.writeValueAsBytes(started));
		UserExercisesEvent suggestedBack = codec.decode("SuggestionsSet", mapper.writeValueAsBytes(suggested));

		assertThat(startedBack.getSessionProperties()).isEqualTo(properties);
		assertThat(startedBack.getSessionId()).isEqualTo(started.getSessionId());
		assertThat(suggestedBack.getSuggestions()).isEqualTo(suggested.getSuggestions());
	}

	@Test
	@DisplayName("損毀或空白的內容以 IllegalStateException 回報，訊息帶出 eventType")
	void rejectsCorruptedPayload() {
		assertThatThrownBy(() -> codec.decode("SessionStarted", utf8("{not json")))
				.isInstanceOf(IllegalStateException.class).hasMessageContaining("SessionStarted")
				.hasMessageContaining("UserExercisesEvent");
		assertThatThrownBy(() -> codec.decode("SessionEnded", new byte[0])).isInstanceOf(IllegalStateException.class);
	}
}
