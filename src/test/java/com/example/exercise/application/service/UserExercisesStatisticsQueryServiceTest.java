package com.example.exercise.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.example.exercise.application.domain.exercise.aggregate.vo.Exercise;
import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;
import com.example.exercise.application.domain.exercise.exception.ReplayInconsistencyException;
import com.example.exercise.application.domain.exercise.exception.ViewUnavailableException;
import com.example.exercise.application.domain.exercise.query.ClassificationExamples;
import com.example.exercise.application.domain.exercise.query.UserExerciseExplicitClassificationExamples;
import com.example.exercise.application.domain.exercise.query.UserGetExerciseSuggestions;
import com.example.exercise.application.port.UserExercisesViewPort;

class UserExercisesStatisticsQueryServiceTest {

	private UserExercisesViewPort viewPort;
	private UserExercisesStatisticsQueryService service;
	private final UserId userId = UserId.randomId();

	@BeforeEach
	void setUp() {
		viewPort = mock(UserExercisesViewPort.class);
		service = new UserExercisesStatisticsQueryService(viewPort, 50);
	}

	@Test
	@DisplayName("查詢參數原樣轉交視圖，並回傳視圖的答案")
	void forwardsQueryToView() {
		UUID sessionId = UUID.randomUUID();
		ClassificationExamples answer = ClassificationExamples.of(List.of(Exercise.named("squat")));
		when(viewPort.classificationExamples(any())).thenReturn(CompletableFuture.completedFuture(answer));

		ClassificationExamples result = service.getClassificationExamples(userId, sessionId, List.of("legs"));

		ArgumentCaptor<UserExerciseExplicitClassificationExamples> captor = ArgumentCaptor
				.forClass(UserExerciseExplicitClassificationExamples.class);
		verify(viewPort).classificationExamples(captor.capture());
		assertThat(captor.getValue())
				.isEqualTo(new UserExerciseExplicitClassificationExamples(userId, sessionId, List.of("legs")));
		assertThat(result).isEqualTo(answer);
	}

	@Test
	@DisplayName("視圖未在時限內回應時回報暫時無法使用")
	void timesOutWhenViewDoesNotAnswer() {
		when(viewPort.suggestions(any(UserGetExerciseSuggestions.class))).thenReturn(new CompletableFuture<>());

		assertThatThrownBy(() -> service.getSuggestions(userId)).isInstanceOf(ViewUnavailableException.class);
	}

	@Test
	@DisplayName("視圖重播失敗時回報暫時無法使用，並保留原因")
	void failedReplaySurfacesAsUnavailable() {
		when(viewPort.suggestions(any(UserGetExerciseSuggestions.class)))
				.thenReturn(CompletableFuture.failedFuture(new ReplayInconsistencyException("gap")));

		assertThatThrownBy(() -> service.getSuggestions(userId)).isInstanceOf(ViewUnavailableException.class)
				.hasCauseInstanceOf(ReplayInconsistencyException.class);
	}

	@Test
	void listsSupportedMuscleGroupsWithoutTouchingTheView() {
		assertThat(service.getSupportedMuscleGroups()).hasSize(7);
	}
}
