package com.example.exercise.infra.adapter;

import java.util.concurrent.CompletableFuture;

import org.springframework.stereotype.Component;

import com.example.exercise.application.domain.exercise.query.ClassificationExamples;
import com.example.exercise.application.domain.exercise.query.UserExerciseExplicitClassificationExamples;
import com.example.exercise.application.domain.exercise.query.UserGetExerciseSuggestions;
import com.example.exercise.application.domain.exercise.suggestion.Suggestions;
import com.example.exercise.application.port.UserExercisesViewPort;
import com.example.exercise.infra.shard.ShardRegion;

import lombok.RequiredArgsConstructor;

/**
 * 以分片區域實作統計視圖查詢 Port
 */
@Component
@RequiredArgsConstructor
public class ShardedUserExercisesViewAdapter implements UserExercisesViewPort {

	private final ShardRegion shardRegion;

	@Override
	public CompletableFuture<ClassificationExamples> classificationExamples(
			UserExerciseExplicitClassificationExamples query) {
		return shardRegion.ask(query).thenApply(ClassificationExamples.class::cast);
	}

	@Override
	public CompletableFuture<Suggestions> suggestions(UserGetExerciseSuggestions query) {
		return shardRegion.ask(query).thenApply(Suggestions.class::cast);
	}
}
