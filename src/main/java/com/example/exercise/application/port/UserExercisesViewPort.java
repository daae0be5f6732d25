package com.example.exercise.application.port;

import java.util.concurrent.CompletableFuture;

import com.example.exercise.application.domain.exercise.query.ClassificationExamples;
import com.example.exercise.application.domain.exercise.query.UserExerciseExplicitClassificationExamples;
import com.example.exercise.application.domain.exercise.query.UserGetExerciseSuggestions;
import com.example.exercise.application.domain.exercise.suggestion.Suggestions;

/**
 * 使用者運動統計視圖查詢 Port，由分片執行環境實作
 */
public interface UserExercisesViewPort {

	CompletableFuture<ClassificationExamples> classificationExamples(UserExerciseExplicitClassificationExamples query);

	CompletableFuture<Suggestions> suggestions(UserGetExerciseSuggestions query);
}
