package com.example.exercise.application.domain.exercise.query;

import java.util.List;

import com.example.exercise.application.domain.exercise.aggregate.vo.Exercise;

/**
 * 分類範例查詢結果：成功時帶有範例，失敗時帶有原因
 */
public record ClassificationExamples(List<Exercise> examples, String failure) {

	public static final String NO_EXAMPLES = "No examples";

	public static ClassificationExamples of(List<Exercise> examples) {
		return new ClassificationExamples(List.copyOf(examples), null);
	}

	public static ClassificationExamples noExamples() {
		return new ClassificationExamples(List.of(), NO_EXAMPLES);
	}

	public boolean isSuccess() {
		return failure == null;
	}
}
