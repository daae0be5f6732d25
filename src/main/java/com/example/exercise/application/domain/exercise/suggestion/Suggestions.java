package com.example.exercise.application.domain.exercise.suggestion;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 建議集合，由外部產生，收到 SuggestionsSet 事件時整批替換 (不合併)
 */
public record Suggestions(List<Suggestion> suggestions) {

	private static final Suggestions EMPTY = new Suggestions(List.of());

	public Suggestions {
		suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
	}

	public static Suggestions empty() {
		return EMPTY;
	}

	@JsonIgnore
	public boolean isEmpty() {
		return suggestions.isEmpty();
	}
}
