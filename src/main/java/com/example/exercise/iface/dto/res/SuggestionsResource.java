package com.example.exercise.iface.dto.res;

import com.example.exercise.application.domain.exercise.suggestion.Suggestions;

public record SuggestionsResource(String code, String message, Suggestions data) {

}
