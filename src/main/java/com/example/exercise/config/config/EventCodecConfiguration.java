package com.example.exercise.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.exercise.application.domain.exercise.event.UserExercisesEvent;
import com.example.exercise.infra.event.codec.EventJsonCodec;
import com.example.exercise.infra.event.mapper.EventStoreEventMapper;

import tools.jackson.databind.ObjectMapper;

/**
 * EventCodec 的配置類
 * <p>
 * 用來配置可轉換的 Event 類型
 * </p>
 */
@Configuration
public class EventCodecConfiguration {

	@Bean
	public EventJsonCodec<UserExercisesEvent> userExercisesEventJsonCodec(ObjectMapper objectMapper) {
		return new EventJsonCodec<>(objectMapper, UserExercisesEvent.class);
	}

	@Bean
	public EventStoreEventMapper<UserExercisesEvent> userExercisesEventMapper(
			EventJsonCodec<UserExercisesEvent> userExercisesEventJsonCodec) {
		return new EventStoreEventMapper<>(userExercisesEventJsonCodec);
	}
}
