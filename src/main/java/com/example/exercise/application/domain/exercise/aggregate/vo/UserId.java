package com.example.exercise.application.domain.exercise.aggregate.vo;

import java.util.UUID;

/**
 * 使用者識別碼
 * <p>
 * {@link #toString()} 即為實體 (Entity) 的路由鍵，必須穩定。
 * </p>
 */
public record UserId(UUID id) {

	public UserId {
		if (id == null) {
			throw new IllegalArgumentException("UserId 不可為空");
		}
	}

	public static UserId fromString(String value) {
		return new UserId(UUID.fromString(value));
	}

	public static UserId randomId() {
		return new UserId(UUID.randomUUID());
	}

	@Override
	public String toString() {
		return id.toString();
	}
}
