package com.example.exercise.application.domain.exercise.exception;

/**
 * 統計視圖暫時無法回答 (逾時或實體重播失敗)
 */
public class ViewUnavailableException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ViewUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
