package com.example.exercise.application.domain.exercise.exception;

/**
 * 重播時發現事件資料損毀或順序不符。
 * <p>
 * 不做就地修復：持有該狀態的實體會被移除，下次存取時從頭重播。
 * </p>
 */
public class ReplayInconsistencyException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ReplayInconsistencyException(String message) {
		super(message);
	}
}
