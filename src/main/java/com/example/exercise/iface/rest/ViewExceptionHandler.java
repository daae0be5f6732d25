package com.example.exercise.iface.rest;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.example.exercise.application.domain.exercise.exception.ViewUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * 將視圖暫時不可用轉為 503，呼叫端可稍後重試 (實體會在下次存取時重建)
 */
@Slf4j
@RestControllerAdvice
public class ViewExceptionHandler {

	@ExceptionHandler(ViewUnavailableException.class)
	public ResponseEntity<Map<String, String>> handleViewUnavailable(ViewUnavailableException e) {
		log.warn(">>> [Query] 回傳 503: {}", e.getMessage());
		return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("code", "503", "message", e.getMessage()));
	}
}
