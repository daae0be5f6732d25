package com.example.exercise.application.domain.exercise.suggestion;

import java.time.LocalDate;

import com.example.exercise.application.domain.exercise.aggregate.vo.SessionProperties;

/**
 * 單筆未來課程建議
 *
 * @param date              建議日期
 * @param source            建議來源 (例如 "history", "programme")
 * @param sessionProperties 建議的課程屬性
 */
public record Suggestion(LocalDate date, String source, SessionProperties sessionProperties) {
}
