package com.example.exercise.application.domain.exercise.query;

import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;

/**
 * 帶有使用者識別碼的查詢，路由層依此決定實體與分片
 */
public interface UserScopedQuery {

	UserId userId();
}
