package com.example.exercise.infra.shard;

/**
 * 路由結果
 *
 * @param entityId 實體鍵 (使用者識別碼字串)
 * @param shardId  分片識別碼
 */
public record RouteKey(String entityId, String shardId) {
}
