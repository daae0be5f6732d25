package com.example.exercise.infra.shard;

import com.example.exercise.application.domain.exercise.aggregate.vo.UserId;
import com.example.exercise.application.domain.exercise.query.UserScopedQuery;

/**
 * <h3>分片路由器 (Shard Router)</h3>
 * <p>
 * 將使用者識別碼映射為實體鍵與分片識別碼。
 * </p>
 * <ul>
 * <li><b>無狀態</b>：只依輸入計算。</li>
 * <li><b>確定性</b>：同一使用者在整個部署生命週期內永遠落在同一分片。 雜湊取自識別碼字串，不依賴物件的 hashCode 實作。</li>
 * </ul>
 */
public class ShardRouter {

	public static final int DEFAULT_SHARD_COUNT = 10;

	private final int shardCount;

	public ShardRouter(int shardCount) {
		if (shardCount <= 0) {
			throw new IllegalArgumentException("shardCount 必須大於 0: " + shardCount);
		}
		this.shardCount = shardCount;
	}

	public int getShardCount() {
		return shardCount;
	}

	public String entityId(UserId userId) {
		return userId.toString();
	}

	/**
	 * @return 分片索引，範圍 [0, shardCount - 1]
	 */
	public int shardIndex(UserId userId) {
		return Math.floorMod(entityId(userId).hashCode(), shardCount);
	}

	public String shardId(UserId userId) {
		return String.valueOf(shardIndex(userId));
	}

	public RouteKey route(UserScopedQuery query) {
		return new RouteKey(entityId(query.userId()), shardId(query.userId()));
	}
}
