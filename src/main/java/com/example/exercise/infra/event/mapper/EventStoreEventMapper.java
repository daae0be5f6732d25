package com.example.exercise.infra.event.mapper;

import com.eventstore.dbclient.RecordedEvent;
import com.example.exercise.infra.event.codec.EventJsonCodec;

import lombok.RequiredArgsConstructor;

/**
 * EventStore 專用的 Domain Event 映射器 (Event Mapper)
 *
 * <p>
 * 封裝 EventStoreDB 專屬結構，讓上層只看到純粹的 Domain Event。 本服務只讀取事件，因此只提供還原方向。
 * </p>
 *
 * @param <T> Domain Event 類型
 */
@RequiredArgsConstructor
public class EventStoreEventMapper<T> {

	private final EventJsonCodec<T> jsonCodec;

	/**
	 * 將 EventStore {@link RecordedEvent} 的內容還原為 Domain Event。
	 *
	 * @throws IllegalStateException 若反序列化失敗，表示事件資料可能已損毀
	 */
	public T toDomainEvent(RecordedEvent recordedEvent) {
		return jsonCodec.decode(recordedEvent.getEventType(), recordedEvent.getEventData());
	}
}
