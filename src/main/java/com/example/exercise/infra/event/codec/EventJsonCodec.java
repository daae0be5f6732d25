package com.example.exercise.infra.event.codec;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * 事件內容 JSON 解碼器
 *
 * <p>
 * 本服務只讀取事件日誌，因此只負責 byte[] 到 Domain Event 的方向。 內容無法解析代表日誌中的資料已損毀，視為系統錯誤。
 * </p>
 *
 * @param <T> Domain Event 類型
 */
public class EventJsonCodec<T> {

	private final ObjectMapper objectMapper;
	private final Class<T> type;

	public EventJsonCodec(ObjectMapper objectMapper, Class<T> type) {
		this.objectMapper = objectMapper;
		this.type = type;
	}

	/**
	 * @param eventType EventStore 上的 eventType，只用於錯誤訊息
	 * @param data      事件內容
	 * @throws IllegalStateException 內容無法解析為 {@code T}
	 */
	public T decode(String eventType, byte[] data) {
		if (data == null || data.length == 0) {
			throw new IllegalStateException(eventType + " 事件內容為空，無法還原為 " + type.getSimpleName());
		}
		try {
			return objectMapper.readValue(data, type);
		} catch (JacksonException e) {
			throw new IllegalStateException(
					eventType + " 事件內容無法還原為 " + type.getSimpleName() + " (" + data.length + " bytes)", e);
		}
	}
}
