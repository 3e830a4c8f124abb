package com.example.cortex.persistence;

import com.example.cortex.domain.ConversationMessage;
import com.example.cortex.domain.SpaceParticipant;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Converts the JSON text columns of the memory entities to and from their Java shapes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonColumnMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<ConversationMessage>> MESSAGE_LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<SpaceParticipant>> PARTICIPANT_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map && map.isEmpty()) {
            return null;
        }
        if (value instanceof List<?> list && list.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize value", e);
        }
    }

    public Map<String, Object> readMap(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyMap();
        }
        return read(json, MAP_TYPE, Collections.emptyMap());
    }

    /**
     * Returns a mutable copy so callers can append to accumulated lists.
     */
    public List<String> readStrings(String json) {
        if (!StringUtils.hasText(json)) {
            return new ArrayList<>();
        }
        List<String> result = read(json, STRING_LIST_TYPE, List.of());
        return CollectionUtils.isEmpty(result) ? new ArrayList<>() : new ArrayList<>(result);
    }

    public List<ConversationMessage> readMessages(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyList();
        }
        return read(json, MESSAGE_LIST_TYPE, Collections.emptyList());
    }

    public List<SpaceParticipant> readParticipants(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyList();
        }
        return read(json, PARTICIPANT_LIST_TYPE, Collections.emptyList());
    }

    private <T> T read(String json, TypeReference<T> type, T fallback) {
        try {
            T value = objectMapper.readValue(json, type);
            return value != null ? value : fallback;
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable JSON column value of type {}", type.getType(), e);
            return fallback;
        }
    }
}
