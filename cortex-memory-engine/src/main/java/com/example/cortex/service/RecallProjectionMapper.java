package com.example.cortex.service;

import com.example.cortex.dto.FactRecall;
import com.example.cortex.dto.MemoryRecall;
import com.example.cortex.dto.PropertyInteractionRecall;
import com.example.cortex.dto.SuburbPreferenceRecall;
import com.example.cortex.persistence.FactEntity;
import com.example.cortex.persistence.JsonColumnMapper;
import com.example.cortex.persistence.MemoryEntity;
import com.example.cortex.persistence.PropertyInteractionEntity;
import com.example.cortex.persistence.SuburbPreferenceEntity;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Narrows stored rows to the fields the agent needs in its prompt context.
 */
@Component
@RequiredArgsConstructor
public class RecallProjectionMapper {

    private final JsonColumnMapper jsonMapper;

    public MemoryRecall toRecall(MemoryEntity entity) {
        return new MemoryRecall(entity.getContent(), entity.getImportance(), entity.getCreatedAt());
    }

    public FactRecall toRecall(FactEntity entity) {
        return new FactRecall(
                entity.getFact(),
                entity.getConfidence(),
                entity.getCategory(),
                entity.getSubject(),
                entity.getObjectValue());
    }

    public PropertyInteractionRecall toRecall(PropertyInteractionEntity entity) {
        return new PropertyInteractionRecall(
                entity.getPropertyId(),
                jsonMapper.readMap(entity.getPropertyContext()),
                entity.getInteractionType(),
                entity.getQueryText(),
                entity.getOccurredAt());
    }

    public SuburbPreferenceRecall toRecall(SuburbPreferenceEntity entity) {
        List<String> reasons = jsonMapper.readStrings(entity.getReasons());
        return new SuburbPreferenceRecall(
                entity.getSuburbName(),
                entity.getState(),
                entity.getPreferenceScore(),
                List.copyOf(reasons));
    }
}
