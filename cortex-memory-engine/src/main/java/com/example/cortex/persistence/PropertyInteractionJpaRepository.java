package com.example.cortex.persistence;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PropertyInteractionJpaRepository extends JpaRepository<PropertyInteractionEntity, String> {

    List<PropertyInteractionEntity> findByUserIdOrderByOccurredAtDesc(String userId, Pageable pageable);

    List<PropertyInteractionEntity> findByUserIdOrderByOccurredAtDesc(String userId);

    List<PropertyInteractionEntity> findByUserIdAndPropertyIdOrderByOccurredAtDesc(String userId, String propertyId);
}
