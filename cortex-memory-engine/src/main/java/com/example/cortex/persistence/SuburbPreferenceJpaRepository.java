package com.example.cortex.persistence;

import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SuburbPreferenceJpaRepository extends JpaRepository<SuburbPreferenceEntity, Long> {

    Optional<SuburbPreferenceEntity> findByUserIdAndSuburbNameAndState(String userId, String suburbName, String state);

    List<SuburbPreferenceEntity> findByUserIdOrderByPreferenceScoreDesc(String userId);

    List<SuburbPreferenceEntity> findByUserIdAndPreferenceScoreGreaterThanOrderByPreferenceScoreDesc(
            String userId, int minimumScore, Pageable pageable);
}
