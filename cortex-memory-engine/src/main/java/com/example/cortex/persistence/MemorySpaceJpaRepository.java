package com.example.cortex.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface MemorySpaceJpaRepository extends JpaRepository<MemorySpaceEntity, String> {
}
