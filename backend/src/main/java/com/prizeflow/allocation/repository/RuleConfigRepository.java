package com.prizeflow.allocation.repository;

import com.prizeflow.allocation.model.RuleConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface RuleConfigRepository extends JpaRepository<RuleConfig, UUID> {
}
