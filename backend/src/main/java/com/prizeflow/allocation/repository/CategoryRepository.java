package com.prizeflow.allocation.repository;

import com.prizeflow.allocation.model.Category;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CategoryRepository extends JpaRepository<Category, UUID> {
    List<Category> findByTournamentIdOrderByOrderIdxAscCategoryIdAsc(UUID tournamentId);
}
