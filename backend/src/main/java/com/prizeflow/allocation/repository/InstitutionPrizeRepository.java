package com.prizeflow.allocation.repository;

import com.prizeflow.allocation.model.InstitutionPrize;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface InstitutionPrizeRepository extends JpaRepository<InstitutionPrize, UUID> {
    List<InstitutionPrize> findByGroupIdInAndActiveTrueOrderByPlaceAscPrizeIdAsc(Collection<UUID> groupIds);
}
