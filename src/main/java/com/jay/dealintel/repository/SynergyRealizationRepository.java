package com.jay.dealintel.repository;

import com.jay.dealintel.entity.SynergyRealizationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SynergyRealizationRepository extends JpaRepository<SynergyRealizationRecord, String> {

    List<SynergyRealizationRecord> findBySynergyIdOrderByPeriodStartAsc(String synergyId);

    List<SynergyRealizationRecord> findBySynergyIdInOrderByPeriodStartAsc(Collection<String> synergyIds);

    @Query("SELECT COUNT(DISTINCT r.synergyId) FROM SynergyRealizationRecord r")
    long countTrackedSynergies();
}
