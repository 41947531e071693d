package dev.jobsignal.repository;

import dev.jobsignal.entity.ScoreBreakdown;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ScoreBreakdownRepository extends JpaRepository<ScoreBreakdown, Long> {

    Optional<ScoreBreakdown> findByCompanyId(Long companyId);

    long countByCompanyId(Long companyId);
}
