package dev.jobsignal.repository;

import dev.jobsignal.entity.AiSignal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AiSignalRepository extends JpaRepository<AiSignal, Long> {

    List<AiSignal> findByCompanyIdOrderByIdAsc(Long companyId);
}
