package dev.jobsignal.repository;

import dev.jobsignal.entity.LeadershipSignal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LeadershipSignalRepository extends JpaRepository<LeadershipSignal, Long> {

    List<LeadershipSignal> findByCompanyIdOrderByIdAsc(Long companyId);
}
