package dev.jobsignal.repository;

import dev.jobsignal.entity.ToolAdoption;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ToolAdoptionRepository extends JpaRepository<ToolAdoption, Long> {

    List<ToolAdoption> findByCompanyIdOrderByIdAsc(Long companyId);
}
