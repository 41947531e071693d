package dev.jobsignal.repository;

import dev.jobsignal.entity.Company;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CompanyRepository extends JpaRepository<Company, Long> {

    Optional<Company> findByNameIgnoreCase(String name);

    /**
     * All companies, best score first.
     */
    List<Company> findAllByOrderByCompositeScoreDescIdAsc();

    @Query("SELECT c.id FROM Company c ORDER BY c.id")
    List<Long> findAllIds();
}
