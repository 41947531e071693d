package dev.jobsignal.repository;

import dev.jobsignal.entity.JobListing;
import dev.jobsignal.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for job listings tracked across scans.
 */
@Repository
public interface JobListingRepository extends JpaRepository<JobListing, Long>, JpaSpecificationExecutor<JobListing> {

    /**
     * Lookup by the URL-bearing identity.
     */
    Optional<JobListing> findFirstByCompanyIdAndTitleAndUrlOrderByIdAsc(Long companyId, String title, String url);

    /**
     * Lookup for postings without a URL, disambiguated by content hash.
     */
    Optional<JobListing> findFirstByCompanyIdAndTitleAndUrlIsNullAndContentHashOrderByIdAsc(
            Long companyId, String title, String contentHash);

    List<JobListing> findByCompanyIdAndTitleAndUrlIsNullOrderByIdAsc(Long companyId, String title);

    List<JobListing> findByCompanyIdAndStatus(Long companyId, JobStatus status);

    long countByCompanyId(Long companyId);

    long countByCompanyIdAndStatus(Long companyId, JobStatus status);
}
