package dev.jobsignal.service;

import dev.jobsignal.entity.AiSignal;
import dev.jobsignal.entity.Company;
import dev.jobsignal.entity.JobListing;
import dev.jobsignal.entity.LeadershipSignal;
import dev.jobsignal.entity.ScoreBreakdown;
import dev.jobsignal.entity.ToolAdoption;
import dev.jobsignal.model.CanonicalJob;
import dev.jobsignal.model.CompanyScores;
import dev.jobsignal.model.EvidenceSignals;
import dev.jobsignal.model.JobFilter;
import dev.jobsignal.model.JobStatus;
import dev.jobsignal.model.ScanFilter;
import dev.jobsignal.model.UpsertResult;
import dev.jobsignal.repository.AiSignalRepository;
import dev.jobsignal.repository.CompanyRepository;
import dev.jobsignal.repository.JobListingRepository;
import dev.jobsignal.repository.LeadershipSignalRepository;
import dev.jobsignal.repository.ScoreBreakdownRepository;
import dev.jobsignal.repository.ToolAdoptionRepository;
import dev.jobsignal.util.HashUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Persistence boundary for companies, evidence, score breakdowns and job
 * listings. Write errors are not caught here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalStore {

    private final CompanyRepository companyRepository;
    private final LeadershipSignalRepository leadershipSignalRepository;
    private final ToolAdoptionRepository toolAdoptionRepository;
    private final AiSignalRepository aiSignalRepository;
    private final ScoreBreakdownRepository scoreBreakdownRepository;
    private final JobListingRepository jobListingRepository;
    private final Clock clock;

    // ---- companies ----

    /**
     * Companies matching the filter, best composite score first.
     */
    @Transactional(readOnly = true)
    public List<Company> findCompanies(ScanFilter filter) {
        return companyRepository.findAllByOrderByCompositeScoreDescIdAsc().stream()
                .filter(filter::matches)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Company> getAllCompanies() {
        return companyRepository.findAllByOrderByCompositeScoreDescIdAsc();
    }

    @Transactional(readOnly = true)
    public Optional<Company> findCompany(Long companyId) {
        return companyRepository.findById(companyId);
    }

    @Transactional(readOnly = true)
    public Optional<Company> findCompanyByName(String name) {
        return companyRepository.findByNameIgnoreCase(name);
    }

    @Transactional
    public Company saveCompany(Company company) {
        company.setUpdatedAt(Instant.now(clock));
        return companyRepository.save(company);
    }

    @Transactional
    public void markResearched(Long companyId) {
        Company company = requireCompany(companyId);
        Instant now = Instant.now(clock);
        company.setLastResearchedAt(now);
        company.setUpdatedAt(now);
        companyRepository.save(company);
    }

    /**
     * Mirror a freshly computed composite onto the company row.
     */
    @Transactional
    public void updateCompanyScore(Long companyId, double composite) {
        Company company = requireCompany(companyId);
        company.setCompositeScore(composite);
        company.setUpdatedAt(Instant.now(clock));
        companyRepository.save(company);
    }

    // ---- evidence ----

    @Transactional
    public LeadershipSignal addLeadershipSignal(LeadershipSignal signal) {
        requireCompany(signal.getCompanyId());
        signal.setCreatedAt(Instant.now(clock));
        return leadershipSignalRepository.save(signal);
    }

    @Transactional
    public ToolAdoption addToolAdoption(ToolAdoption tool) {
        requireCompany(tool.getCompanyId());
        tool.setCreatedAt(Instant.now(clock));
        return toolAdoptionRepository.save(tool);
    }

    @Transactional
    public AiSignal addAiSignal(AiSignal signal) {
        requireCompany(signal.getCompanyId());
        signal.setCreatedAt(Instant.now(clock));
        return aiSignalRepository.save(signal);
    }

    @Transactional(readOnly = true)
    public EvidenceSignals getEvidenceSignals(Long companyId) {
        return new EvidenceSignals(
                leadershipSignalRepository.findByCompanyIdOrderByIdAsc(companyId),
                toolAdoptionRepository.findByCompanyIdOrderByIdAsc(companyId),
                aiSignalRepository.findByCompanyIdOrderByIdAsc(companyId));
    }

    // ---- score breakdown ----

    /**
     * Insert or overwrite the single breakdown row of a company.
     */
    @Transactional
    public ScoreBreakdown upsertScoreBreakdown(Long companyId, CompanyScores scores) {
        requireCompany(companyId);
        ScoreBreakdown breakdown = scoreBreakdownRepository.findByCompanyId(companyId)
                .orElseGet(() -> ScoreBreakdown.builder().companyId(companyId).build());

        breakdown.setLeadershipScore(scores.leadership());
        breakdown.setToolAdoptionScore(scores.toolAdoption());
        breakdown.setCultureScore(scores.culture());
        breakdown.setEvidenceDepthScore(scores.evidenceDepth());
        breakdown.setRecencyScore(scores.recency());
        breakdown.setCompositeScore(scores.composite());
        breakdown.setLastComputedAt(Instant.now(clock));
        return scoreBreakdownRepository.save(breakdown);
    }

    @Transactional(readOnly = true)
    public Optional<ScoreBreakdown> getScoreBreakdown(Long companyId) {
        return scoreBreakdownRepository.findByCompanyId(companyId);
    }

    // ---- job listings ----

    /**
     * Insert a posting on first sighting, otherwise refresh it.
     * <p>
     * On refresh, optional fields are only overwritten by non-null values,
     * the relevance score is always replaced, reasons are replaced when the
     * new list is non-empty and a closed listing becomes active again.
     * Applied and ignored listings keep their status.
     */
    @Transactional
    public UpsertResult upsertJob(Long companyId, CanonicalJob job, double relevanceScore, List<String> reasons) {
        Instant now = Instant.now(clock);
        String contentHash = HashUtils.jobContentHash(job.title(), job.location(), job.department());

        Optional<JobListing> existing = job.url() != null
                ? jobListingRepository.findFirstByCompanyIdAndTitleAndUrlOrderByIdAsc(companyId, job.title(), job.url())
                : findUrlLess(companyId, job, contentHash);

        if (existing.isPresent()) {
            JobListing listing = existing.get();
            listing.setDateLastSeen(now);
            listing.setLocation(coalesce(job.location(), listing.getLocation()));
            listing.setDepartment(coalesce(job.department(), listing.getDepartment()));
            listing.setDescription(coalesce(job.description(), listing.getDescription()));
            listing.setDatePosted(coalesce(job.datePosted(), listing.getDatePosted()));
            listing.setRelevanceScore(relevanceScore);
            if (reasons != null && !reasons.isEmpty()) {
                listing.setMatchReasons(new ArrayList<>(reasons));
            }
            if (listing.getStatus() == JobStatus.CLOSED) {
                listing.setStatus(JobStatus.ACTIVE);
            }
            listing.setContentHash(HashUtils.jobContentHash(
                    listing.getTitle(), listing.getLocation(), listing.getDepartment()));
            jobListingRepository.save(listing);
            log.debug("Updated job {} '{}'", listing.getId(), listing.getTitle());
            return new UpsertResult(listing.getId(), false);
        }

        JobListing listing = JobListing.builder()
                .companyId(companyId)
                .title(job.title())
                .url(job.url())
                .location(job.location())
                .department(job.department())
                .description(job.description())
                .datePosted(job.datePosted())
                .dateFirstSeen(now)
                .dateLastSeen(now)
                .status(JobStatus.ACTIVE)
                .relevanceScore(relevanceScore)
                .matchReasons(reasons == null ? new ArrayList<>() : new ArrayList<>(reasons))
                .contentHash(contentHash)
                .build();
        JobListing saved = jobListingRepository.save(listing);
        log.debug("Inserted job {} '{}'", saved.getId(), saved.getTitle());
        return new UpsertResult(saved.getId(), true);
    }

    /**
     * URL-less lookup: exact content hash first, then the single same-title
     * listing whose stored location and department do not contradict the
     * posting. A field the posting lacks matches anything.
     */
    private Optional<JobListing> findUrlLess(Long companyId, CanonicalJob job, String contentHash) {
        Optional<JobListing> exact = jobListingRepository
                .findFirstByCompanyIdAndTitleAndUrlIsNullAndContentHashOrderByIdAsc(companyId, job.title(), contentHash);
        if (exact.isPresent()) {
            return exact;
        }
        List<JobListing> compatible = jobListingRepository
                .findByCompanyIdAndTitleAndUrlIsNullOrderByIdAsc(companyId, job.title()).stream()
                .filter(listing -> compatible(job.location(), listing.getLocation()))
                .filter(listing -> compatible(job.department(), listing.getDepartment()))
                .toList();
        if (compatible.size() > 1) {
            log.debug("{} URL-less listings titled '{}' match company {}; inserting a new one",
                    compatible.size(), job.title(), companyId);
            return Optional.empty();
        }
        return compatible.stream().findFirst();
    }

    private static boolean compatible(String incoming, String stored) {
        return incoming == null || stored == null || incoming.equalsIgnoreCase(stored);
    }

    /**
     * Close every active listing of the company whose URL was not observed.
     * Listings without a URL are always closed by this overload.
     *
     * @return number of listings closed
     */
    @Transactional
    public int markStale(Long companyId, Collection<String> observedUrls) {
        return closeActive(companyId, listing -> listing.getUrl() == null || !observedUrls.contains(listing.getUrl()));
    }

    /**
     * Close every active listing of the company whose id is not among the ids
     * returned by this scan's upserts. A retitled posting that kept its URL is
     * a new listing, so the old one is closed.
     *
     * @return number of listings closed
     */
    @Transactional
    public int markStaleExcept(Long companyId, Collection<Long> observedListingIds) {
        return closeActive(companyId, listing -> !observedListingIds.contains(listing.getId()));
    }

    private int closeActive(Long companyId, Predicate<JobListing> isStale) {
        List<JobListing> stale = jobListingRepository.findByCompanyIdAndStatus(companyId, JobStatus.ACTIVE).stream()
                .filter(isStale)
                .toList();

        // applied and ignored listings are never in the active set
        stale.forEach(listing -> listing.setStatus(JobStatus.CLOSED));
        jobListingRepository.saveAll(stale);

        if (!stale.isEmpty()) {
            log.debug("Closed {} stale listings for company {}", stale.size(), companyId);
        }
        return stale.size();
    }

    /**
     * Listings matching the filter, most relevant first, then newest first.
     */
    @Transactional(readOnly = true)
    public List<JobListing> getJobs(JobFilter filter) {
        Specification<JobListing> spec = (root, query, cb) -> cb.conjunction();
        if (filter.companyId() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("companyId"), filter.companyId()));
        }
        if (filter.status() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), filter.status()));
        }
        if (filter.minRelevance() != null) {
            spec = spec.and((root, query, cb) ->
                    cb.greaterThanOrEqualTo(root.<Double>get("relevanceScore"), filter.minRelevance()));
        }
        if (filter.firstSeenSince() != null) {
            spec = spec.and((root, query, cb) ->
                    cb.greaterThanOrEqualTo(root.<Instant>get("dateFirstSeen"), filter.firstSeenSince()));
        }

        Sort sort = Sort.by(Sort.Order.desc("relevanceScore"), Sort.Order.desc("dateFirstSeen"), Sort.Order.asc("id"));
        return jobListingRepository.findAll(spec, PageRequest.of(0, filter.limit(), sort)).getContent();
    }

    @Transactional(readOnly = true)
    public Optional<JobListing> getJob(Long jobId) {
        return jobListingRepository.findById(jobId);
    }

    /**
     * Explicit user transition, e.g. to applied or ignored.
     *
     * @return false when no listing has this id
     */
    @Transactional
    public boolean updateJobStatus(Long jobId, JobStatus status) {
        Optional<JobListing> listing = jobListingRepository.findById(jobId);
        if (listing.isEmpty()) {
            return false;
        }
        listing.get().setStatus(status);
        jobListingRepository.save(listing.get());
        log.info("Job {} marked {}", jobId, status.value());
        return true;
    }

    private Company requireCompany(Long companyId) {
        return companyRepository.findById(companyId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown company id: " + companyId));
    }

    private static <T> T coalesce(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
