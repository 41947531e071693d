package dev.jobsignal.service;

import dev.jobsignal.entity.Company;
import dev.jobsignal.metrics.ScannerMetrics;
import dev.jobsignal.model.CanonicalJob;
import dev.jobsignal.model.CompanyDescriptor;
import dev.jobsignal.model.JobRelevance;
import dev.jobsignal.model.ScanFilter;
import dev.jobsignal.model.ScanResult;
import dev.jobsignal.model.UpsertResult;
import dev.jobsignal.source.AdapterRegistry;
import dev.jobsignal.source.SourceAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Main orchestration service for the scan pipeline.
 * <p>
 * Companies are scanned one after the other. A company without an adapter or
 * whose fetch fails is recorded and skipped; store errors abort the scan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanOrchestrator {

    private static final String SEPARATOR = "========================================";
    private static final String UNKNOWN_PLATFORM = "unknown";

    private final SignalStore signalStore;
    private final AdapterRegistry adapterRegistry;
    private final JobRelevanceScorer jobRelevanceScorer;
    private final ScannerMetrics metrics;

    /**
     * Scan every company matching the filter, best composite score first.
     *
     * @return one result per company, failures included
     */
    public List<ScanResult> scanAll(ScanFilter filter) {
        List<Company> companies = signalStore.findCompanies(filter);

        log.info(SEPARATOR);
        log.info("Job scan starting");
        log.info(SEPARATOR);
        log.info("Companies selected: {}", companies.size());
        log.info("Adapters available: {}", adapterRegistry.platforms());

        List<ScanResult> results = new ArrayList<>();
        for (Company company : companies) {
            results.add(scanCompany(company));
        }

        int failures = (int) results.stream().filter(result -> !result.isSuccess()).count();
        int jobsFound = results.stream().mapToInt(ScanResult::jobsFound).sum();
        int newJobs = results.stream().mapToInt(ScanResult::newJobs).sum();
        int staleJobs = results.stream().mapToInt(ScanResult::staleJobs).sum();
        metrics.updateLastScanStats(results.size(), failures, jobsFound);

        log.info(SEPARATOR);
        log.info("SCAN SUMMARY");
        log.info("Companies scanned: {} ({} failed)", results.size(), failures);
        log.info("Jobs found: {} | New: {} | Closed: {}", jobsFound, newJobs, staleJobs);
        log.info(SEPARATOR);

        return results;
    }

    /**
     * One pass over a company: fetch, score, upsert, then close what was not seen.
     */
    public ScanResult scanCompany(Company company) {
        String platform = company.getCareersPlatform() != null ? company.getCareersPlatform() : UNKNOWN_PLATFORM;
        metrics.recordCompanyScanned();

        Optional<SourceAdapter> adapter = adapterRegistry.resolve(platform);
        if (adapter.isEmpty()) {
            log.warn("Skipping {}: no adapter for platform '{}'", company.getName(), platform);
            metrics.incrementScanFailures(platform);
            return ScanResult.failed(company.getName(), platform, "No adapter for platform: " + platform);
        }

        List<CanonicalJob> jobs;
        try {
            jobs = adapter.get().fetchJobs(CompanyDescriptor.from(company)).block();
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Fetch failed for {} ({}): {}", company.getName(), platform, error);
            metrics.incrementScanFailures(platform);
            return ScanResult.failed(company.getName(), platform, error);
        }
        if (jobs == null) {
            jobs = List.of();
        }

        int newJobs = 0;
        int updatedJobs = 0;
        Set<Long> observedIds = new HashSet<>();

        for (CanonicalJob job : jobs) {
            JobRelevance relevance = jobRelevanceScorer.score(job);
            UpsertResult upsert = signalStore.upsertJob(company.getId(), job, relevance.score(), relevance.reasons());

            if (upsert.isNew()) {
                newJobs++;
            } else {
                updatedJobs++;
            }
            observedIds.add(upsert.id());
        }

        int staleJobs = signalStore.markStaleExcept(company.getId(), observedIds);

        metrics.recordNewJobs(newJobs);
        metrics.recordStaleJobs(staleJobs);
        log.info("{} ({}): {} found, {} new, {} updated, {} closed",
                company.getName(), platform, jobs.size(), newJobs, updatedJobs, staleJobs);

        return new ScanResult(company.getName(), platform, jobs.size(), newJobs, updatedJobs, staleJobs, null);
    }
}
