package dev.jobsignal.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for scan and scoring operations.
 */
@Component
public class ScannerMetrics {

    private static final String TAG_PLATFORM = "platform";
    private final MeterRegistry registry;

    // Counters
    private final Counter companiesScannedCounter;
    private final Counter newJobsCounter;
    private final Counter staleJobsCounter;
    private final Counter scoresRefreshedCounter;

    // Timers (per platform)
    private final ConcurrentHashMap<String, Timer> platformTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastScanCompanies = new AtomicInteger(0);
    private final AtomicInteger lastScanFailures = new AtomicInteger(0);
    private final AtomicInteger lastScanJobsFound = new AtomicInteger(0);

    public ScannerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.companiesScannedCounter = Counter.builder("job_signal_companies_scanned_total")
                .description("Total company scan passes")
                .register(registry);

        this.newJobsCounter = Counter.builder("job_signal_jobs_new_total")
                .description("Total job listings inserted on first sighting")
                .register(registry);

        this.staleJobsCounter = Counter.builder("job_signal_jobs_stale_total")
                .description("Total job listings closed because a rescan no longer returned them")
                .register(registry);

        this.scoresRefreshedCounter = Counter.builder("job_signal_company_scores_refreshed_total")
                .description("Total company score recomputations")
                .register(registry);

        Gauge.builder("job_signal_last_scan_companies", lastScanCompanies, AtomicInteger::get)
                .description("Companies scanned in last scan")
                .register(registry);

        Gauge.builder("job_signal_last_scan_failures", lastScanFailures, AtomicInteger::get)
                .description("Companies that failed in last scan")
                .register(registry);

        Gauge.builder("job_signal_last_scan_jobs_found", lastScanJobsFound, AtomicInteger::get)
                .description("Jobs returned by adapters in last scan")
                .register(registry);
    }

    /**
     * Get or create a fetch timer for a platform.
     */
    public Timer getPlatformTimer(String platform) {
        return platformTimers.computeIfAbsent(platform, name ->
                Timer.builder("job_signal_source_fetch_duration")
                        .description("Time to fetch one company's postings")
                        .tag(TAG_PLATFORM, name)
                        .register(registry));
    }

    public void recordCompanyScanned() {
        companiesScannedCounter.increment();
    }

    public void recordNewJobs(int count) {
        newJobsCounter.increment(count);
    }

    public void recordStaleJobs(int count) {
        staleJobsCounter.increment(count);
    }

    public void recordScoreRefreshed() {
        scoresRefreshedCounter.increment();
    }

    /**
     * Record a company skipped or failed during a scan.
     */
    public void incrementScanFailures(String platform) {
        Counter.builder("job_signal_scan_failures_by_platform_total")
                .tag(TAG_PLATFORM, platform)
                .register(registry)
                .increment();
    }

    /**
     * Record postings returned by an adapter.
     */
    public void recordJobsDiscovered(String platform, int count) {
        Counter.builder("job_signal_jobs_discovered_by_platform_total")
                .tag(TAG_PLATFORM, platform)
                .register(registry)
                .increment(count);
    }

    public void recordFetchLatency(String platform, long latencyMs) {
        getPlatformTimer(platform).record(Duration.ofMillis(latencyMs));
    }

    public void updateLastScanStats(int companies, int failures, int jobsFound) {
        lastScanCompanies.set(companies);
        lastScanFailures.set(failures);
        lastScanJobsFound.set(jobsFound);
    }
}
