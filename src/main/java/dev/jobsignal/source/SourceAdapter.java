package dev.jobsignal.source;

import dev.jobsignal.model.CanonicalJob;
import dev.jobsignal.model.CompanyDescriptor;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for job board adapters.
 * Each careers platform implements this interface.
 */
public interface SourceAdapter {

    /**
     * Platform key this adapter serves (e.g. "greenhouse", "lever").
     */
    String getPlatform();

    /**
     * Fetch a company's current postings, normalized to canonical records.
     * Errors surface as a single {@link SourceFetchException}; postings that
     * could not be parsed are dropped rather than failing the fetch.
     */
    Mono<List<CanonicalJob>> fetchJobs(CompanyDescriptor company);
}
