package dev.jobsignal.model;

/**
 * Outcome of scanning one company. A non-null error means the pass was aborted
 * before anything was written.
 */
public record ScanResult(
        String companyName,
        String platform,
        int jobsFound,
        int newJobs,
        int updatedJobs,
        int staleJobs,
        String error) {

    public static ScanResult failed(String companyName, String platform, String error) {
        return new ScanResult(companyName, platform, 0, 0, 0, 0, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
