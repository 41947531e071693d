package dev.jobsignal.model;

import dev.jobsignal.entity.Company;

import java.util.Locale;

/**
 * Company selection for a scan. Null fields do not filter.
 */
public record ScanFilter(String platform, String companyName, Double minScore) {

    public static ScanFilter all() {
        return new ScanFilter(null, null, null);
    }

    public boolean matches(Company company) {
        if (platform != null && !platform.equalsIgnoreCase(company.getCareersPlatform())) {
            return false;
        }
        if (companyName != null && (company.getName() == null
                || !company.getName().toLowerCase(Locale.ROOT).contains(companyName.toLowerCase(Locale.ROOT)))) {
            return false;
        }
        return minScore == null || company.getCompositeScore() >= minScore;
    }
}
