package dev.jobsignal.model;

import dev.jobsignal.entity.Company;

/**
 * What an adapter needs to know to locate a company's job board.
 */
public record CompanyDescriptor(
        Long id,
        String name,
        String platform,
        String domain,
        String careersUrl) {

    public static CompanyDescriptor from(Company company) {
        return new CompanyDescriptor(
                company.getId(),
                company.getName(),
                company.getCareersPlatform(),
                company.getDomain(),
                company.getCareersUrl());
    }

    /**
     * First label of the domain ("linear.app" -> "linear"), or null without a domain.
     */
    public String domainSlug() {
        if (domain == null || domain.isBlank()) {
            return null;
        }
        String host = domain.trim().toLowerCase();
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        int dot = host.indexOf('.');
        return dot > 0 ? host.substring(0, dot) : host;
    }
}
