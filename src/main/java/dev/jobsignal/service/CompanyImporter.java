package dev.jobsignal.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobsignal.entity.AiSignal;
import dev.jobsignal.entity.Company;
import dev.jobsignal.entity.LeadershipSignal;
import dev.jobsignal.entity.ToolAdoption;
import dev.jobsignal.model.AdoptionLevel;
import dev.jobsignal.model.ImpactLevel;
import dev.jobsignal.model.SignalType;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Bulk import of companies and their evidence from a JSON file.
 * <p>
 * Companies are matched by name (case-insensitive) and updated in place;
 * evidence entries are always appended. Invalid entries are skipped and
 * reported in the summary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompanyImporter {

    private final SignalStore signalStore;
    private final ObjectMapper objectMapper;

    /**
     * Counts of what was written, plus one message per skipped entry.
     */
    public record ImportSummary(
            int companiesCreated,
            int companiesUpdated,
            int leadershipSignals,
            int toolAdoptions,
            int aiSignals,
            List<String> errors) {
    }

    @Transactional
    public ImportSummary importFile(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("File not found: " + path);
        }

        ImportFile file;
        try {
            file = objectMapper.readValue(path.toFile(), ImportFile.class);
        } catch (IOException e) {
            log.error("Failed to read {}. Ensure it matches the company import structure.", path, e);
            throw new IllegalStateException("Could not read import file " + path, e);
        }

        ImportSummary summary = importCompanies(file.getCompanies() != null ? file.getCompanies() : List.of());
        log.info("Imported {}: {} companies created, {} updated, {} leadership / {} tool / {} other signals, {} errors",
                path, summary.companiesCreated(), summary.companiesUpdated(), summary.leadershipSignals(),
                summary.toolAdoptions(), summary.aiSignals(), summary.errors().size());
        return summary;
    }

    ImportSummary importCompanies(List<CompanyEntry> entries) {
        int created = 0;
        int updated = 0;
        int leadership = 0;
        int tools = 0;
        int signals = 0;
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < entries.size(); i++) {
            CompanyEntry entry = entries.get(i);
            String prefix = "companies[" + i + "]";
            if (isBlank(entry.getName())) {
                errors.add(prefix + ": name is required");
                continue;
            }

            Company company = signalStore.findCompanyByName(entry.getName().trim()).orElse(null);
            if (company == null) {
                company = Company.builder().name(entry.getName().trim()).build();
                created++;
            } else {
                updated++;
            }
            applyFields(company, entry);
            Long companyId = signalStore.saveCompany(company).getId();
            List<LeadershipEntry> leadershipEntries = orEmpty(entry.getLeadership());
            List<ToolEntry> toolEntries = orEmpty(entry.getTools());
            List<SignalEntry> signalEntries = orEmpty(entry.getSignals());

            for (int j = 0; j < leadershipEntries.size(); j++) {
                LeadershipEntry item = leadershipEntries.get(j);
                List<String> itemErrors = new ArrayList<>();
                if (isBlank(item.getLeaderName())) {
                    itemErrors.add("leaderName is required");
                }
                if (isBlank(item.getContent())) {
                    itemErrors.add("content is required");
                }
                ImpactLevel impact = parse(item.getImpactLevel(), ImpactLevel::fromValue, itemErrors);
                LocalDate observed = parseDate(item.getDateObserved(), itemErrors);
                if (report(errors, prefix + ".leadership[" + j + "]", itemErrors)) {
                    continue;
                }
                signalStore.addLeadershipSignal(LeadershipSignal.builder()
                        .companyId(companyId)
                        .leaderName(item.getLeaderName())
                        .leaderTitle(item.getLeaderTitle())
                        .content(item.getContent())
                        .sourceUrl(item.getSourceUrl())
                        .impactLevel(impact)
                        .dateObserved(observed)
                        .build());
                leadership++;
            }

            for (int j = 0; j < toolEntries.size(); j++) {
                ToolEntry item = toolEntries.get(j);
                List<String> itemErrors = new ArrayList<>();
                if (isBlank(item.getToolName())) {
                    itemErrors.add("toolName is required");
                }
                AdoptionLevel level = parse(item.getAdoptionLevel(), AdoptionLevel::fromValue, itemErrors);
                LocalDate observed = parseDate(item.getDateObserved(), itemErrors);
                if (report(errors, prefix + ".tools[" + j + "]", itemErrors)) {
                    continue;
                }
                signalStore.addToolAdoption(ToolAdoption.builder()
                        .companyId(companyId)
                        .toolName(item.getToolName())
                        .adoptionLevel(level)
                        .evidenceUrl(item.getEvidenceUrl())
                        .evidenceExcerpt(item.getEvidenceExcerpt())
                        .dateObserved(observed)
                        .build());
                tools++;
            }

            for (int j = 0; j < signalEntries.size(); j++) {
                SignalEntry item = signalEntries.get(j);
                List<String> itemErrors = new ArrayList<>();
                if (isBlank(item.getSignalType())) {
                    itemErrors.add("signalType is required");
                }
                if (isBlank(item.getTitle())) {
                    itemErrors.add("title is required");
                }
                SignalType type = parse(item.getSignalType(), SignalType::fromValue, itemErrors);
                LocalDate observed = parseDate(item.getDateObserved(), itemErrors);
                if (report(errors, prefix + ".signals[" + j + "]", itemErrors)) {
                    continue;
                }
                signalStore.addAiSignal(AiSignal.builder()
                        .companyId(companyId)
                        .signalType(type)
                        .title(item.getTitle())
                        .sourceUrl(item.getSourceUrl())
                        .sourceName(item.getSourceName())
                        .excerpt(item.getExcerpt())
                        .signalStrength(item.getSignalStrength())
                        .dateObserved(observed)
                        .build());
                signals++;
            }

            signalStore.markResearched(companyId);
        }

        errors.forEach(error -> log.warn("Import skipped {}", error));
        return new ImportSummary(created, updated, leadership, tools, signals, List.copyOf(errors));
    }

    private void applyFields(Company company, CompanyEntry entry) {
        if (entry.getDomain() != null) {
            company.setDomain(entry.getDomain().trim());
        }
        if (entry.getCareersUrl() != null) {
            company.setCareersUrl(entry.getCareersUrl().trim());
        }
        if (entry.getCareersPlatform() != null) {
            company.setCareersPlatform(entry.getCareersPlatform().trim().toLowerCase());
        }
        if (entry.getDescription() != null) {
            company.setDescription(entry.getDescription());
        }
        if (entry.getTier() != null) {
            company.setTier(entry.getTier());
        }
    }

    private static <T> T parse(String value, Function<String, T> parser, List<String> errors) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
            return null;
        }
    }

    private static LocalDate parseDate(String value, List<String> errors) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            errors.add("dateObserved is not an ISO date: " + value);
            return null;
        }
    }

    private static boolean report(List<String> errors, String path, List<String> itemErrors) {
        itemErrors.forEach(error -> errors.add(path + ": " + error));
        return !itemErrors.isEmpty();
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ImportFile {
        private List<CompanyEntry> companies = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CompanyEntry {
        private String name;
        private String domain;
        private String careersUrl;
        private String careersPlatform;
        private String description;
        private Integer tier;
        private List<LeadershipEntry> leadership = new ArrayList<>();
        private List<ToolEntry> tools = new ArrayList<>();
        private List<SignalEntry> signals = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LeadershipEntry {
        private String leaderName;
        private String leaderTitle;
        private String content;
        private String sourceUrl;
        private String impactLevel;
        private String dateObserved;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ToolEntry {
        private String toolName;
        private String adoptionLevel;
        private String evidenceUrl;
        private String evidenceExcerpt;
        private String dateObserved;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SignalEntry {
        private String signalType;
        private String title;
        private String sourceUrl;
        private String sourceName;
        private String excerpt;
        private Integer signalStrength;
        private String dateObserved;
    }
}
