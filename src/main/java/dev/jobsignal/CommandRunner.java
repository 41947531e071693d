package dev.jobsignal;

import dev.jobsignal.entity.JobListing;
import dev.jobsignal.entity.ScoreBreakdown;
import dev.jobsignal.model.JobFilter;
import dev.jobsignal.model.JobStatus;
import dev.jobsignal.model.ScanFilter;
import dev.jobsignal.model.ScanResult;
import dev.jobsignal.service.CompanyImporter;
import dev.jobsignal.service.CompanyImporter.ImportSummary;
import dev.jobsignal.service.CompanyScoreEngine;
import dev.jobsignal.service.ScanOrchestrator;
import dev.jobsignal.service.SignalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches command-line arguments to the scan, scoring and store services.
 * Results are reported as log lines. With no arguments a full scan runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandRunner {

  private static final String SEPARATOR = "========================================";
  private static final String USAGE = "Usage: scan [--platform P] [--company C] [--min-score S]"
      + " | scores refresh [--company-id N]"
      + " | jobs [--status S] [--min-relevance R] [--company-id N] [--limit N]"
      + " | job apply|ignore <id>"
      + " | import <file>";

  private final ScanOrchestrator scanOrchestrator;
  private final CompanyScoreEngine companyScoreEngine;
  private final SignalStore signalStore;
  private final CompanyImporter companyImporter;

  /**
   * Run one command.
   *
   * @return process exit code, 0 on success
   */
  public int execute(String... args) {
    List<String> arguments = Arrays.stream(args)
        .filter(arg -> !arg.startsWith("--spring.") && !arg.startsWith("--logging."))
        .toList();
    String command = arguments.isEmpty() ? "scan" : arguments.get(0);
    List<String> rest = arguments.isEmpty() ? List.of() : arguments.subList(1, arguments.size());

    try {
      return switch (command) {
        case "scan" -> scan(options(rest));
        case "scores" -> scores(rest);
        case "jobs" -> jobs(options(rest));
        case "job" -> job(rest);
        case "import" -> importFile(rest);
        default -> usage("Unknown command: " + command);
      };
    } catch (IllegalArgumentException e) {
      return usage(e.getMessage());
    }
  }

  private int scan(Map<String, String> options) {
    ScanFilter filter = new ScanFilter(
        options.get("platform"),
        options.get("company"),
        options.containsKey("min-score") ? parseDouble(options.get("min-score"), "min-score") : null);

    List<ScanResult> results = scanOrchestrator.scanAll(filter);
    for (ScanResult result : results) {
      if (result.isSuccess()) {
        log.info("  {} [{}] found {}, new {}, updated {}, closed {}", result.companyName(), result.platform(),
            result.jobsFound(), result.newJobs(), result.updatedJobs(), result.staleJobs());
      } else {
        log.info("  {} [{}] skipped: {}", result.companyName(), result.platform(), result.error());
      }
    }
    return 0;
  }

  private int scores(List<String> args) {
    if (args.isEmpty() || !"refresh".equals(args.get(0))) {
      return usage("Expected: scores refresh [--company-id N]");
    }
    Map<String, String> options = options(args.subList(1, args.size()));
    if (options.containsKey("company-id")) {
      long companyId = parseLong(options.get("company-id"), "company-id");
      ScoreBreakdown breakdown;
      try {
        breakdown = companyScoreEngine.refresh(companyId);
      } catch (IllegalArgumentException e) {
        log.error(e.getMessage());
        return 1;
      }
      log.info("Company {} composite score: {}", breakdown.getCompanyId(), breakdown.getCompositeScore());
    } else {
      int count = companyScoreEngine.refreshAll();
      log.info("Refreshed {} companies", count);
    }
    return 0;
  }

  private int jobs(Map<String, String> options) {
    JobFilter filter = JobFilter.builder()
        .companyId(options.containsKey("company-id") ? parseLong(options.get("company-id"), "company-id") : null)
        .status(options.containsKey("status") ? JobStatus.fromValue(options.get("status")) : null)
        .minRelevance(options.containsKey("min-relevance")
            ? parseDouble(options.get("min-relevance"), "min-relevance") : null)
        .limit(options.containsKey("limit") ? parseInt(options.get("limit"), "limit") : null)
        .build();

    List<JobListing> jobs = signalStore.getJobs(filter);
    log.info(SEPARATOR);
    log.info("{} job listings", jobs.size());
    log.info(SEPARATOR);
    for (JobListing job : jobs) {
      log.info("  #{} {} | {} | {} | {} | {}", job.getId(), job.getRelevanceScore(), job.getTitle(),
          job.getLocation() != null ? job.getLocation() : "-", job.getStatus().value(),
          job.getUrl() != null ? job.getUrl() : "-");
    }
    return 0;
  }

  private int job(List<String> args) {
    if (args.size() != 2) {
      return usage("Expected: job apply|ignore <id>");
    }
    JobStatus status = switch (args.get(0)) {
      case "apply" -> JobStatus.APPLIED;
      case "ignore" -> JobStatus.IGNORED;
      default -> null;
    };
    if (status == null) {
      return usage("Unknown job action: " + args.get(0));
    }
    long jobId = parseLong(args.get(1), "id");
    if (!signalStore.updateJobStatus(jobId, status)) {
      log.error("Job {} not found", jobId);
      return 1;
    }
    return 0;
  }

  private int importFile(List<String> args) {
    if (args.size() != 1) {
      return usage("Expected: import <file>");
    }
    ImportSummary summary = companyImporter.importFile(Path.of(args.get(0)));
    return summary.errors().isEmpty() ? 0 : 1;
  }

  private int usage(String problem) {
    log.error(problem);
    log.error(USAGE);
    return 1;
  }

  /**
   * Parses "--name value" and "--name=value" pairs.
   */
  static Map<String, String> options(List<String> args) {
    Map<String, String> options = new HashMap<>();
    List<String> unexpected = new ArrayList<>();
    for (int i = 0; i < args.size(); i++) {
      String arg = args.get(i);
      if (!arg.startsWith("--")) {
        unexpected.add(arg);
        continue;
      }
      String name = arg.substring(2);
      int eq = name.indexOf('=');
      if (eq >= 0) {
        options.put(name.substring(0, eq), name.substring(eq + 1));
      } else if (i + 1 < args.size()) {
        options.put(name, args.get(++i));
      } else {
        throw new IllegalArgumentException("Missing value for --" + name);
      }
    }
    if (!unexpected.isEmpty()) {
      throw new IllegalArgumentException("Unexpected arguments: " + unexpected);
    }
    return options;
  }

  private static double parseDouble(String value, String name) {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--" + name + " must be a number: " + value, e);
    }
  }

  private static int parseInt(String value, String name) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer: " + value, e);
    }
  }

  private static long parseLong(String value, String name) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer: " + value, e);
    }
  }
}
