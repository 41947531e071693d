package dev.jobsignal.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for job relevance scoring.
 * Loaded from application.yml under 'job-scoring' prefix; the defaults target
 * data, analytics and ML roles.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "job-scoring")
public class JobScoringConfig {

    private double titleWeight = 0.40;
    private double keywordWeight = 0.30;
    private double locationWeight = 0.15;
    private double seniorityWeight = 0.15;

    private List<String> targetRoles = new ArrayList<>(List.of(
            "data engineer", "data scientist", "data analyst", "analytics engineer",
            "machine learning engineer", "ml engineer", "applied scientist", "research scientist",
            "research engineer", "ai engineer", "data platform", "data infrastructure",
            "business intelligence", "bi engineer", "bi developer", "decision scientist",
            "quantitative analyst", "statistical"));

    private List<String> domainWords = new ArrayList<>(List.of(
            "data", "analytics", "ml", "ai", "machine learning", "intelligence"));

    private List<String> roleWords = new ArrayList<>(List.of(
            "engineer", "scientist", "analyst", "developer", "architect"));

    private List<String> positiveKeywords = new ArrayList<>(List.of(
            "python", "sql", "dbt", "spark", "airflow", "snowflake", "bigquery",
            "databricks", "redshift", "kafka", "pandas", "scikit", "tensorflow",
            "pytorch", "machine learning", "deep learning", "nlp", "llm",
            "data pipeline", "etl", "elt", "data warehouse", "data lake",
            "analytics", "statistics", "a/b test", "experimentation",
            "tableau", "looker", "power bi", "metrics", "dashboard",
            "data model", "feature engineering", "mlops"));

    private List<String> negativeKeywords = new ArrayList<>(List.of(
            "sales", "account executive", "customer success", "marketing manager",
            "recruiter", "legal counsel", "office manager", "receptionist",
            "graphic design", "content writer", "social media manager",
            "finance manager", "accountant", "payroll"));

    private List<String> preferredLocations = new ArrayList<>(List.of(
            "remote", "san francisco", "new york", "los angeles", "seattle", "austin",
            "denver", "chicago", "boston", "portland", "united states", "us", "usa", "anywhere"));

    private List<String> juniorSignals = new ArrayList<>(List.of(
            "intern", "internship", "entry level", "entry-level", "new grad", "junior", "associate"));

    private List<String> executiveSignals = new ArrayList<>(List.of(
            "vp", "vice president", "director", "chief", "head of", "c-suite", "cto", "cdo"));

    private List<String> targetSeniority = new ArrayList<>(List.of(
            "senior", "staff", "lead", "principal", "ii", "iii", "mid"));

    public JobScoringRules toRules() {
        return new JobScoringRules(
                titleWeight, keywordWeight, locationWeight, seniorityWeight,
                targetRoles, domainWords, roleWords,
                positiveKeywords, negativeKeywords, preferredLocations,
                juniorSignals, executiveSignals, targetSeniority);
    }
}
