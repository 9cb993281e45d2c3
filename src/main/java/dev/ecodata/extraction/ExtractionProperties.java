package dev.ecodata.extraction;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised tuning for the extraction pipeline.
 *
 * <p>Properties are bound from {@code ecodata.extraction.*} in application.yml.
 *
 * <ul>
 *   <li>{@code grounded-default-confidence} - confidence for a cited value when the model gives
 *       no score (default 0.8)
 *   <li>{@code inferred-default-confidence} - confidence for an uncited value when the model gives
 *       no score (default 0.4)
 *   <li>{@code default-candidate-relevance} - relevance for a candidate sentence without a score
 *       (default 0.5)
 *   <li>{@code max-candidates} - candidate sentences kept per category (default 5)
 *   <li>{@code max-examples} - confirmed examples embedded per category in a prompt (default 5)
 *   <li>{@code concurrency} - rows processed in parallel across all jobs (default 4)
 *   <li>{@code fatal-error-threshold} - rows failing with a fatal provider error before the job
 *       is failed (default 3)
 * </ul>
 *
 * <p>Explicit model scores always take precedence over the defaults. Validated at startup via
 * {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "ecodata.extraction")
public class ExtractionProperties {

  private double groundedDefaultConfidence = 0.8;
  private double inferredDefaultConfidence = 0.4;
  private double defaultCandidateRelevance = 0.5;
  private int maxCandidates = 5;
  private int maxExamples = 5;
  private int concurrency = 4;
  private int fatalErrorThreshold = 3;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  public void validate() {
    requireUnit("grounded-default-confidence", groundedDefaultConfidence);
    requireUnit("inferred-default-confidence", inferredDefaultConfidence);
    requireUnit("default-candidate-relevance", defaultCandidateRelevance);
    requirePositive("max-candidates", maxCandidates);
    requirePositive("max-examples", maxExamples);
    requirePositive("concurrency", concurrency);
    requirePositive("fatal-error-threshold", fatalErrorThreshold);
  }

  private static void requireUnit(String name, double value) {
    if (value < 0.0 || value > 1.0) {
      throw new IllegalStateException(
          "ecodata.extraction." + name + " must be in [0.0, 1.0], got: " + value);
    }
  }

  private static void requirePositive(String name, int value) {
    if (value < 1) {
      throw new IllegalStateException(
          "ecodata.extraction." + name + " must be at least 1, got: " + value);
    }
  }

  public double getGroundedDefaultConfidence() {
    return groundedDefaultConfidence;
  }

  public void setGroundedDefaultConfidence(double groundedDefaultConfidence) {
    this.groundedDefaultConfidence = groundedDefaultConfidence;
  }

  public double getInferredDefaultConfidence() {
    return inferredDefaultConfidence;
  }

  public void setInferredDefaultConfidence(double inferredDefaultConfidence) {
    this.inferredDefaultConfidence = inferredDefaultConfidence;
  }

  public double getDefaultCandidateRelevance() {
    return defaultCandidateRelevance;
  }

  public void setDefaultCandidateRelevance(double defaultCandidateRelevance) {
    this.defaultCandidateRelevance = defaultCandidateRelevance;
  }

  public int getMaxCandidates() {
    return maxCandidates;
  }

  public void setMaxCandidates(int maxCandidates) {
    this.maxCandidates = maxCandidates;
  }

  public int getMaxExamples() {
    return maxExamples;
  }

  public void setMaxExamples(int maxExamples) {
    this.maxExamples = maxExamples;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public int getFatalErrorThreshold() {
    return fatalErrorThreshold;
  }

  public void setFatalErrorThreshold(int fatalErrorThreshold) {
    this.fatalErrorThreshold = fatalErrorThreshold;
  }
}
