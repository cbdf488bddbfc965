package com.z254.verity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * VERITY - Root cause analysis over metrics, logs and traces.
 *
 * <p>VERITY provides:
 * <ul>
 *   <li>Fetching - Bounded, deadline-aware queries against Prometheus-compatible, Loki and Tempo backends</li>
 *   <li>Detection - Baselines, CUSUM changepoints, anomalies, log bursts and trace degradations</li>
 *   <li>Correlation - Temporal grouping of evidence into weighted bundles</li>
 *   <li>Causal inference - Granger tests, a Bayesian category model and cycle-tolerant root finding</li>
 *   <li>Ranking - Scored hypotheses with adaptive per-tenant signal weights</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class VerityApplication {

    public static void main(String[] args) {
        SpringApplication.run(VerityApplication.class, args);
    }
}
