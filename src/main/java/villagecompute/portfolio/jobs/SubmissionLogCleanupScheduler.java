/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.portfolio.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.portfolio.config.ContactSecurityConfig;
import villagecompute.portfolio.observability.ObservabilityMetrics;
import villagecompute.portfolio.services.SubmissionLogService;

/**
 * Scheduled job to purge old contact submission logs.
 *
 * <p>
 * Attempts are only needed for rate-limit accounting (at most one day back) and short-term auditing. This job runs
 * daily at 03:00 and deletes attempts older than {@code contact.retention.days} (default 30).
 */
@ApplicationScoped
public class SubmissionLogCleanupScheduler {

    private static final Logger LOG = Logger.getLogger(SubmissionLogCleanupScheduler.class);

    @Inject
    SubmissionLogService submissionLogService;

    @Inject
    ContactSecurityConfig config;

    @Inject
    ObservabilityMetrics observabilityMetrics;

    @Scheduled(
            cron = "0 0 3 * * ?",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void purgeExpiredSubmissionLogs() {
        try {
            long deleted = submissionLogService.purgeOlderThan(config.getRetentionDays());
            if (deleted > 0) {
                LOG.infof("Deleted %d contact submission logs older than %d days", deleted, config.getRetentionDays());
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Contact submission log purge failed");
            observabilityMetrics.incrementStoreFailure("retention_purge");
        }
    }
}
