package com.caredirectory.providers.scheduler;

import com.caredirectory.providers.config.ProviderDirectoryProperties;
import com.caredirectory.providers.exception.UpdateInProgressException;
import com.caredirectory.providers.model.RefreshTrigger;
import com.caredirectory.providers.persistence.ProviderSchema;
import com.caredirectory.providers.service.ProviderRefreshService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup refreshes.
 *
 * Default schedule: 2nd of each month at 02:00 (Europe/Prague). The register is republished
 * monthly, so running more often only re-downloads the same data.
 *
 * Override with provider-directory.scheduling.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProviderRefreshScheduler {

    private final ProviderRefreshService refreshService;
    private final ProviderSchema providerSchema;
    private final ProviderDirectoryProperties properties;

    /**
     * On application startup:
     *  1. Ensure the schema exists
     *  2. Re-publish the last snapshot if it survived the restart
     *  3. Optionally run a refresh if run-on-startup=true
     */
    @PostConstruct
    public void onStartup() {
        providerSchema.ensureSchema();
        refreshService.restorePublishedSnapshot();

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup=true, refreshing provider data");
            runQuietly(RefreshTrigger.STARTUP);
        } else {
            log.info("Provider directory ready. Refresh schedule: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${provider-directory.scheduling.cron:0 0 2 2 * ?}",
            zone = "${provider-directory.scheduling.zone:Europe/Prague}")
    public void scheduledRefresh() {
        log.info("Scheduled refresh triggered");
        runQuietly(RefreshTrigger.SCHEDULED);
    }

    /** The next scheduled run retries a failed one, so failures are only logged here. */
    private void runQuietly(RefreshTrigger trigger) {
        try {
            refreshService.runUpdate(trigger);
        } catch (UpdateInProgressException e) {
            log.warn("{} refresh skipped: another refresh is running", trigger);
        } catch (Exception e) {
            log.error("{} refresh failed: {}", trigger, e.getMessage(), e);
        }
    }
}
