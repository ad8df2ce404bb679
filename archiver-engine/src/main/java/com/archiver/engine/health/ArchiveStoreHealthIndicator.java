package com.archiver.engine.health;

import com.archiver.core.model.ArchiveListing;
import com.archiver.core.store.ArchiveStore;
import com.archiver.engine.config.ArchiverProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reports the archive store as down when it cannot be reached or listed.
 * Details: store type, number of archived weeks and the latest week.
 */
@Component
public class ArchiveStoreHealthIndicator implements HealthIndicator {

    private final ArchiveStore store;
    private final String storeType;

    public ArchiveStoreHealthIndicator(ArchiveStore store, ArchiverProperties properties) {
        this.store = store;
        this.storeType = properties.getStore().getType().name().toLowerCase(Locale.ROOT);
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("store", storeType);

        try {
            List<ArchiveListing> weeks = store.list();
            details.put("archivedWeeks", weeks.size());
            weeks.stream()
                .max(ArchiveListing.BY_MODIFICATION)
                .ifPresent(latest -> details.put("latestWeek", latest.week().toString()));
            return Health.up()
                .withDetails(details)
                .build();
        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
