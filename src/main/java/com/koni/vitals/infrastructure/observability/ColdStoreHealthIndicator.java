package com.koni.vitals.infrastructure.observability;

import com.koni.vitals.infrastructure.storage.FileSystemColdObjectStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health indicator for the filesystem cold store.
 *
 * Reports UP when the root directory exists and is writable. A missing root is created on
 * the first write, so it is reported UP as long as its nearest existing parent is writable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColdStoreHealthIndicator implements HealthIndicator {
    
    private final FileSystemColdObjectStore coldStore;
    
    @Override
    public Health health() {
        Path root = coldStore.getRoot();
        try {
            Path probe = root;
            while (probe != null && !Files.exists(probe)) {
                probe = probe.getParent();
            }
            if (probe == null || !Files.isDirectory(probe) || !Files.isWritable(probe)) {
                log.warn("Cold store health check failed: root={}, reason=not writable", root);
                return Health.down()
                        .withDetail("root", root.toString())
                        .withDetail("error", "NotWritable")
                        .withDetail("message", "Cold store root is not a writable directory")
                        .build();
            }
            return Health.up()
                    .withDetail("root", root.toString())
                    .withDetail("exists", Files.exists(root))
                    .build();
        } catch (SecurityException e) {
            log.error("Cold store health check failed: root={}", root, e);
            return Health.down()
                    .withDetail("root", root.toString())
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", e.getMessage())
                    .build();
        }
    }
}
