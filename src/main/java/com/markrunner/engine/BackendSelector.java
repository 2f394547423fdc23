package com.markrunner.engine;

import com.markrunner.core.model.BackendType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Picks the most capable backend the host supports: coordinator, then indirect dispatch,
 * then the in-process sequential loop.
 */
@Service
public class BackendSelector {

    private static final Logger log = LoggerFactory.getLogger(BackendSelector.class);

    private final ExecutableLocator locator;
    private final EngineProperties properties;

    public BackendSelector(ExecutableLocator locator, EngineProperties properties) {
        this.locator = locator;
        this.properties = properties;
    }

    /**
     * Pure selection rule. Missing tools degrade down the chain; an explicit SEQUENTIAL
     * request is always honoured.
     */
    public static BackendType decide(boolean coordinatorAvailable, boolean dispatcherAvailable,
                                     BackendPreference preference) {
        return switch (preference) {
            case SEQUENTIAL -> BackendType.SEQUENTIAL;
            case INDIRECT -> dispatcherAvailable ? BackendType.INDIRECT_DISPATCH : BackendType.SEQUENTIAL;
            case AUTO, COORDINATOR -> {
                if (coordinatorAvailable) yield BackendType.COORDINATOR;
                yield dispatcherAvailable ? BackendType.INDIRECT_DISPATCH : BackendType.SEQUENTIAL;
            }
        };
    }

    public ExecutionBackend select(BackendPreference preference) {
        BackendPreference effective = preference == null || preference == BackendPreference.AUTO
                ? properties.getBackendPreference()
                : preference;
        BackendType type = decide(
                locator.isAvailable(properties.getCoordinatorBinary()),
                locator.isAvailable(properties.getDispatchBinary()),
                effective);
        if (effective == BackendPreference.INDIRECT && type != BackendType.INDIRECT_DISPATCH
                || effective == BackendPreference.COORDINATOR && type != BackendType.COORDINATOR) {
            log.warn("Requested backend {} is unavailable, using {}", effective, type);
        }
        log.debug("Selected backend {} (preference {})", type, effective);
        return backend(type);
    }

    public ExecutionBackend backend(BackendType type) {
        return switch (type) {
            case COORDINATOR -> new CoordinatorBackend(properties.getCoordinatorBinary(), properties.getShell());
            case INDIRECT_DISPATCH -> new IndirectDispatchBackend(properties.getDispatchBinary(),
                    properties.getShell(), properties.getProgressLockAttempts(), properties.getProgressLockSleepMs());
            case SEQUENTIAL -> new SequentialBackend(properties.getShell());
        };
    }

    /**
     * Which backends this host can run right now.
     */
    public Map<BackendType, Boolean> availability() {
        boolean shell = locator.isAvailable(properties.getShell());
        var map = new EnumMap<BackendType, Boolean>(BackendType.class);
        map.put(BackendType.COORDINATOR, shell && locator.isAvailable(properties.getCoordinatorBinary()));
        map.put(BackendType.INDIRECT_DISPATCH, shell && locator.isAvailable(properties.getDispatchBinary()));
        map.put(BackendType.SEQUENTIAL, shell);
        return map;
    }
}
