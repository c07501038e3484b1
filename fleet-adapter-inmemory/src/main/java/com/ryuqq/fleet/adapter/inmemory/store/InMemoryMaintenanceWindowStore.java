package com.ryuqq.fleet.adapter.inmemory.store;

import com.ryuqq.fleet.core.model.WindowId;
import com.ryuqq.fleet.core.schedule.MaintenanceWindow;
import com.ryuqq.fleet.core.spi.MaintenanceWindowStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link MaintenanceWindowStore}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMaintenanceWindowStore implements MaintenanceWindowStore {

    private final ConcurrentHashMap<WindowId, MaintenanceWindow> windows = new ConcurrentHashMap<>();

    @Override
    public void save(MaintenanceWindow window) {
        if (window == null) {
            throw new IllegalArgumentException("window cannot be null");
        }
        windows.put(window.windowId(), window);
    }

    @Override
    public Optional<MaintenanceWindow> find(WindowId windowId) {
        if (windowId == null) {
            throw new IllegalArgumentException("windowId cannot be null");
        }
        return Optional.ofNullable(windows.get(windowId));
    }

    @Override
    public List<MaintenanceWindow> findActive() {
        return windows.values().stream()
            .filter(MaintenanceWindow::active)
            .sorted(Comparator.comparing(MaintenanceWindow::windowId))
            .collect(Collectors.toList());
    }
}
