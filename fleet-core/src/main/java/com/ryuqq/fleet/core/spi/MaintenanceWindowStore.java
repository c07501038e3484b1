package com.ryuqq.fleet.core.spi;

import com.ryuqq.fleet.core.model.WindowId;
import com.ryuqq.fleet.core.schedule.MaintenanceWindow;

import java.util.List;
import java.util.Optional;

/**
 * Storage SPI for maintenance windows.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MaintenanceWindowStore {

    /**
     * Inserts or replaces a window.
     *
     * @param window the window
     * @throws IllegalArgumentException if window is null
     */
    void save(MaintenanceWindow window);

    Optional<MaintenanceWindow> find(WindowId windowId);

    /**
     * @return windows with {@code active = true}, ordered by window id
     */
    List<MaintenanceWindow> findActive();
}
