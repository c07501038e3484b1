package com.ryuqq.fleet.core.schedule;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MaintenanceWindow 테스트.
 *
 * <p>2025-01-06은 월요일이며 Europe/Berlin은 UTC+1입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MaintenanceWindowTest {

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    @Test
    void sameDayWindow_EndsAreInclusive() {
        // Given
        MaintenanceWindow window = MaintenanceWindow.of("office", LocalTime.of(9, 0), LocalTime.of(17, 0), Set.of(), BERLIN);

        // When & Then
        assertTrue(window.isOpen(Instant.parse("2025-01-06T08:00:00Z")));
        assertTrue(window.isOpen(Instant.parse("2025-01-06T16:00:00Z")));
        assertFalse(window.isOpen(Instant.parse("2025-01-06T16:00:01Z")));
        assertFalse(window.isOpen(Instant.parse("2025-01-06T07:59:59Z")));
    }

    @Test
    void emptyDays_AppliesEveryDay() {
        MaintenanceWindow window = MaintenanceWindow.of("office", LocalTime.of(9, 0), LocalTime.of(17, 0), null, BERLIN);

        assertTrue(window.daysOfWeek().isEmpty());
        assertTrue(window.isOpen(Instant.parse("2025-01-05T10:00:00Z")));
        assertTrue(window.isOpen(Instant.parse("2025-01-11T10:00:00Z")));
    }

    @Test
    void overnightWindow_BelongsToStartDay() {
        // Given: Monday 22:00 to Tuesday 04:00
        MaintenanceWindow window = MaintenanceWindow.of("night", LocalTime.of(22, 0), LocalTime.of(4, 0), Set.of(1), BERLIN);

        // When & Then
        assertTrue(window.wrapsMidnight());
        assertTrue(window.isOpen(Instant.parse("2025-01-06T22:00:00Z")));
        assertTrue(window.isOpen(Instant.parse("2025-01-07T02:00:00Z")));
        assertFalse(window.isOpen(Instant.parse("2025-01-07T22:00:00Z")));
        assertFalse(window.isOpen(Instant.parse("2025-01-06T02:00:00Z")));
        assertFalse(window.isOpen(Instant.parse("2025-01-06T12:00:00Z")));
    }

    @Test
    void sunday_IsDayZero() {
        assertEquals(0, MaintenanceWindow.toSundayBased(DayOfWeek.SUNDAY));
        assertEquals(1, MaintenanceWindow.toSundayBased(DayOfWeek.MONDAY));
        assertEquals(6, MaintenanceWindow.toSundayBased(DayOfWeek.SATURDAY));

        MaintenanceWindow sundayOnly = MaintenanceWindow.of("weekend", LocalTime.of(0, 0), LocalTime.of(23, 59), Set.of(0), BERLIN);
        assertTrue(sundayOnly.isOpen(Instant.parse("2025-01-05T12:00:00Z")));
        assertFalse(sundayOnly.isOpen(Instant.parse("2025-01-06T12:00:00Z")));
    }

    @Test
    void timezone_AppliesToLocalTime() {
        MaintenanceWindow tokyo = MaintenanceWindow.of("tokyo", LocalTime.of(9, 0), LocalTime.of(10, 0), Set.of(), ZoneId.of("Asia/Tokyo"));

        assertTrue(tokyo.isOpen(Instant.parse("2025-01-06T00:30:00Z")));
        assertFalse(tokyo.isOpen(Instant.parse("2025-01-06T09:30:00Z")));
    }

    @Test
    void nullTimezone_DefaultsToBerlin() {
        MaintenanceWindow window = MaintenanceWindow.of("office", LocalTime.of(9, 0), LocalTime.of(17, 0), Set.of(), null);

        assertEquals(MaintenanceWindow.DEFAULT_TIMEZONE, window.timezone());
        assertEquals(BERLIN, window.timezone());
    }

    @Test
    void inactiveWindow_IsNeverOpen() {
        MaintenanceWindow window = MaintenanceWindow.of("office", LocalTime.of(9, 0), LocalTime.of(17, 0), Set.of(), BERLIN)
            .withActive(false);

        assertFalse(window.isOpen(Instant.parse("2025-01-06T10:00:00Z")));
    }

    @Test
    void invalidDefinition_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> MaintenanceWindow.of("bad", LocalTime.of(9, 0), LocalTime.of(17, 0), Set.of(7), BERLIN));
        assertThrows(IllegalArgumentException.class,
            () -> MaintenanceWindow.of("bad", LocalTime.of(9, 0), LocalTime.of(9, 0), Set.of(), BERLIN));
        assertThrows(IllegalArgumentException.class,
            () -> MaintenanceWindow.of(" ", LocalTime.of(9, 0), LocalTime.of(17, 0), Set.of(), BERLIN));
    }
}
