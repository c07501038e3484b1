package com.ryuqq.fleet.core.schedule;

import com.ryuqq.fleet.core.model.TargetSelector;
import com.ryuqq.fleet.core.model.WindowId;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Set;
import java.util.TreeSet;

/**
 * 유지보수 창: 변경 작업이 허용되는 반복 시간대.
 *
 * <p><strong>요일 인코딩:</strong> 0 = 일요일 … 6 = 토요일. 빈 집합은 매일을 의미합니다.</p>
 *
 * <p><strong>시간 판정:</strong> 창의 시간대(timezone)로 변환한 현지 시각이
 * [startTime, endTime] 안에 있으면 열린 것으로 봅니다 (양 끝 포함).
 * endTime이 startTime보다 이르면 자정을 넘어가는 창으로, 시작 요일의 startTime부터
 * 다음 날 endTime까지 열려 있습니다.</p>
 *
 * <p><strong>적용 범위:</strong> scope가 null이면 전체 Fleet에 적용됩니다.</p>
 *
 * @param windowId 창 ID
 * @param name 이름
 * @param startTime 시작 시각 (현지)
 * @param endTime 종료 시각 (현지)
 * @param daysOfWeek 시작 요일 집합 (0~6)
 * @param timezone 시간대 (null이면 Europe/Berlin)
 * @param active 활성 여부
 * @param scope 적용 대상 (null이면 전체)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MaintenanceWindow(
    WindowId windowId,
    String name,
    LocalTime startTime,
    LocalTime endTime,
    Set<Integer> daysOfWeek,
    ZoneId timezone,
    boolean active,
    TargetSelector scope
) {

    public static final ZoneId DEFAULT_TIMEZONE = ZoneId.of("Europe/Berlin");

    public MaintenanceWindow {
        if (windowId == null) {
            throw new IllegalArgumentException("windowId cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("startTime and endTime cannot be null");
        }
        if (startTime.equals(endTime)) {
            throw new IllegalArgumentException("startTime and endTime must differ (current: " + startTime + ")");
        }
        Set<Integer> days = new TreeSet<>();
        if (daysOfWeek != null) {
            for (Integer day : daysOfWeek) {
                if (day == null || day < 0 || day > 6) {
                    throw new IllegalArgumentException("daysOfWeek must be between 0 and 6 (current: " + day + ")");
                }
                days.add(day);
            }
        }
        daysOfWeek = Set.copyOf(days);
        if (timezone == null) {
            timezone = DEFAULT_TIMEZONE;
        }
    }

    /**
     * 전체 Fleet에 적용되는 활성 창 생성.
     */
    public static MaintenanceWindow of(String name, LocalTime startTime, LocalTime endTime,
                                       Set<Integer> daysOfWeek, ZoneId timezone) {
        return new MaintenanceWindow(WindowId.newId(), name, startTime, endTime, daysOfWeek, timezone, true, null);
    }

    public MaintenanceWindow withScope(TargetSelector newScope) {
        return new MaintenanceWindow(windowId, name, startTime, endTime, daysOfWeek, timezone, active, newScope);
    }

    public MaintenanceWindow withActive(boolean newActive) {
        return new MaintenanceWindow(windowId, name, startTime, endTime, daysOfWeek, timezone, newActive, scope);
    }

    /**
     * 주어진 시각에 창이 열려 있는지 확인.
     *
     * @param instant 확인할 시각
     * @return 활성이고 시간대가 맞으면 true
     */
    public boolean isOpen(Instant instant) {
        if (!active) {
            return false;
        }
        ZonedDateTime local = instant.atZone(timezone);
        LocalTime time = local.toLocalTime();
        int today = toSundayBased(local.getDayOfWeek());

        if (!wrapsMidnight()) {
            return appliesOn(today) && !time.isBefore(startTime) && !time.isAfter(endTime);
        }
        int yesterday = (today + 6) % 7;
        return (appliesOn(today) && !time.isBefore(startTime))
            || (appliesOn(yesterday) && !time.isAfter(endTime));
    }

    /**
     * 자정을 넘어가는 창인지 확인.
     */
    public boolean wrapsMidnight() {
        return endTime.isBefore(startTime);
    }

    private boolean appliesOn(int day) {
        return daysOfWeek.isEmpty() || daysOfWeek.contains(day);
    }

    /**
     * java.time 요일(월=1 … 일=7)을 0=일요일 인코딩으로 변환.
     *
     * @param dayOfWeek 요일
     * @return 0~6
     */
    public static int toSundayBased(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }
}
