package io.petfeeder.backend.schedule.dto;

import java.util.List;

public record ScheduleListResponse(
    List<ScheduleResponse> schedules, int total, int page, int pageSize, boolean hasNext) {}
