package io.b2mash.b2b.timeledger.domain;

import java.util.UUID;

public record WorkSchedule(UUID id, String name, WeeklyHours hours) {}
