package io.b2mash.b2b.timeledger.domain;

import java.time.LocalDate;
import java.util.UUID;

public record Holiday(UUID id, String name, LocalDate date, String country) {}
