package uk.gegc.xpeconomy.features.monitoring.api.dto;

import java.util.List;
import java.util.UUID;

public record AnomalyDto(
        String type,
        String severity,
        long count,
        Long threshold,
        List<UUID> accountIds
) {}
