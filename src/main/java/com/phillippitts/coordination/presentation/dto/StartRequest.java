package com.phillippitts.coordination.presentation.dto;

import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public record StartRequest(
        @PositiveOrZero int itemCount,
        List<String> domains,
        String strategy,
        List<String> itemKinds
) {
}
