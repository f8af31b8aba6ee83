package com.len.kitchen.api.ticket.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ChangePriorityRequest(
        @NotNull(message = "priority는 필수입니다.")
        Integer priority,

        @NotBlank(message = "actor는 필수입니다.")
        String actor
) {}
