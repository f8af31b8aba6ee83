package com.len.kitchen.api.ticket.dto;

import jakarta.validation.constraints.NotBlank;

public record AdvanceRequest(
        @NotBlank(message = "actor는 필수입니다.")
        String actor
) {}
