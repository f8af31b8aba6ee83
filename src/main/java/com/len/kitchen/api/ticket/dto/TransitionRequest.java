package com.len.kitchen.api.ticket.dto;

import com.len.kitchen.domain.ticket.TicketTrigger;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TransitionRequest(
        @NotNull(message = "trigger는 필수입니다.")
        TicketTrigger trigger,

        @NotBlank(message = "actor는 필수입니다.")
        String actor
) {}
