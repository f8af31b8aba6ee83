package com.len.kitchen.api.board;

import com.len.kitchen.application.ticket.BoardSummary;
import com.len.kitchen.application.ticket.TicketQueryService;
import com.len.kitchen.application.ticket.TicketView;
import com.len.kitchen.application.timer.EscalationLevel;
import com.len.kitchen.application.timer.TicketTiming;
import com.len.kitchen.domain.settings.KitchenSettings;
import com.len.kitchen.domain.ticket.Ticket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BoardController.class)
class BoardControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    TicketQueryService ticketQueryService;

    @Test
    @DisplayName("summary: 상태별 건수 + active 합계")
    void summary() throws Exception {
        given(ticketQueryService.summary("hub-1")).willReturn(new BoardSummary("hub-1", 3, 2, 4, 1, 0));

        mockMvc.perform(get("/api/kitchen/hubs/hub-1/tickets/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inProgress").value(4))
                .andExpect(jsonPath("$.bumped").value(1));
    }

    @Test
    @DisplayName("active: 페이지 정보와 긴급도")
    void active() throws Exception {
        Ticket t = Ticket.receive("hub-1", "ord-1", "l1", "grill", "Burger", 1, null, 0,
                LocalDateTime.of(2026, 3, 1, 12, 0));
        given(ticketQueryService.listActive("hub-1", 0)).willReturn(new PageImpl<>(
                List.of(new TicketView(t, new TicketTiming(1900, EscalationLevel.CRITICAL))),
                PageRequest.of(0, 12), 13));

        mockMvc.perform(get("/api/kitchen/hubs/hub-1/tickets/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tickets[0].escalation").value("CRITICAL"))
                .andExpect(jsonPath("$.totalElements").value(13));
    }

    @Test
    @DisplayName("settings: 허브 설정 그대로")
    void settings() throws Exception {
        given(ticketQueryService.settings("hub-1")).willReturn(KitchenSettings.defaults());

        mockMvc.perform(get("/api/kitchen/hubs/hub-1/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.warningThresholdSeconds").value(900))
                .andExpect(jsonPath("$.itemsPerPage").value(12));
    }
}
