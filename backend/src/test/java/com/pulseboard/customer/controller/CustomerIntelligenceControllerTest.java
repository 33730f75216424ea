package com.pulseboard.customer.controller;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.pulseboard.common.GlobalExceptionHandler;
import com.pulseboard.customer.service.CustomerIntelligenceService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class CustomerIntelligenceControllerTest {

    @Mock
    private CustomerIntelligenceService customerIntelligenceService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CustomerIntelligenceController(customerIntelligenceService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void search_should_use_default_limit() throws Exception {
        when(customerIntelligenceService.searchCustomers("ann", 20)).thenReturn(List.of());

        mockMvc.perform(get("/api/customers/search").param("q", "ann"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());

        verify(customerIntelligenceService).searchCustomers("ann", 20);
    }

    @Test
    void search_should_reject_missing_query_parameter() throws Exception {
        mockMvc.perform(get("/api/customers/search"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.message").value("Missing required parameter: q"));

        verifyNoInteractions(customerIntelligenceService);
    }

    @Test
    void detail_should_map_missing_customer_to_not_found() throws Exception {
        when(customerIntelligenceService.getCustomerDetail(anyString()))
            .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Customer not found"));

        mockMvc.perform(get("/api/customers/detail").param("email", "ghost@test.com"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Customer not found"))
            .andExpect(jsonPath("$.path").value("/api/customers/detail"));
    }

    @Test
    void dashboard_should_map_store_failure_to_service_unavailable() throws Exception {
        when(customerIntelligenceService.getDashboard())
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(get("/api/customers/dashboard"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.message").value("Customer store is unavailable"));
    }
}
