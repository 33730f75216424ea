package com.pulseboard.customer.controller;

import com.pulseboard.customer.dto.BrandAffinityResponse;
import com.pulseboard.customer.dto.CohortRetentionResponse;
import com.pulseboard.customer.dto.CustomerDashboardResponse;
import com.pulseboard.customer.dto.CustomerDetailResponse;
import com.pulseboard.customer.dto.CustomerSearchResultResponse;
import com.pulseboard.customer.dto.SegmentSummaryResponse;
import com.pulseboard.customer.service.CustomerIntelligenceService;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/customers")
public class CustomerIntelligenceController {

    private final CustomerIntelligenceService customerIntelligenceService;

    public CustomerIntelligenceController(CustomerIntelligenceService customerIntelligenceService) {
        this.customerIntelligenceService = customerIntelligenceService;
    }

    @GetMapping("/dashboard")
    public CustomerDashboardResponse getDashboard() {
        return customerIntelligenceService.getDashboard();
    }

    @GetMapping("/detail")
    public CustomerDetailResponse getDetail(@RequestParam(name = "email") @NotBlank String email) {
        return customerIntelligenceService.getCustomerDetail(email);
    }

    @GetMapping("/search")
    public List<CustomerSearchResultResponse> search(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "limit", defaultValue = "20") int limit
    ) {
        return customerIntelligenceService.searchCustomers(query, limit);
    }

    @GetMapping("/rfm-segments")
    public List<SegmentSummaryResponse> getRfmSegments() {
        return customerIntelligenceService.getRfmSegments();
    }

    @GetMapping("/cohort-data")
    public CohortRetentionResponse getCohortData() {
        return customerIntelligenceService.getCohortData();
    }

    @GetMapping("/brand-affinity")
    public List<BrandAffinityResponse> getBrandAffinity() {
        return customerIntelligenceService.getBrandAffinity();
    }
}
