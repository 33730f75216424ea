package com.pulseboard.customer.analytics;

import com.pulseboard.customer.dto.CohortRetentionResponse;
import com.pulseboard.customer.dto.CohortRowResponse;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Monthly cohort retention. A customer's cohort is the calendar month of their earliest
 * order; retention at offset {@code k} is the share of the cohort that ordered in the
 * {@code k}-th month after it.
 */
@Component
public class CohortRetentionCalculator {

    private final CustomerIntelligenceProperties properties;

    public CohortRetentionCalculator(CustomerIntelligenceProperties properties) {
        this.properties = properties;
    }

    public CohortRetentionResponse calculate(List<OrderRecord> orders) {
        ZoneId zone = properties.zoneId();
        int months = Math.max(1, properties.getCohortMonths());

        Map<String, OffsetDateTime> firstOrderByEmail = new HashMap<>();
        for (OrderRecord order : orders) {
            if (order.createdAt() != null) {
                firstOrderByEmail.merge(order.customerEmail(), order.createdAt(), (a, b) -> a.isBefore(b) ? a : b);
            }
        }
        if (firstOrderByEmail.isEmpty()) {
            return CohortRetentionResponse.empty();
        }

        // cohort month -> order month -> customers active that month
        TreeMap<YearMonth, Map<YearMonth, Set<String>>> activity = new TreeMap<>();
        for (OrderRecord order : orders) {
            OffsetDateTime firstOrder = firstOrderByEmail.get(order.customerEmail());
            if (firstOrder == null || order.createdAt() == null) {
                continue;
            }
            YearMonth cohort = monthOf(firstOrder, zone);
            YearMonth orderMonth = monthOf(order.createdAt(), zone);
            activity.computeIfAbsent(cohort, key -> new HashMap<>())
                .computeIfAbsent(orderMonth, key -> new HashSet<>())
                .add(order.customerEmail());
        }

        List<YearMonth> recentCohorts = new ArrayList<>(activity.keySet());
        recentCohorts = recentCohorts.subList(Math.max(0, recentCohorts.size() - months), recentCohorts.size());

        List<CohortRowResponse> rows = new ArrayList<>();
        for (YearMonth cohort : recentCohorts) {
            Map<YearMonth, Set<String>> byMonth = activity.get(cohort);
            int size = byMonth.getOrDefault(cohort, Set.of()).size();
            if (size == 0) {
                continue;
            }

            List<Double> retention = new ArrayList<>(months);
            for (int offset = 0; offset < months; offset++) {
                int active = byMonth.getOrDefault(cohort.plusMonths(offset), Set.of()).size();
                retention.add(Ratios.percent(active, size));
            }
            rows.add(new CohortRowResponse(cohort.toString(), size, List.copyOf(retention)));
        }

        return new CohortRetentionResponse(rows, months);
    }

    private static YearMonth monthOf(OffsetDateTime timestamp, ZoneId zone) {
        return YearMonth.from(timestamp.atZoneSameInstant(zone));
    }
}
