package com.pulseboard.customer.analytics;

import com.pulseboard.customer.dto.AcquisitionMonthResponse;
import com.pulseboard.customer.dto.OverviewKpisResponse;
import com.pulseboard.customer.dto.TopCustomerResponse;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

@Component
public class CustomerOverviewCalculator {

    private final CustomerIntelligenceProperties properties;

    public CustomerOverviewCalculator(CustomerIntelligenceProperties properties) {
        this.properties = properties;
    }

    public OverviewKpisResponse kpis(CustomerSnapshot snapshot, List<RfmProfile> profiles) {
        int active = 0;
        int atRisk = 0;
        long orders = 0;
        double spend = 0;
        long repeatRecencyDays = 0;
        int repeatWithRecency = 0;

        for (RfmProfile profile : profiles) {
            if (profile.daysSinceLastOrder() <= properties.getActiveWindowDays()) {
                active++;
            }
            if (RfmSegment.SLIPPING.contains(profile.segment())) {
                atRisk++;
            }
            orders += profile.ordersCount();
            spend += profile.totalSpent();
            if (profile.ordersCount() >= 2 && profile.hasOrderHistory()) {
                repeatRecencyDays += profile.daysSinceLastOrder();
                repeatWithRecency++;
            }
        }

        long purchasers = snapshot.customers().stream().filter(c -> c.ordersCount() >= 1).count();
        long repeaters = snapshot.customers().stream().filter(c -> c.ordersCount() >= 2).count();

        return new OverviewKpisResponse(
            snapshot.totalCustomerCount(),
            active,
            Ratios.average(orders, profiles.size(), 1),
            Ratios.average(spend, profiles.size(), 2),
            snapshot.newThisMonthCount(),
            Ratios.percent(repeaters, purchasers),
            atRisk,
            (int) Ratios.average(repeatRecencyDays, repeatWithRecency, 0)
        );
    }

    /**
     * Sign-ups by account-creation month over the trailing acquisition window, current month
     * included. Counts every customer, not only those who have ordered.
     */
    public List<AcquisitionMonthResponse> acquisitionTrend(List<OffsetDateTime> signupDates, OffsetDateTime now) {
        ZoneId zone = properties.zoneId();
        YearMonth current = YearMonth.from(now.atZoneSameInstant(zone));
        YearMonth earliest = current.minusMonths(Math.max(1, properties.getAcquisitionMonths()) - 1);

        Map<YearMonth, Integer> counts = new TreeMap<>();
        for (OffsetDateTime createdAt : signupDates) {
            if (createdAt == null) {
                continue;
            }
            YearMonth month = YearMonth.from(createdAt.atZoneSameInstant(zone));
            if (!month.isBefore(earliest) && !month.isAfter(current)) {
                counts.merge(month, 1, Integer::sum);
            }
        }

        return counts.entrySet().stream()
            .map(entry -> new AcquisitionMonthResponse(entry.getKey().toString(), entry.getValue()))
            .toList();
    }

    public List<TopCustomerResponse> topCustomers(List<RfmProfile> profiles) {
        ZoneId zone = properties.zoneId();
        return profiles.stream()
            .sorted(Comparator.comparingDouble(RfmProfile::totalSpent).reversed())
            .limit(Math.max(0, properties.getTopCustomersLimit()))
            .map(profile -> new TopCustomerResponse(
                profile.customer().displayName(),
                profile.customer().email(),
                profile.ordersCount(),
                profile.totalSpent(),
                profile.lastOrderAt() == null ? null : profile.lastOrderAt().atZoneSameInstant(zone).toLocalDate(),
                profile.segment().label(),
                profile.daysSinceLastOrder()
            ))
            .toList();
    }
}
