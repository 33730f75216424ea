package com.pulseboard.customer.analytics;

import com.pulseboard.customer.dto.OverviewKpisResponse;
import com.pulseboard.customer.dto.PulseResponse;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class PulseNarrativeGenerator {

    private final CustomerIntelligenceProperties properties;

    public PulseNarrativeGenerator(CustomerIntelligenceProperties properties) {
        this.properties = properties;
    }

    public PulseResponse generate(List<RfmProfile> profiles, OverviewKpisResponse kpis) {
        int atRisk = 0;
        int champions = 0;
        double championRevenue = 0;
        double totalRevenue = 0;
        for (RfmProfile profile : profiles) {
            if (RfmSegment.CHURN_RISK.contains(profile.segment())) {
                atRisk++;
            }
            if (profile.segment() == RfmSegment.CHAMPIONS) {
                champions++;
                championRevenue += profile.totalSpent();
            }
            totalRevenue += profile.totalSpent();
        }

        long championRevenuePct = totalRevenue > 0 ? Math.round(championRevenue / totalRevenue * 100) : 0;
        long riskPct = profiles.isEmpty() ? 0 : Math.round(atRisk * 100.0 / profiles.size());

        String narrative = String.format(
            Locale.US,
            "%,d active customers out of %,d total, %,d Champions driving %d%% of revenue",
            kpis.activeCustomers(),
            kpis.totalCustomers(),
            champions,
            championRevenuePct
        );
        if (atRisk > 0) {
            narrative += String.format(Locale.US, ", but %,d customers at risk of churning", atRisk);
        }

        String proNarrative = String.format(
            Locale.US,
            "Customer base: %,d total, %,d active (%dd). "
                + "RFM analysis identifies %,d Champions (%d%% of revenue). "
                + "%,d customers classified At Risk/Hibernating/Lost (%d%% of purchasers). "
                + "Repeat rate: %s%%. Avg LTV: $%,.2f.",
            kpis.totalCustomers(),
            kpis.activeCustomers(),
            properties.getActiveWindowDays(),
            champions,
            championRevenuePct,
            atRisk,
            riskPct,
            kpis.repeatRate(),
            kpis.avgLtv()
        );

        return new PulseResponse(narrative, status(riskPct).label(), proNarrative);
    }

    static PulseStatus status(long riskPct) {
        if (riskPct >= 40) {
            return PulseStatus.CRITICAL;
        }
        if (riskPct >= 20) {
            return PulseStatus.AT_RISK;
        }
        if (riskPct >= 10) {
            return PulseStatus.STABLE;
        }
        return PulseStatus.THRIVING;
    }

    enum PulseStatus {
        CRITICAL("Critical"),
        AT_RISK("At Risk"),
        STABLE("Stable"),
        THRIVING("Thriving");

        private final String label;

        PulseStatus(String label) {
            this.label = label;
        }

        String label() {
            return label;
        }
    }
}
