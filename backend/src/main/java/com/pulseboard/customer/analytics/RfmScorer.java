package com.pulseboard.customer.analytics;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Scores every purchasing customer on recency, frequency and monetary value.
 *
 * <p>Each dimension is split into quintiles by rank: the customer at zero-based position
 * {@code i} of {@code n} in sort order gets {@code min(i * 5 / n + 1, 5)}. Sorting is stable,
 * so ties keep the order in which customers arrived.
 */
@Component
public class RfmScorer {

    public List<RfmProfile> score(List<CustomerRecord> customers, List<OrderRecord> orders, OffsetDateTime now) {
        List<CustomerRecord> eligible = customers.stream()
            .filter(CustomerRecord::isScorable)
            .toList();
        if (eligible.isEmpty()) {
            return List.of();
        }

        Map<String, OffsetDateTime> lastOrderByEmail = lastOrderByEmail(orders);

        int n = eligible.size();
        long[] daysSince = new long[n];
        OffsetDateTime[] lastOrderAt = new OffsetDateTime[n];
        for (int i = 0; i < n; i++) {
            OffsetDateTime last = lastOrderByEmail.get(eligible.get(i).email());
            lastOrderAt[i] = last;
            daysSince[i] = last == null
                ? RfmProfile.NEVER_ORDERED_DAYS
                : Math.max(0, Duration.between(last, now).toDays());
        }

        // most recent sorts last, so it lands in quintile 5
        int[] recency = quintiles(n, Comparator.comparingLong((Integer i) -> daysSince[i]).reversed());
        int[] frequency = quintiles(n, Comparator.comparingInt((Integer i) -> eligible.get(i).ordersCount()));
        int[] monetary = quintiles(n, Comparator.comparingDouble((Integer i) -> eligible.get(i).totalSpent()));

        List<RfmProfile> profiles = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            profiles.add(new RfmProfile(
                eligible.get(i),
                daysSince[i],
                lastOrderAt[i],
                recency[i],
                frequency[i],
                monetary[i],
                RfmSegmentClassifier.classify(recency[i], frequency[i], monetary[i])
            ));
        }
        return profiles;
    }

    static int quintile(int rank, int total) {
        return Math.min((int) ((long) rank * 5 / total) + 1, 5);
    }

    private int[] quintiles(int n, Comparator<Integer> order) {
        List<Integer> indices = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            indices.add(i);
        }
        indices.sort(order);

        int[] scores = new int[n];
        for (int rank = 0; rank < n; rank++) {
            scores[indices.get(rank)] = quintile(rank, n);
        }
        return scores;
    }

    private Map<String, OffsetDateTime> lastOrderByEmail(List<OrderRecord> orders) {
        Map<String, OffsetDateTime> lastOrder = new HashMap<>();
        for (OrderRecord order : orders) {
            if (order.createdAt() == null) {
                continue;
            }
            lastOrder.merge(order.customerEmail(), order.createdAt(), (a, b) -> a.isAfter(b) ? a : b);
        }
        return lastOrder;
    }
}
