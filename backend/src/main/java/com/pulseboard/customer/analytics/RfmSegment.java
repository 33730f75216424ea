package com.pulseboard.customer.analytics;

import java.util.Set;

public enum RfmSegment {

    CHAMPIONS(
        "Champions",
        "#c49a4a",
        "Best customers. Bought recently, buy often, spend the most.",
        "Reward them. Offer exclusive early access and VIP programs."
    ),
    LOYAL(
        "Loyal",
        "#1a7a3a",
        "Spend good money often. Responsive to promotions.",
        "Upsell higher-value products. Ask for reviews and referrals."
    ),
    POTENTIAL_LOYALIST(
        "Potential Loyalist",
        "#1f6f6b",
        "Recent customers with above-average frequency.",
        "Offer loyalty programs and recommend related products."
    ),
    PROMISING(
        "Promising",
        "#3a8fd6",
        "Recent shoppers who haven't bought much yet.",
        "Create brand awareness. Offer free trials or samples."
    ),
    NEW_CUSTOMERS(
        "New Customers",
        "#6b5ce7",
        "Bought recently for the first time.",
        "Provide onboarding support. Start building the relationship."
    ),
    NEED_ATTENTION(
        "Need Attention",
        "#c49a4a",
        "Above-average recency, frequency and monetary but slipping.",
        "Reactivate with limited-time offers and personalised recommendations."
    ),
    ABOUT_TO_SLEEP(
        "About to Sleep",
        "#e88c3a",
        "Below-average recency and frequency. Losing them.",
        "Share valuable resources. Recommend popular products. Offer discounts."
    ),
    AT_RISK(
        "At Risk",
        "#b5342a",
        "Spent big money, purchased often, but a long time ago.",
        "Send personalised reactivation campaigns. Offer renewals or new products."
    ),
    HIBERNATING(
        "Hibernating",
        "#8b5e3c",
        "Last purchase was long ago. Low frequency and spend.",
        "Offer deep discounts. Recreate brand value. Likely to lose if not engaged."
    ),
    LOST(
        "Lost",
        "#6b7280",
        "Lowest recency, frequency, and monetary scores.",
        "Revive with aggressive win-back campaign or accept and focus elsewhere."
    );

    /** Segments counted as at risk of churning in the pulse status. */
    public static final Set<RfmSegment> CHURN_RISK = Set.of(AT_RISK, HIBERNATING, LOST);

    /** Segments counted as churned by the retention KPIs. */
    public static final Set<RfmSegment> CHURNED = Set.of(HIBERNATING, LOST);

    /** Segments counted by the overview at-risk KPI. */
    public static final Set<RfmSegment> SLIPPING = Set.of(AT_RISK, HIBERNATING);

    private final String label;
    private final String color;
    private final String description;
    private final String action;

    RfmSegment(String label, String color, String description, String action) {
        this.label = label;
        this.color = color;
        this.description = description;
        this.action = action;
    }

    public String label() {
        return label;
    }

    public String color() {
        return color;
    }

    public String description() {
        return description;
    }

    public String action() {
        return action;
    }
}
