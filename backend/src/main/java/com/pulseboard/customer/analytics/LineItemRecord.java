package com.pulseboard.customer.analytics;

public record LineItemRecord(String brand, String title, String sku) {

    public String productKey() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        if (sku != null && !sku.isBlank()) {
            return sku;
        }
        return "Unknown";
    }

    public boolean hasBrand() {
        return brand != null && !brand.isBlank();
    }
}
