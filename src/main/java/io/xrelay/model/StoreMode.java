package io.xrelay.model;

public enum StoreMode {
    DURABLE("durable"),
    VOLATILE("volatile");

    private final String label;

    StoreMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
