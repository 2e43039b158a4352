package com.transparenta.analytics.model;

public enum RootDepth {
    CHAPTER(2),
    SUBCHAPTER(4),
    PARAGRAPH(6);

    private final int digits;

    RootDepth(int digits) {
        this.digits = digits;
    }

    public int digits() {
        return digits;
    }
}
