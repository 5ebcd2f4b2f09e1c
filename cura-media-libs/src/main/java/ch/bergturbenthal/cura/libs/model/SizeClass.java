package ch.bergturbenthal.cura.libs.model;

import lombok.Getter;

/**
 * The two fixed thumbnail widths.
 */
public enum SizeClass {
    SMALL(150, "small"), MEDIUM(600, "medium");

    @Getter
    private final int width;
    @Getter
    private final String suffix;

    SizeClass(final int width, final String suffix) {
        this.width = width;
        this.suffix = suffix;
    }
}
