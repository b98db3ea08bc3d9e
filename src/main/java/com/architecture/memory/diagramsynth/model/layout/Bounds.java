package com.architecture.memory.diagramsynth.model.layout;

import lombok.Value;

/**
 * Axis-aligned rectangle given by its top-left corner and size.
 */
@Value
public class Bounds {

    double x;
    double y;
    double width;
    double height;

    public double getRight() {
        return x + width;
    }

    public double getBottom() {
        return y + height;
    }

    public double getCenterX() {
        return x + width / 2;
    }

    public double getCenterY() {
        return y + height / 2;
    }

    public Bounds union(Bounds other) {
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        double maxX = Math.max(getRight(), other.getRight());
        double maxY = Math.max(getBottom(), other.getBottom());
        return new Bounds(minX, minY, maxX - minX, maxY - minY);
    }
}
