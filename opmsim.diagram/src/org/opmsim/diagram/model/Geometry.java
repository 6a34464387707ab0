package org.opmsim.diagram.model;

/**
 * Immutable bounding box of a node. States use their parent object's local frame.
 */
public final class Geometry {
    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public Geometry(double x, double y, double width, double height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Geometry size cannot be negative: " + width + "x" + height);
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }

    public double getRight() {
        return x + width;
    }

    public Geometry withPosition(double newX, double newY) {
        return new Geometry(newX, newY, width, height);
    }

    public Geometry withSize(double newWidth, double newHeight) {
        return new Geometry(x, y, newWidth, newHeight);
    }

    public Geometry translate(double dx, double dy) {
        return new Geometry(x + dx, y + dy, width, height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Geometry)) return false;
        Geometry other = (Geometry) o;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(width, other.width) == 0
                && Double.compare(height, other.height) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(x);
        result = 31 * result + Double.hashCode(y);
        result = 31 * result + Double.hashCode(width);
        result = 31 * result + Double.hashCode(height);
        return result;
    }

    @Override
    public String toString() {
        return String.format("(%.1f, %.1f %.1fx%.1f)", x, y, width, height);
    }
}
