package nl.bytesoflife.tikzsvg.renderer.svg;

/**
 * Scope transformation in picture units (centimetres): {@code p' = p * scale + shift}.
 */
public record Transform(double scale, double shiftX, double shiftY) {

    private static final Transform IDENTITY = new Transform(1, 0, 0);

    public static Transform identity() {
        return IDENTITY;
    }

    public boolean isIdentity() {
        return scale == 1 && shiftX == 0 && shiftY == 0;
    }

    public double applyX(double x) {
        return x * scale + shiftX;
    }

    public double applyY(double y) {
        return y * scale + shiftY;
    }

    /**
     * Composes a transformation declared inside this one.
     */
    public Transform then(Transform inner) {
        if (inner.isIdentity()) {
            return this;
        }
        return new Transform(scale * inner.scale, scale * inner.shiftX + shiftX, scale * inner.shiftY + shiftY);
    }
}
