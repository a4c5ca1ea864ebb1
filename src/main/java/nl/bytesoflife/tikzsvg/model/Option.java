package nl.bytesoflife.tikzsvg.model;

/**
 * One entry of a bracketed option list: a flag such as {@code thick} (value {@code null})
 * or a {@code key=value} pair.
 */
public record Option(String key, String value) {

    public static Option flag(String key) {
        return new Option(key, null);
    }

    public boolean isFlag() {
        return value == null;
    }

    @Override
    public String toString() {
        return isFlag() ? key : key + "=" + value;
    }
}
