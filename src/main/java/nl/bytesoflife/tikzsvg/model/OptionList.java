package nl.bytesoflife.tikzsvg.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Options in source order. Later entries win when keys repeat.
 */
public record OptionList(List<Option> options) {

    private static final OptionList EMPTY = new OptionList(List.of());

    public OptionList {
        options = List.copyOf(options);
    }

    public static OptionList empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return options.isEmpty();
    }

    public Optional<String> get(String key) {
        String found = null;
        for (Option option : options) {
            if (option.key().equals(key) && !option.isFlag()) {
                found = option.value();
            }
        }
        return Optional.ofNullable(found);
    }

    public boolean hasFlag(String key) {
        return options.stream().anyMatch(o -> o.isFlag() && o.key().equals(key));
    }

    @Override
    public String toString() {
        return options.stream().map(Option::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
