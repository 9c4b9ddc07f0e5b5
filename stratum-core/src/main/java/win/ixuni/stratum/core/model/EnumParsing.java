package win.ixuni.stratum.core.model;

import win.ixuni.stratum.core.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Parses raw strings into the closed enums at the boundary
 * <p>
 * Accepts any case and either '-' or '_' as separator ("cost-optimized" == "COST_OPTIMIZED").
 */
final class EnumParsing {

    private EnumParsing() {
    }

    static <E extends Enum<E>> E parse(Class<E> type, String label, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(label + " must not be empty");
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            String allowed = Arrays.stream(type.getEnumConstants())
                    .map(c -> c.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            throw new ValidationException("Invalid " + label + " '" + raw + "', expected one of: " + allowed);
        }
    }
}
