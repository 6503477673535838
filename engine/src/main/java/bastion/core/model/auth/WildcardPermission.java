package bastion.core.model.auth;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A permission of the form {@code domain:actions:targets}.
 *
 * <p>Each part may list several comma-separated values or the wildcard {@code *}.
 * Missing trailing parts are implied wildcards, so {@code document} grants every
 * action on every document and {@code document:read} grants reading any document.
 *
 * <p>Examples:
 * <ul>
 *   <li>{@code document:read,write:report-1}</li>
 *   <li>{@code document:*:report-1}</li>
 *   <li>{@code *}</li>
 * </ul>
 *
 * @param domain  resource domain, or {@code *}
 * @param actions permitted actions; contains only {@code *} when unrestricted
 * @param targets permitted targets; contains only {@code *} when unrestricted
 */
public record WildcardPermission(String domain, Set<String> actions, Set<String> targets) {

    public static final String WILDCARD = "*";
    private static final String PART_DIVIDER = ":";
    private static final String SUBPART_DIVIDER = ",";

    public WildcardPermission {
        actions = Set.copyOf(actions);
        targets = Set.copyOf(targets);
    }

    /**
     * Parse a permission string.
     *
     * @throws IllegalArgumentException if the string is blank or has more than three parts
     */
    public static WildcardPermission parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Permission cannot be null or blank");
        }
        final var parts = value.trim().split(PART_DIVIDER, -1);
        if (parts.length > 3) {
            throw new IllegalArgumentException("Permission has too many parts: " + value);
        }
        final var domain = parts[0].trim().isEmpty() ? WILDCARD : parts[0].trim();
        final var actions = parts.length > 1 ? subparts(parts[1]) : Set.of(WILDCARD);
        final var targets = parts.length > 2 ? subparts(parts[2]) : Set.of(WILDCARD);
        return new WildcardPermission(domain, actions, targets);
    }

    private static Set<String> subparts(String part) {
        final List<String> values = Arrays.stream(part.split(SUBPART_DIVIDER))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        if (values.isEmpty() || values.contains(WILDCARD)) {
            return Set.of(WILDCARD);
        }
        return values.stream().collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Check whether this permission implies the required one.
     */
    public boolean implies(WildcardPermission required) {
        return covers(Set.of(domain), Set.of(required.domain))
                && covers(actions, required.actions)
                && covers(targets, required.targets);
    }

    private static boolean covers(Set<String> granted, Set<String> required) {
        if (granted.contains(WILDCARD)) {
            return true;
        }
        if (required.contains(WILDCARD)) {
            return false;
        }
        return granted.containsAll(required);
    }

    @Override
    public String toString() {
        return domain + PART_DIVIDER + String.join(SUBPART_DIVIDER, actions) + PART_DIVIDER
                + String.join(SUBPART_DIVIDER, targets);
    }
}
