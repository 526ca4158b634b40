package com.bastion.tenancy;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts a tenant subdomain from a {@code Host} header value.
 * <p>
 * {@code acme.example.com:8443} yields {@code acme}. Hosts with fewer than three labels have
 * no tenant subdomain, and reserved labels such as {@code www} are never tenants.
 */
public final class SubdomainParser {

    public static final Set<String> DEFAULT_RESERVED = Set.of("www", "api", "app");

    private static final int MIN_LABELS = 3;

    private final Set<String> reserved;

    public SubdomainParser() {
        this(DEFAULT_RESERVED);
    }

    public SubdomainParser(Set<String> reserved) {
        this.reserved = reserved.stream()
                .map(label -> label.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public Optional<String> parse(String host) {
        if (host == null || host.isBlank()) {
            return Optional.empty();
        }
        String hostname = stripPort(host.strip());
        String[] labels = hostname.split("\\.");
        if (labels.length < MIN_LABELS) {
            return Optional.empty();
        }
        String candidate = labels[0].toLowerCase(Locale.ROOT);
        if (candidate.isEmpty() || reserved.contains(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    public Set<String> reserved() {
        return reserved;
    }

    private static String stripPort(String host) {
        int colon = host.lastIndexOf(':');
        return colon < 0 ? host : host.substring(0, colon);
    }
}
