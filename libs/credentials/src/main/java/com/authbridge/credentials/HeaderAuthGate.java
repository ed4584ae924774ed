package com.authbridge.credentials;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns the proxy's trusted headers into an {@link Identity}.
 * <p>
 * Headers are taken verbatim; authenticity is the proxy's job. An absent username means the
 * caller is anonymous, which is reported as an empty result rather than an error.
 */
public final class HeaderAuthGate {

    private static final Logger log = LoggerFactory.getLogger(HeaderAuthGate.class);

    private final HeaderNames headers;
    private final GroupPolicy groupPolicy;

    public HeaderAuthGate(HeaderNames headers, GroupPolicy groupPolicy) {
        this.headers = headers;
        this.groupPolicy = groupPolicy;
    }

    /**
     * Extracts the identity from request headers.
     *
     * @param header looks up a header value by name, returning null when absent
     * @return the identity, or empty when the username header is absent or blank
     * @throws MissingHeaderException if the groups header is required but absent
     * @throws InvalidHeaderException if any header value fails validation or the whitelist
     */
    public Optional<Identity> extractIdentity(Function<String, String> header) {
        String username = trimToNull(header.apply(headers.username()));
        if (username == null) {
            log.debug("No {} header, treating request as anonymous", headers.username());
            return Optional.empty();
        }

        String rawGroups = header.apply(headers.groups());
        if (rawGroups == null && groupPolicy.required()) {
            throw new MissingHeaderException(headers.groups());
        }

        List<String> errors = new ArrayList<>();
        List<String> groups = parseGroups(rawGroups, errors);

        Identity identity = new Identity(
                username,
                trimToNull(header.apply(headers.email())),
                trimToNull(header.apply(headers.name())),
                groups);

        IdentityValidationResult validation = IdentityValidator.validate(identity);
        errors.addAll(validation.errors());
        if (!errors.isEmpty()) {
            throw new InvalidHeaderException(errors);
        }
        return Optional.of(identity);
    }

    /** Header names this gate reads. */
    public HeaderNames headers() {
        return headers;
    }

    private List<String> parseGroups(String rawGroups, List<String> errors) {
        if (rawGroups == null || rawGroups.isEmpty()) {
            return List.of();
        }
        List<String> groups = new ArrayList<>();
        for (String part : rawGroups.split(",")) {
            String group = part.trim();
            if (group.isEmpty()) {
                continue;
            }
            if (!groupPolicy.allows(group)) {
                errors.add("group '" + group + "' is not in whitelist");
                continue;
            }
            groups.add(group);
        }
        return groups;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
