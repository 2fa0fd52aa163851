package io.objection.core;

import java.util.Optional;

/**
 * Payload of the session bootstrap event: {@code {"token": string|null}}.
 *
 * @param token renderer-supplied session token, {@code null} for a fresh session
 */
public record MountData(String token) {

    public Optional<String> optionalToken() {
        return Optional.ofNullable(token);
    }
}
