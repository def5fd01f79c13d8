package com.fieldservice.backend.model;

import java.time.Instant;

/**
 * One recorded login outcome.
 *
 * @param identity  login the attempt was made for
 * @param source    client address the attempt came from
 * @param timestamp when the attempt was recorded
 * @param success   whether the credentials were accepted
 */
public record LoginAttempt(String identity, String source, Instant timestamp, boolean success) {
}
