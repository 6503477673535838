package bastion.core.model.auth;

import java.time.Instant;

/**
 * Reference to a dispatched one-time code challenge.
 *
 * @param principal  account the challenge was sent for
 * @param tag        tag of the secret the code was generated from
 * @param dispatcher name of the dispatcher that delivered it
 * @param issuedAt   when the challenge was issued
 * @param expiresAt  last instant at which the code is still accepted
 */
public record ChallengeRef(String principal, String tag, String dispatcher, Instant issuedAt, Instant expiresAt) {}
