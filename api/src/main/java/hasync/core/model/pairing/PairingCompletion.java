package hasync.core.model.pairing;

import hasync.core.model.auth.IssuedToken;

/**
 * Result of completing a pairing session: the new client and its credential.
 *
 * <p>The raw token inside {@code issuedToken} is returned to the completing
 * administrator once and never stored.
 */
public record PairingCompletion(PairedClient client, IssuedToken issuedToken) {}
