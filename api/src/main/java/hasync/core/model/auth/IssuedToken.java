package hasync.core.model.auth;

/**
 * A freshly issued credential together with its raw token.
 *
 * <p>The raw token exists only in this value, handed to the direct caller of the
 * issuing operation. {@link #toString()} never prints it.
 */
public record IssuedToken(String rawToken, Credential credential) {

    @Override
    public String toString() {
        return "IssuedToken[subjectId=" + credential.subjectId() + ", tokenId=" + credential.tokenId() + "]";
    }
}
