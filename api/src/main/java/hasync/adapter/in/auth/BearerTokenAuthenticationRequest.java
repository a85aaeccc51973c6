package hasync.adapter.in.auth;

import io.quarkus.security.identity.request.BaseAuthenticationRequest;

/**
 * Authentication request carrying a raw bearer token for {@link CredentialIdentityProvider}.
 */
public class BearerTokenAuthenticationRequest extends BaseAuthenticationRequest {

    private final String token;

    public BearerTokenAuthenticationRequest(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
