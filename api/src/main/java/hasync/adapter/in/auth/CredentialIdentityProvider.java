package hasync.adapter.in.auth;

import java.security.Principal;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.model.auth.Credential;
import hasync.core.model.auth.Role;
import hasync.core.model.auth.TokenException;
import hasync.core.port.in.TokenManagement;

/**
 * Quarkus identity provider that verifies bearer tokens through {@link TokenManagement}.
 *
 * <p>The resulting {@link SecurityIdentity} has a {@link CredentialPrincipal} and the
 * security role matching the credential role.
 */
@ApplicationScoped
public class CredentialIdentityProvider implements IdentityProvider<BearerTokenAuthenticationRequest> {

    private static final Logger LOG = Logger.getLogger(CredentialIdentityProvider.class);

    /** Identity attribute holding the raw bearer token, used by logout. */
    public static final String RAW_TOKEN_ATTRIBUTE = "rawToken";

    private final TokenManagement tokens;

    public CredentialIdentityProvider(TokenManagement tokens) {
        this.tokens = tokens;
    }

    @Override
    public Class<BearerTokenAuthenticationRequest> getRequestType() {
        return BearerTokenAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            BearerTokenAuthenticationRequest request, AuthenticationRequestContext context) {
        return tokens.verify(request.getToken())
                .map(credential -> buildIdentity(credential, request.getToken()))
                .onFailure(TokenException.class)
                .transform(e -> {
                    LOG.debugv("Bearer authentication failed: {0}", ((TokenException) e).code());
                    return new AuthenticationFailedException(e);
                });
    }

    private SecurityIdentity buildIdentity(Credential credential, String rawToken) {
        LOG.debugv("Authenticated subject={0}, role={1}", credential.subjectId(), credential.role().value());
        return QuarkusSecurityIdentity.builder()
                .setPrincipal(new CredentialPrincipal(credential))
                .addRole(Roles.of(credential.role()))
                .addAttribute(RAW_TOKEN_ATTRIBUTE, rawToken)
                .build();
    }

    /**
     * Principal of an authenticated HASync credential.
     */
    public static class CredentialPrincipal implements Principal {

        private final Credential credential;

        public CredentialPrincipal(Credential credential) {
            this.credential = credential;
        }

        @Override
        public String getName() {
            return credential.subjectId();
        }

        public Role getRole() {
            return credential.role();
        }

        public Set<String> getScopes() {
            return credential.assignedScopes();
        }

        public String getTokenHash() {
            return credential.tokenHash();
        }
    }
}
