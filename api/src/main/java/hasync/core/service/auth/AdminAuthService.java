package hasync.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import hasync.core.config.AdminAuthConfig;
import hasync.core.model.auth.IssuedToken;
import hasync.core.model.auth.Role;
import hasync.core.model.common.ErrorCode;
import hasync.core.model.common.ServiceException;
import hasync.core.port.in.TokenManagement;
import hasync.core.port.out.ScopeRegistry;
import hasync.core.service.ratelimit.PairingRateLimitService;
import hasync.core.util.SecureHash;

/**
 * Password login for the single configured administrator.
 *
 * <p>Username and password are compared as SHA-256 digests in constant time, and both
 * comparisons always run, so timing reveals neither which field was wrong nor how much
 * of it matched. The credential is authorized for the scopes known at login; scopes
 * registered later need a fresh login.
 */
@ApplicationScoped
public class AdminAuthService {

    private static final Logger LOG = Logger.getLogger(AdminAuthService.class);

    static final String SUBJECT_PREFIX = "admin:";

    private final AdminAuthConfig config;
    private final TokenManagement tokens;
    private final PairingRateLimitService rateLimits;
    private final ScopeRegistry scopes;

    public AdminAuthService(
            AdminAuthConfig config,
            TokenManagement tokens,
            PairingRateLimitService rateLimits,
            ScopeRegistry scopes) {
        this.config = config;
        this.tokens = tokens;
        this.rateLimits = rateLimits;
        this.scopes = scopes;
    }

    /**
     * Authenticate and issue an ADMIN credential.
     *
     * @param username      presented username
     * @param password      presented password
     * @param clientAddress caller address used for rate limiting
     */
    public Uni<IssuedToken> login(String username, String password, String clientAddress) {
        return rateLimits.checkLogin(clientAddress).flatMap(decision -> {
            final var configured = config.password();
            if (configured.isEmpty() || configured.get().isEmpty()) {
                LOG.warn("Admin login attempted but no admin password is configured");
                return Uni.createFrom().<IssuedToken>failure(unauthorized());
            }

            final var userMatches = digestEquals(config.username(), username);
            final var passwordMatches = digestEquals(configured.get(), password);
            if (!(userMatches & passwordMatches)) {
                LOG.warnf("Failed admin login for username '%s'", username);
                return Uni.createFrom().<IssuedToken>failure(unauthorized());
            }

            return scopes.knownScopes()
                    .flatMap(known -> tokens.issue(SUBJECT_PREFIX + config.username(), Role.ADMIN, known))
                    .invoke(issued -> LOG.infof("Admin %s logged in", config.username()));
        });
    }

    /**
     * Revoke the credential the caller authenticated with.
     */
    public Uni<Boolean> logout(String rawToken) {
        return tokens.revokeToken(rawToken, "logout");
    }

    private static ServiceException unauthorized() {
        return new ServiceException(ErrorCode.UNAUTHORIZED, "Invalid administrator credentials");
    }

    private static boolean digestEquals(String expected, String presented) {
        return SecureHash.constantTimeEquals(
                SecureHash.sha256Hex(expected), SecureHash.sha256Hex(presented == null ? "" : presented));
    }
}
