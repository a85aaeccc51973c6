package hasync;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.notNullValue;

import java.util.Map;
import java.util.Set;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * End-to-end pairing over HTTP using the test profile administrator.
 */
@QuarkusTest
@DisplayName("Pairing Flow Integration Tests")
class PairingFlowIntegrationTest {

    private String adminToken;

    @BeforeEach
    void login() {
        adminToken = given().contentType(ContentType.JSON)
                .body(Map.of("username", "admin", "password", "test-admin-password"))
                .when()
                .post("/api/auth/login")
                .then()
                .statusCode(200)
                .body("subjectId", equalTo("admin:admin"))
                .body("expiresAt", notNullValue())
                .extract()
                .path("token");
    }

    private Map<String, Object> createSession() {
        return given().header("Authorization", "Bearer " + adminToken)
                .contentType(ContentType.JSON)
                .when()
                .post("/api/pairing/sessions")
                .then()
                .statusCode(201)
                .body("pin", matchesPattern("[1-9][0-9]{5}"))
                .extract()
                .as(Map.class);
    }

    private void verify(String sessionId, String pin) {
        given().contentType(ContentType.JSON)
                .body(Map.of(
                        "pin", pin, "deviceName", "Kitchen Tablet", "deviceType", "tablet", "sessionId", sessionId))
                .when()
                .post("/api/pairing/verify")
                .then()
                .statusCode(200)
                .body("sessionId", equalTo(sessionId));
    }

    private Map<String, Object> complete(String sessionId, Set<String> scopes) {
        return given().header("Authorization", "Bearer " + adminToken)
                .contentType(ContentType.JSON)
                .body(Map.of("clientName", "Kitchen Tablet", "assignedScopes", scopes))
                .when()
                .post("/api/pairing/sessions/" + sessionId + "/complete")
                .then()
                .statusCode(201)
                .extract()
                .as(Map.class);
    }

    private static String wrongPin(String pin) {
        return "111111".equals(pin) ? "222222" : "111111";
    }

    @Nested
    @DisplayName("Administrator Login")
    class AdminLoginTests {

        @Test
        @DisplayName("should reject wrong password")
        void shouldRejectWrongPassword() {
            given().contentType(ContentType.JSON)
                    .body(Map.of("username", "admin", "password", "not-the-password"))
                    .when()
                    .post("/api/auth/login")
                    .then()
                    .statusCode(401)
                    .contentType("application/problem+json")
                    .body("code", equalTo("UNAUTHORIZED"));
        }

        @Test
        @DisplayName("should require a token for admin endpoints")
        void shouldRequireTokenForAdminEndpoints() {
            given().contentType(ContentType.JSON)
                    .when()
                    .post("/api/pairing/sessions")
                    .then()
                    .statusCode(401);

            given().when().get("/api/clients").then().statusCode(401);
        }

        @Test
        @DisplayName("should report readiness without a token")
        void shouldReportReadiness() {
            given().when()
                    .get("/q/health/ready")
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("UP"))
                    .body("checks.name", hasItem("realtime-connections"));
        }

        @Test
        @DisplayName("should reject a malformed bearer token")
        void shouldRejectMalformedToken() {
            given().header("Authorization", "Bearer not-a-token")
                    .when()
                    .get("/api/clients")
                    .then()
                    .statusCode(401);
        }
    }

    @Nested
    @DisplayName("Pairing")
    class PairingTests {

        @Test
        @DisplayName("should pair a device and list it as a client")
        void shouldPairDevice() {
            var session = createSession();
            var sessionId = (String) session.get("id");
            verify(sessionId, (String) session.get("pin"));

            var issued = complete(sessionId, Set.of("kitchen"));
            var subjectId = (String) issued.get("subjectId");

            given().header("Authorization", "Bearer " + adminToken)
                    .when()
                    .get("/api/clients")
                    .then()
                    .statusCode(200)
                    .body("subjectId", hasItem(subjectId));

            given().header("Authorization", "Bearer " + adminToken)
                    .when()
                    .get("/api/clients/" + subjectId)
                    .then()
                    .statusCode(200)
                    .body("clientName", equalTo("Kitchen Tablet"))
                    .body("deviceType", equalTo("tablet"))
                    .body("pairedBy", equalTo("admin:admin"))
                    .body("assignedScopes", containsInAnyOrder("kitchen"))
                    .body("active", equalTo(true));
        }

        @Test
        @DisplayName("should mask a wrong PIN as invalid or expired")
        void shouldMaskWrongPin() {
            var session = createSession();
            var sessionId = (String) session.get("id");

            given().contentType(ContentType.JSON)
                    .body(Map.of("pin", wrongPin((String) session.get("pin")), "sessionId", sessionId))
                    .when()
                    .post("/api/pairing/verify")
                    .then()
                    .statusCode(400)
                    .contentType("application/problem+json")
                    .body("code", equalTo("INVALID_PIN"))
                    .body("detail", equalTo("Invalid or expired PIN"))
                    .body("attemptsRemaining", equalTo(2));
        }

        @Test
        @DisplayName("should mask reuse of a verified PIN")
        void shouldMaskReusedPin() {
            var session = createSession();
            var sessionId = (String) session.get("id");
            var pin = (String) session.get("pin");
            verify(sessionId, pin);

            given().contentType(ContentType.JSON)
                    .body(Map.of("pin", pin, "sessionId", sessionId))
                    .when()
                    .post("/api/pairing/verify")
                    .then()
                    .statusCode(400)
                    .body("code", equalTo("INVALID_PIN"))
                    .body("detail", equalTo("Invalid or expired PIN"));
        }

        @Test
        @DisplayName("should reject completion with an unknown scope")
        void shouldRejectUnknownScope() {
            var session = createSession();
            var sessionId = (String) session.get("id");
            verify(sessionId, (String) session.get("pin"));

            given().header("Authorization", "Bearer " + adminToken)
                    .contentType(ContentType.JSON)
                    .body(Map.of("assignedScopes", Set.of("attic")))
                    .when()
                    .post("/api/pairing/sessions/" + sessionId + "/complete")
                    .then()
                    .statusCode(400)
                    .body("code", equalTo("SCOPE_NOT_FOUND"));

            // the session is still verified and can be completed with a known scope
            complete(sessionId, Set.of("garage"));
        }

        @Test
        @DisplayName("should reject completion of an unverified session")
        void shouldRejectUnverifiedCompletion() {
            var sessionId = (String) createSession().get("id");

            given().header("Authorization", "Bearer " + adminToken)
                    .contentType(ContentType.JSON)
                    .body(Map.of("assignedScopes", Set.of("kitchen")))
                    .when()
                    .post("/api/pairing/sessions/" + sessionId + "/complete")
                    .then()
                    .statusCode(409)
                    .body("code", equalTo("SESSION_NOT_VERIFIED"));
        }

        @Test
        @DisplayName("should cancel a pending session")
        void shouldCancelSession() {
            var sessionId = (String) createSession().get("id");

            given().header("Authorization", "Bearer " + adminToken)
                    .when()
                    .delete("/api/pairing/sessions/" + sessionId)
                    .then()
                    .statusCode(204);

            given().header("Authorization", "Bearer " + adminToken)
                    .when()
                    .get("/api/pairing/sessions/" + sessionId)
                    .then()
                    .statusCode(200)
                    .body("status", equalTo("EXPIRED"))
                    .body("cancelled", equalTo(true));
        }
    }

    @Nested
    @DisplayName("Revocation")
    class RevocationTests {

        @Test
        @DisplayName("should reject a client token after revocation")
        void shouldRejectRevokedClientToken() {
            var session = createSession();
            var sessionId = (String) session.get("id");
            verify(sessionId, (String) session.get("pin"));
            var issued = complete(sessionId, Set.of("living_room"));
            var subjectId = (String) issued.get("subjectId");
            var clientToken = (String) issued.get("token");

            given().header("Authorization", "Bearer " + clientToken)
                    .when()
                    .get("/api/clients")
                    .then()
                    .statusCode(403);

            given().header("Authorization", "Bearer " + adminToken)
                    .contentType(ContentType.JSON)
                    .body(Map.of("subjectId", subjectId, "reason", "lost device"))
                    .when()
                    .post("/api/tokens/revoke")
                    .then()
                    .statusCode(200)
                    .body("revokedCount", equalTo(1));

            given().header("Authorization", "Bearer " + clientToken)
                    .when()
                    .post("/api/auth/logout")
                    .then()
                    .statusCode(401);
        }

        @Test
        @DisplayName("should reissue a credential when scopes change")
        void shouldReissueOnScopeChange() {
            var session = createSession();
            var sessionId = (String) session.get("id");
            verify(sessionId, (String) session.get("pin"));
            var issued = complete(sessionId, Set.of("kitchen"));
            var subjectId = (String) issued.get("subjectId");
            var oldToken = (String) issued.get("token");

            var newToken = given().header("Authorization", "Bearer " + adminToken)
                    .contentType(ContentType.JSON)
                    .body(Map.of("assignedScopes", Set.of("kitchen", "garage")))
                    .when()
                    .put("/api/clients/" + subjectId + "/scopes")
                    .then()
                    .statusCode(200)
                    .body("subjectId", equalTo(subjectId))
                    .body("assignedScopes", containsInAnyOrder("kitchen", "garage"))
                    .extract()
                    .<String>path("token");

            given().header("Authorization", "Bearer " + adminToken)
                    .when()
                    .get("/api/clients/" + subjectId + "/credentials")
                    .then()
                    .statusCode(200)
                    .body("$", hasSize(2));

            given().header("Authorization", "Bearer " + oldToken)
                    .when()
                    .post("/api/auth/logout")
                    .then()
                    .statusCode(401);

            given().header("Authorization", "Bearer " + newToken)
                    .when()
                    .post("/api/auth/logout")
                    .then()
                    .statusCode(204);
        }

        @Test
        @DisplayName("should delete a client and invalidate its token")
        void shouldDeleteClient() {
            var session = createSession();
            var sessionId = (String) session.get("id");
            verify(sessionId, (String) session.get("pin"));
            var issued = complete(sessionId, Set.of("kitchen"));
            var subjectId = (String) issued.get("subjectId");
            var clientToken = (String) issued.get("token");

            given().header("Authorization", "Bearer " + adminToken)
                    .when()
                    .delete("/api/clients/" + subjectId)
                    .then()
                    .statusCode(204);

            given().header("Authorization", "Bearer " + adminToken)
                    .when()
                    .get("/api/clients/" + subjectId)
                    .then()
                    .statusCode(404);

            given().header("Authorization", "Bearer " + clientToken)
                    .when()
                    .post("/api/auth/logout")
                    .then()
                    .statusCode(401);

            given().header("Authorization", "Bearer " + adminToken)
                    .when()
                    .delete("/api/clients/" + subjectId)
                    .then()
                    .statusCode(404);
        }

        @Test
        @DisplayName("should report zero revocations for an unknown subject")
        void shouldReportZeroForUnknownSubject() {
            given().header("Authorization", "Bearer " + adminToken)
                    .contentType(ContentType.JSON)
                    .body(Map.of("subjectId", "no-such-client"))
                    .when()
                    .post("/api/tokens/revoke")
                    .then()
                    .statusCode(200)
                    .body("revokedCount", equalTo(0));
        }
    }

    @Nested
    @DisplayName("Scopes and Events")
    class ScopeAndEventTests {

        @Test
        @DisplayName("should list configured scopes")
        void shouldListScopes() {
            given().header("Authorization", "Bearer " + adminToken)
                    .when()
                    .get("/api/scopes")
                    .then()
                    .statusCode(200)
                    .body("$", hasItem("kitchen"))
                    .body("$", hasItem("garage"));
        }

        @Test
        @DisplayName("should reject an event with both scope and subject")
        void shouldRejectAmbiguousEventTarget() {
            given().header("Authorization", "Bearer " + adminToken)
                    .contentType(ContentType.JSON)
                    .body(Map.of("type", "light.changed", "scope", "kitchen", "subjectId", "someone"))
                    .when()
                    .post("/api/events")
                    .then()
                    .statusCode(400);
        }

        @Test
        @DisplayName("should publish a scoped event with no listeners")
        void shouldPublishWithNoListeners() {
            given().header("Authorization", "Bearer " + adminToken)
                    .contentType(ContentType.JSON)
                    .body(Map.of("type", "light.changed", "scope", "garage", "payload", Map.of("on", true)))
                    .when()
                    .post("/api/events")
                    .then()
                    .statusCode(200);
        }
    }
}
