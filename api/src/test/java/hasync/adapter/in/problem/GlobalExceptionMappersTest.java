package hasync.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GlobalExceptionMappers")
class GlobalExceptionMappersTest {

    private GlobalExceptionMappers mappers;

    @BeforeEach
    void setUp() {
        mappers = new GlobalExceptionMappers();
    }

    @Test
    @DisplayName("should not render the message of an IllegalArgumentException")
    void shouldHideIllegalArgumentMessage() {
        var response = mappers.mapIllegalArgumentException(
                new IllegalArgumentException("bad key at /etc/hasync/secret.properties"));

        assertEquals(400, response.getStatus());
        var problem = (HttpProblem) response.getEntity();
        assertEquals(GlobalExceptionMappers.INVALID_REQUEST_DETAIL, problem.getDetail());
        assertFalse(problem.getDetail().contains("secret"));
    }

    @Test
    @DisplayName("should tag an unexpected state with a correlation id only")
    void shouldHideIllegalStateMessage() {
        var response = mappers.mapIllegalStateException(new IllegalStateException("pool exhausted"));

        assertEquals(500, response.getStatus());
        var problem = (HttpProblem) response.getEntity();
        assertEquals("Unexpected error", problem.getDetail());
    }
}
