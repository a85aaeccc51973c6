package hasync.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import hasync.support.TestConfigs;

@DisplayName("ClientIpResolver")
class ClientIpResolverTest {

    @Test
    @DisplayName("should ignore X-Forwarded-For unless trusted")
    void shouldIgnoreForwardedForByDefault() {
        var resolver = new ClientIpResolver(TestConfigs.httpConfig(false));

        assertEquals("10.0.0.5", resolver.resolve("203.0.113.9", "10.0.0.5"));
    }

    @Test
    @DisplayName("should use the first X-Forwarded-For entry when trusted")
    void shouldUseFirstForwardedEntry() {
        var resolver = new ClientIpResolver(TestConfigs.httpConfig(true));

        assertEquals("203.0.113.9", resolver.resolve(" 203.0.113.9 , 10.0.0.1", "10.0.0.5"));
    }

    @Test
    @DisplayName("should fall back to the remote address for an empty header")
    void shouldFallBackForEmptyHeader() {
        var resolver = new ClientIpResolver(TestConfigs.httpConfig(true));

        assertEquals("10.0.0.5", resolver.resolve(" , ", "10.0.0.5"));
    }

    @Test
    @DisplayName("should report unknown without any address")
    void shouldReportUnknown() {
        var resolver = new ClientIpResolver(TestConfigs.httpConfig(false));

        assertEquals("unknown", resolver.resolve(null, null));
    }
}
