package cz.vut.fit.shroudinger;

import cz.vut.fit.shroudinger.errors.ConfigurationException;
import cz.vut.fit.shroudinger.errors.ErrorKind;
import cz.vut.fit.shroudinger.errors.ValidationException;
import cz.vut.fit.shroudinger.loader.SourceFetcher;
import cz.vut.fit.shroudinger.models.*;
import cz.vut.fit.shroudinger.pool.UpstreamConnection;
import cz.vut.fit.shroudinger.pool.UpstreamConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Message;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Section;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

public class ShroudingerCoreTest {
    private static final Duration DEADLINE = Duration.ofSeconds(2);

    private final ServerConfig server = ServerConfig.of("primary", "192.0.2.1", Protocol.DOT, 10);

    private Properties properties;
    private SourceFetcher fetcher;
    private UpstreamConnector connector;
    private UpstreamConnection connection;
    private ManualTicker ticker;
    private ShroudingerCore core;

    @BeforeEach
    void setUp() throws Exception {
        properties = new PropertiesBuilder()
                .add(ResolverConfig.RELOAD_INTERVAL_S_CONFIG, 0)
                .add(ResolverConfig.CACHE_SWEEP_INTERVAL_MS_CONFIG, 0)
                .add(ResolverConfig.BATCH_CHECK_LIMIT_CONFIG, 3)
                .get();

        fetcher = mock(SourceFetcher.class);
        when(fetcher.fetch(argThat(s -> s != null && s.name().equals("ads"))))
                .thenReturn("0.0.0.0 ads.example.com\n0.0.0.0 pixel.example.net\n");
        when(fetcher.fetch(argThat(s -> s != null && s.name().equals("trackers"))))
                .thenReturn("||tracker.example^\n@@||ok.tracker.example^\n");

        connection = mock(UpstreamConnection.class);
        when(connection.isOpen()).thenReturn(true);
        when(connection.exchange(any(), any())).thenAnswer(invocation -> answer(invocation.getArgument(0)));
        connector = mock(UpstreamConnector.class);
        when(connector.open(any(), any())).thenReturn(connection);

        ticker = new ManualTicker();
        core = new ShroudingerCore(properties, List.of(server), fetcher, Map.of(Protocol.DOT, connector),
                Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC), ticker);
    }

    @AfterEach
    void tearDown() {
        core.close();
    }

    private static byte[] answer(byte[] query) throws Exception {
        var request = new Message(query);
        var response = new Message(request.getHeader().getID());
        response.getHeader().setFlag(Flags.QR);
        response.getHeader().setRcode(Rcode.NOERROR);
        response.addRecord(request.getQuestion(), Section.QUESTION);
        return response.toWire();
    }

    private List<SourceConfig> sources() {
        return List.of(
                new SourceConfig("ads", "https://lists.example/ads.txt", SourceFormat.HOSTS, Category.ADS, 10,
                        true),
                new SourceConfig("trackers", "https://lists.example/trackers.txt", SourceFormat.FILTER_LIST,
                        Category.TRACKING, 5, true));
    }

    @Test
    void testRejectsMissingServers() {
        assertThrows(ConfigurationException.class, () -> new ShroudingerCore(properties, List.of(), fetcher,
                Map.of(Protocol.DOT, connector), Clock.systemUTC(), ticker));
    }

    @Test
    void testRejectsDoQ() {
        var quic = ServerConfig.of("quic", "192.0.2.5", Protocol.DOQ, 1);
        assertThrows(ConfigurationException.class, () -> new ShroudingerCore(properties, List.of(server, quic),
                fetcher, Map.of(Protocol.DOT, connector), Clock.systemUTC(), ticker));
    }

    @Test
    void testRejectsDuplicateServerNames() {
        var twin = ServerConfig.of("primary", "192.0.2.9", Protocol.DOT, 1);
        assertThrows(ConfigurationException.class, () -> new ShroudingerCore(properties, List.of(server, twin),
                fetcher, Map.of(Protocol.DOT, connector), Clock.systemUTC(), ticker));
    }

    @Test
    void testNotReadyBeforeFirstReload() throws ValidationException {
        assertFalse(core.check("ads.example.com", "A").ready());
        assertFalse(core.status().ready());
        assertEquals(1, core.status().totalServers());
    }

    @Test
    void testCheckAfterReload() throws ValidationException {
        var results = core.reload(sources());
        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(r -> r.error() == null));

        var ads = core.check("ADS.example.com.", "A");
        assertTrue(ads.ready());
        assertTrue(ads.blocked());
        assertEquals(Category.ADS, ads.category());

        assertFalse(core.check("www.ads.example.com", "A").blocked());
        assertEquals(Category.TRACKING, core.check("cdn.tracker.example", "AAAA").category());
        assertFalse(core.check("ok.tracker.example", "A").blocked());
        assertFalse(core.check("example.org", "A").blocked());

        var status = core.status();
        assertTrue(status.ready());
        assertEquals(4, status.totalEntries());
        assertEquals(2, status.activeSources());
    }

    @Test
    void testCheckRejectsMalformedInput() {
        assertThrows(ValidationException.class, () -> core.check("bad..name", "A"));
        assertThrows(ValidationException.class, () -> core.check("example.com", "NOPE"));
        assertEquals(0, core.stats().lookupCount());
    }

    @Test
    void testCheckBatch() throws ValidationException {
        core.reload(sources());

        var items = core.checkBatch(List.of("ads.example.com", "bad!name", "example.org"), "A");

        assertEquals(3, items.size());
        assertTrue(items.get(0).result().blocked());
        assertEquals(ErrorKind.VALIDATION, items.get(1).error());
        assertNull(items.get(1).result());
        assertFalse(items.get(2).result().blocked());
        assertEquals(2, items.get(2).index());
    }

    @Test
    void testCheckBatchLimit() {
        var names = new ArrayList<>(Collections.nCopies(4, "example.org"));
        assertThrows(ValidationException.class, () -> core.checkBatch(names, "A"));
    }

    @Test
    void testResolveAndClearCache() throws Exception {
        core.reload(sources());

        assertTrue(core.resolve("pixel.example.net", "A", DEADLINE).blocked());
        verify(connector, never()).open(any(), any());

        var first = core.resolve("www.example.org", "A", DEADLINE);
        assertTrue(first.isSuccess());
        assertFalse(first.cached());
        assertTrue(core.resolve("www.example.org", "A", DEADLINE).cached());
        assertEquals(1, core.cacheStatistics().size());

        core.clearCache();
        assertEquals(0, core.status().cachedEntries());
        assertFalse(core.resolve("www.example.org", "A", DEADLINE).cached());
    }

    @Test
    void testServerTestUsesDedicatedConnection() throws Exception {
        var result = core.testServer(server, "example.com", DEADLINE);

        assertTrue(result.success());
        assertEquals(Protocol.DOT, result.protocol());
        verify(connection).close();
        assertEquals(0, core.stats().lookupCount());
        assertEquals(0, core.status().cachedEntries());
    }

    @Test
    void testServerTestOfUnconfiguredProtocol() throws Exception {
        var doh = ServerConfig.of("doh", "192.0.2.2", Protocol.DOH, 1);

        var result = core.testServer(doh, "example.com", DEADLINE);

        assertFalse(result.success());
        assertEquals(ErrorKind.CONFIGURATION, result.error());
    }

    @Test
    void testConnectivityCheckSeedsLatency() throws Exception {
        when(connection.exchange(any(), any())).thenAnswer(invocation -> {
            ticker.advance(Duration.ofMillis(8));
            return answer(invocation.getArgument(0));
        });

        var results = core.testServerConnections();

        assertEquals(1, results.size());
        assertTrue(results.get(0).success());
        var health = core.stats().serverHealth().get(0);
        assertEquals(8_000, health.latencyMicros());
        assertEquals(CircuitState.CLOSED, health.state());
    }

    @Test
    void testFailedConnectivityCheckCountsAsFailure() throws Exception {
        doThrow(new IOException("Connection refused")).when(connector).open(any(), any());

        var results = core.testServerConnections();

        assertFalse(results.get(0).success());
        assertEquals(1, core.stats().serverHealth().get(0).consecutiveFailures());
    }

    @Test
    void testRejectsMalformedCheckName() {
        var bad = new PropertiesBuilder().add(ResolverConfig.SERVER_CHECK_DOMAIN_CONFIG, "bad..name").get();
        assertThrows(ConfigurationException.class, () -> new ShroudingerCore(bad, List.of(server), fetcher,
                Map.of(Protocol.DOT, connector), Clock.systemUTC(), ticker));
    }

    @Test
    void testStatsContainNoNames() throws Exception {
        core.reload(sources());
        core.check("ads.example.com", "A");
        core.resolve("www.example.org", "A", DEADLINE);

        var stats = core.stats();
        assertEquals(2, stats.lookupCount());
        assertEquals(1, stats.blockedCount());
        assertEquals(Map.of("ads", 2, "trackers", 2), stats.perSourceCounts());
        assertEquals(1, stats.serverHealth().size());

        var json = Common.makeMapper().build().writeValueAsString(stats);
        assertFalse(json.contains("example"));
    }
}
