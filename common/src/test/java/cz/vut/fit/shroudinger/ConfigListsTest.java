package cz.vut.fit.shroudinger;

import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.shroudinger.errors.ConfigurationException;
import cz.vut.fit.shroudinger.models.Category;
import cz.vut.fit.shroudinger.models.Protocol;
import cz.vut.fit.shroudinger.models.SourceFormat;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigListsTest {
    private final ObjectMapper _mapper = Common.makeMapper().build();

    @Test
    void readsSourcesWithDefaults() {
        var properties = new PropertiesBuilder()
                .add(ResolverConfig.SOURCES_JSON_CONFIG, """
                        [
                          {"name": "StevenBlack", "origin": "https://example.org/hosts", "format": "hosts",
                           "category": "ads", "priority": 1},
                          {"name": "AdGuard", "origin": "/tmp/adservers.txt", "format": "adblock",
                           "priority": 3, "enabled": false},
                          {"name": "Local", "origin": "file:///etc/blocked", "format": "domains"}
                        ]""")
                .get();

        var sources = ConfigLists.readSources(_mapper, properties);

        assertEquals(3, sources.size());
        assertEquals(SourceFormat.HOSTS, sources.get(0).format());
        assertEquals(Category.ADS, sources.get(0).category());
        assertTrue(sources.get(0).enabled());
        assertEquals(SourceFormat.FILTER_LIST, sources.get(1).format());
        assertFalse(sources.get(1).enabled());
        assertEquals(SourceFormat.PLAIN_DOMAINS, sources.get(2).format());
        assertEquals(Category.CUSTOM, sources.get(2).category());
    }

    @Test
    void readsServersWithProtocolDefaults() {
        var properties = new PropertiesBuilder()
                .add(ResolverConfig.SERVERS_JSON_CONFIG, """
                        [
                          {"name": "Cloudflare", "address": "1.1.1.1", "protocol": "DoT", "priority": 3,
                           "hostname": "cloudflare-dns.com"},
                          {"name": "Quad9", "address": "9.9.9.9", "protocol": "doh", "priority": 2}
                        ]""")
                .get();

        var servers = ConfigLists.readServers(_mapper, properties);

        assertEquals(2, servers.size());
        assertEquals(Protocol.DOT, servers.get(0).protocol());
        assertEquals(853, servers.get(0).port());
        assertEquals("cloudflare-dns.com", servers.get(0).hostname());
        assertEquals(Protocol.DOH, servers.get(1).protocol());
        assertEquals(443, servers.get(1).port());
        assertEquals("9.9.9.9", servers.get(1).hostname());
        assertEquals("/dns-query", servers.get(1).path());
    }

    @Test
    void rejectsMalformedLists() {
        var malformed = new PropertiesBuilder()
                .add(ResolverConfig.SOURCES_JSON_CONFIG, "{not json")
                .get();
        assertThrows(ConfigurationException.class, () -> ConfigLists.readSources(_mapper, malformed));

        var unknownFormat = new PropertiesBuilder()
                .add(ResolverConfig.SOURCES_JSON_CONFIG,
                        "[{\"name\": \"x\", \"origin\": \"/tmp/x\", \"format\": \"csv\"}]")
                .get();
        assertThrows(ConfigurationException.class, () -> ConfigLists.readSources(_mapper, unknownFormat));

        var missingOrigin = new PropertiesBuilder()
                .add(ResolverConfig.SOURCES_JSON_CONFIG, "[{\"name\": \"x\", \"format\": \"hosts\"}]")
                .get();
        assertThrows(ConfigurationException.class, () -> ConfigLists.readSources(_mapper, missingOrigin));
    }

    @Test
    void rejectsDuplicateNames() {
        var properties = new PropertiesBuilder()
                .add(ResolverConfig.SERVERS_JSON_CONFIG, """
                        [
                          {"name": "A", "address": "1.1.1.1", "protocol": "DoT"},
                          {"name": "A", "address": "9.9.9.9", "protocol": "DoT"}
                        ]""")
                .get();

        assertThrows(ConfigurationException.class, () -> ConfigLists.readServers(_mapper, properties));
    }
}
