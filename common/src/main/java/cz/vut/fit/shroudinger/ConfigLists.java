package cz.vut.fit.shroudinger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.shroudinger.errors.ConfigurationException;
import cz.vut.fit.shroudinger.models.ServerConfig;
import cz.vut.fit.shroudinger.models.SourceConfig;
import org.jetbrains.annotations.NotNull;

import java.util.HashSet;
import java.util.List;
import java.util.Properties;

/**
 * Reads the typed source and server lists from their JSON representation in the configuration properties.
 */
public final class ConfigLists {
    private static final TypeReference<List<SourceConfig>> SOURCE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<ServerConfig>> SERVER_LIST = new TypeReference<>() {
    };

    private ConfigLists() {
    }

    public static @NotNull List<SourceConfig> readSources(@NotNull ObjectMapper mapper, @NotNull Properties properties) {
        var json = properties.getProperty(ResolverConfig.SOURCES_JSON_CONFIG, ResolverConfig.SOURCES_JSON_DEFAULT);
        List<SourceConfig> sources = read(mapper, json, SOURCE_LIST, "source");
        requireUniqueSourceNames(sources);
        return sources;
    }

    public static @NotNull List<ServerConfig> readServers(@NotNull ObjectMapper mapper, @NotNull Properties properties) {
        var json = properties.getProperty(ResolverConfig.SERVERS_JSON_CONFIG, ResolverConfig.SERVERS_JSON_DEFAULT);
        List<ServerConfig> servers = read(mapper, json, SERVER_LIST, "server");
        requireUniqueServerNames(servers);
        return servers;
    }

    public static void requireUniqueSourceNames(@NotNull List<SourceConfig> sources) {
        var names = new HashSet<String>();
        for (var source : sources) {
            if (!names.add(source.name()))
                throw new ConfigurationException("Duplicate source name: " + source.name());
        }
    }

    public static void requireUniqueServerNames(@NotNull List<ServerConfig> servers) {
        var names = new HashSet<String>();
        for (var server : servers) {
            if (!names.add(server.name()))
                throw new ConfigurationException("Duplicate server name: " + server.name());
        }
    }

    private static <T> List<T> read(ObjectMapper mapper, String json, TypeReference<List<T>> type, String what) {
        try {
            var list = mapper.readValue(json, type);
            if (list == null)
                throw new ConfigurationException("The " + what + " list is null");
            if (list.contains(null))
                throw new ConfigurationException("The " + what + " list contains a null entry");
            return List.copyOf(list);
        } catch (JsonProcessingException e) {
            // Jackson wraps exceptions thrown by the record constructors
            if (e.getCause() instanceof ConfigurationException configurationException)
                throw configurationException;
            throw new ConfigurationException("Malformed " + what + " list", e);
        }
    }
}
