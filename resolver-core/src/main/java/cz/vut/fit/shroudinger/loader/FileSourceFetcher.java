package cz.vut.fit.shroudinger.loader;

import cz.vut.fit.shroudinger.errors.SourceFetchException;
import cz.vut.fit.shroudinger.models.SourceConfig;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads sources from the local file system. The origin is either a {@code file:} URI or a plain path.
 * A malformed origin, including an {@link java.nio.file.InvalidPathException}, is reported as a fetch error.
 */
public class FileSourceFetcher implements SourceFetcher {

    @Override
    public @NotNull String fetch(@NotNull SourceConfig source) throws SourceFetchException {
        try {
            var origin = source.origin();
            var path = origin.startsWith("file:") ? Path.of(URI.create(origin)) : Path.of(origin);
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new SourceFetchException("Invalid source path", e);
        } catch (IOException e) {
            throw new SourceFetchException("Cannot read source file: " + e.getClass().getSimpleName(), e);
        }
    }
}
