package com.gillianbc.goalplanner.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.goalplanner.model.Portfolio;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores the portfolio as a JSON document named after the storage key,
 * i.e. {@code <directory>/<key>.json}.
 */
@Slf4j
public class JsonFilePortfolioStore implements PortfolioStore {

    private final ObjectMapper objectMapper;
    private final Path file;

    public JsonFilePortfolioStore(ObjectMapper objectMapper, Path directory, String key) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        Objects.requireNonNull(directory, "directory must not be null");
        Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        this.file = directory.resolve(key + ".json");
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Optional<Portfolio> load() {
        if (!Files.isRegularFile(file)) {
            log.info("No stored portfolio at {}", file.toAbsolutePath());
            return Optional.empty();
        }
        try {
            Portfolio portfolio = objectMapper.readValue(file.toFile(), Portfolio.class);
            if (portfolio == null) {
                log.warn("Stored portfolio at {} is empty, ignoring it", file.toAbsolutePath());
                return Optional.empty();
            }
            log.info("Loaded portfolio with {} goal(s) from {}", portfolio.getGoals().size(), file.toAbsolutePath());
            return Optional.of(portfolio);
        } catch (IOException e) {
            log.warn("Stored portfolio at {} could not be read, ignoring it: {}", file.toAbsolutePath(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(Portfolio portfolio) {
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        Path temp = null;
        try {
            Path directory = file.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            // write to a sibling temp file first so a failed write never truncates the previous record
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), portfolio);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved portfolio with {} goal(s) to {}", portfolio.getGoals().size(), file.toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to save portfolio to {}", file.toAbsolutePath(), e);
            deleteQuietly(temp, e);
            throw new UncheckedIOException("Failed to save portfolio", e);
        }
    }

    private static void deleteQuietly(Path temp, IOException cause) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}", temp, e);
            cause.addSuppressed(e);
        }
    }
}
