package com.alertmigrator.service.core.silence;

import com.alertmigrator.service.core.config.MigrationProperties;
import com.alertmigrator.unified.model.Silence;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Persists an org's migration silences as JSON under {@code <data-path>/alerting/<orgId>/silences}. */
@Slf4j
@Component
public class SilenceFileWriter {

    static final String FILE_NAME = "silences";

    private final Path dataPath;
    private final ObjectMapper mapper;

    @Autowired
    public SilenceFileWriter(MigrationProperties properties) {
        this(Path.of(properties.getDataPath()));
    }

    public SilenceFileWriter(Path dataPath) {
        this.dataPath = dataPath;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path fileFor(long orgId) {
        return dataPath.resolve("alerting").resolve(Long.toString(orgId)).resolve(FILE_NAME);
    }

    public void write(long orgId, List<Silence> silences) {
        if (silences.isEmpty()) {
            return;
        }
        Path file = fileFor(orgId);
        try {
            Files.createDirectories(file.getParent());
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), silences);
            log.info("Silences written: orgId={} count={} file={}", orgId, silences.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write silence file " + file, e);
        }
    }

    public List<Silence> read(long orgId) {
        Path file = fileFor(orgId);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return List.of(mapper.readValue(file.toFile(), Silence[].class));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read silence file " + file, e);
        }
    }

    /** @return true when a file existed and was removed */
    public boolean delete(long orgId) {
        Path file = fileFor(orgId);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to delete silence file " + file, e);
        }
    }
}
