package com.processsentinel.core.artifact;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Reads and writes {@link ModelArtifact}s as JSON.
 *
 * <p>
 * Scale parameters are written in their shortest round-trip form and the
 * networks as base64 model zips, so a loaded artifact reproduces the saved
 * one exactly.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArtifactStore {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactStore.class);

    private final ObjectMapper mapper;

    public ArtifactStore() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Write the artifact, creating parent directories as needed. The file is
     * written to a sibling temporary file first and then moved into place.
     *
     * @throws IllegalStateException if the file cannot be written
     */
    public void save(ModelArtifact artifact, Path path) {
        Objects.requireNonNull(artifact, "Artifact must not be null");
        Objects.requireNonNull(path, "Path must not be null");
        Path absolute = path.toAbsolutePath();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
            Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                write(artifact, out);
            }
            Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write model artifact: " + absolute, e);
        }
        LOG.info("Saved model artifact to {} ({})", absolute, artifact);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist or is not a
     *                                  valid artifact
     * @throws IllegalStateException    if the file cannot be read
     */
    public ModelArtifact load(Path path) {
        Objects.requireNonNull(path, "Path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            ModelArtifact artifact = read(in);
            LOG.info("Loaded model artifact from {} ({})", path, artifact);
            return artifact;
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Model artifact not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read model artifact: " + path, e);
        }
    }

    public void write(ModelArtifact artifact, OutputStream out) throws IOException {
        mapper.writeValue(out, artifact);
    }

    /**
     * @throws IllegalArgumentException if the content is not a valid artifact
     */
    public ModelArtifact read(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, ModelArtifact.class);
        } catch (JacksonException e) {
            throw new IllegalArgumentException("Malformed model artifact: " + e.getOriginalMessage(), e);
        }
    }
}
