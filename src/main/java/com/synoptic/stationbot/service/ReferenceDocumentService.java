package com.synoptic.stationbot.service;

import com.synoptic.stationbot.model.ReferenceDocument;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Static guide attached to every export. Read once when the bean is created.
 */
@Singleton
public class ReferenceDocumentService {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDocumentService.class);

    private final ReferenceDocument document;

    @Inject
    public ReferenceDocumentService(@Value("${station-bot.reference-document.path:}") String path) {
        this.document = load(path);
    }

    /**
     * @return the document, or empty when none is configured or it could not be read
     */
    public Optional<ReferenceDocument> document() {
        return Optional.ofNullable(document);
    }

    private static ReferenceDocument load(String path) {
        if (path == null || path.isBlank()) {
            log.warn("No reference document configured; exports are sent without it");
            return null;
        }
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            log.warn("Reference document {} not found; exports are sent without it", file.toAbsolutePath());
            return null;
        }
        try {
            byte[] content = Files.readAllBytes(file);
            log.info("Loaded reference document {} ({} bytes)", file.getFileName(), content.length);
            return new ReferenceDocument(file.getFileName().toString(), content);
        } catch (IOException e) {
            log.warn("Reference document {} could not be read; exports are sent without it", file, e);
            return null;
        }
    }
}
