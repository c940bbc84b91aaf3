package com.delta.autoapply.apply.audit;

import com.delta.autoapply.apply.model.ApplicationSession;
import com.delta.autoapply.config.AutoApplyProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * One pretty-printed JSON document per session. Files are created exclusively, so an existing
 * record is never overwritten.
 */
@Component
public class JsonFileAuditLogger implements AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(JsonFileAuditLogger.class);
    private static final DateTimeFormatter FILE_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final Path directory;

    @Autowired
    public JsonFileAuditLogger(ObjectMapper objectMapper, AutoApplyProperties properties) {
        this(objectMapper, Path.of(properties.getAudit().getDirectory()));
    }

    JsonFileAuditLogger(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper;
        this.directory = directory;
    }

    @Override
    public void record(ApplicationSession session) {
        Path target = directory.resolve(fileName(session));
        try {
            Files.createDirectories(directory);
            try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, AuditRecord.from(session));
            }
            log.info("Audit record for session {} ({}) written to {}", session.getId(), session.getStatus(), target);
        } catch (IOException e) {
            log.warn("Failed to write audit record for session {}: {}", session.getId(), e.getMessage());
        }
    }

    static String fileName(ApplicationSession session) {
        String platform = session.getPlatform() == null ? "unknown" : session.getPlatform().name().toLowerCase(Locale.ROOT);
        return FILE_TIMESTAMP.format(session.getStartedAt()) + "_" + platform + "_" + session.getId() + ".json";
    }
}
