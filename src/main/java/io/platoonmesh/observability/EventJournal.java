package io.platoonmesh.observability;

import io.platoonmesh.model.PeerId;
import io.platoonmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only JSON-lines journal of platoon events (membership, role, control mode, connection).
 * The journal is a log sink: nothing reads it back on restart.
 */
public final class EventJournal {
    private static final Logger log = LoggerFactory.getLogger(EventJournal.class);
    private static final EventJournal DISABLED = new EventJournal(null, null);

    private final Path journalFile;
    private final String peer;
    private boolean failureReported;

    private EventJournal(Path journalFile, PeerId peer) {
        this.journalFile = journalFile;
        this.peer = peer == null ? null : peer.value();
    }

    public static EventJournal disabled() {
        return DISABLED;
    }

    public static EventJournal open(Path journalFile, PeerId peer) {
        try {
            Path parent = journalFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize event journal: " + journalFile, e);
        }
        return new EventJournal(journalFile, peer);
    }

    public boolean isEnabled() {
        return journalFile != null;
    }

    public synchronized void record(String action, Map<String, Object> details) {
        if (journalFile == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("peer", peer);
        row.put("action", action);
        row.put("details", details == null ? Map.of() : details);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            failureReported = false;
        } catch (IOException e) {
            if (!failureReported) {
                log.warn("Failed to append to event journal {}: {}", journalFile, e.getMessage());
                failureReported = true;
            }
        }
    }
}
