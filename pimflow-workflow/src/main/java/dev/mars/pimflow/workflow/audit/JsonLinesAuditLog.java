/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.pimflow.workflow.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pimflow.core.exceptions.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only audit log stored as one JSON document per line.
 * <p>
 * Each {@link #append(List)} writes all of its lines with a single channel write and forces
 * them to disk before returning. When the file is opened, a torn trailing line left by a crash
 * is dropped and the file truncated back to the last complete entry. A corrupt line anywhere
 * else fails the open.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class JsonLinesAuditLog implements AuditLog, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(JsonLinesAuditLog.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final FileChannel channel;
    private final Map<String, CopyOnWriteArrayList<AuditEntry>> entriesByRun = new ConcurrentHashMap<>();

    public JsonLinesAuditLog(Path file, ObjectMapper objectMapper) throws StorageUnavailableException {
        this.file = Objects.requireNonNull(file, "file");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.channel = FileChannel.open(file, StandardOpenOption.CREATE,
                    StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot open audit log " + file, e);
        }
        try {
            load();
            channel.position(channel.size());
        } catch (IOException | StorageUnavailableException e) {
            closeAfterFailedOpen();
            if (e instanceof StorageUnavailableException) {
                throw (StorageUnavailableException) e;
            }
            throw new StorageUnavailableException("Cannot read audit log " + file, e);
        }
    }

    private void closeAfterFailedOpen() {
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Cannot close audit log {} after failed open: {}", file, e.getMessage());
        }
    }

    private void load() throws IOException, StorageUnavailableException {
        byte[] content = Files.readAllBytes(file);
        int lineStart = 0;
        int count = 0;
        while (lineStart < content.length) {
            int lineEnd = indexOf(content, (byte) '\n', lineStart);
            boolean lastLine = lineEnd < 0;
            int end = lastLine ? content.length : lineEnd;
            String line = new String(content, lineStart, end - lineStart, StandardCharsets.UTF_8).trim();

            if (!line.isEmpty()) {
                try {
                    if (lastLine) {
                        // an entry is only complete once its newline is on disk
                        throw new IOException("missing line terminator");
                    }
                    index(objectMapper.readValue(line, AuditEntry.class));
                    count++;
                } catch (IOException e) {
                    if (!lastLine) {
                        throw new StorageUnavailableException("Corrupt audit entry in " + file
                                + " at byte " + lineStart, e);
                    }
                    logger.warn("Dropping torn trailing audit entry in {} at byte {}: {}",
                            file, lineStart, e.getMessage());
                    channel.truncate(lineStart);
                    channel.force(true);
                    break;
                }
            }
            lineStart = end + 1;
        }
        logger.debug("Loaded {} audit entries from {}", count, file);
    }

    private static int indexOf(byte[] content, byte value, int from) {
        for (int i = from; i < content.length; i++) {
            if (content[i] == value) {
                return i;
            }
        }
        return -1;
    }

    private void index(AuditEntry entry) {
        entriesByRun.computeIfAbsent(entry.getRunId(), id -> new CopyOnWriteArrayList<>()).add(entry);
    }

    @Override
    public synchronized void append(List<AuditEntry> entries) throws StorageUnavailableException {
        Objects.requireNonNull(entries, "entries");
        if (entries.isEmpty()) {
            return;
        }

        StringBuilder lines = new StringBuilder();
        try {
            for (AuditEntry entry : entries) {
                lines.append(objectMapper.writeValueAsString(entry)).append('\n');
            }
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Cannot serialize audit entries", e);
        }

        long position = -1;
        try {
            position = channel.position();
            ByteBuffer buffer = ByteBuffer.wrap(lines.toString().getBytes(StandardCharsets.UTF_8));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(false);
        } catch (IOException e) {
            rollbackTo(position);
            throw new StorageUnavailableException("Cannot append to audit log " + file, e);
        }

        for (AuditEntry entry : entries) {
            index(entry);
        }
    }

    private void rollbackTo(long position) {
        if (position < 0) {
            return;
        }
        try {
            channel.truncate(position);
            channel.position(position);
        } catch (IOException e) {
            // the torn tail will be dropped on the next open
            logger.error("Failed to roll back partial audit append in {}", file, e);
        }
    }

    @Override
    public Iterable<AuditEntry> query(String runId) {
        return () -> entriesByRun.getOrDefault(runId, new CopyOnWriteArrayList<>()).iterator();
    }

    @Override
    public long lastSequence(String runId) {
        List<AuditEntry> entries = entriesByRun.get(runId);
        if (entries == null || entries.isEmpty()) {
            return 0;
        }
        return entries.get(entries.size() - 1).getSequence();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void close() throws IOException {
        channel.close();
    }
}
