package io.vaultflow.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vaultflow.model.AuditLogEntry;
import io.vaultflow.model.AuditResult;
import io.vaultflow.security.SensitiveDataMasker;
import io.vaultflow.storage.VaultStoreException;
import io.vaultflow.util.Hashing;
import io.vaultflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Append-only, date-partitioned audit trail ({@code Logs/<yyyy-MM-dd>.jsonl}).
 *
 * <p>Each entry is one compact JSON line carrying {@code prev_hash} and {@code hash}, a SHA-256
 * chain per partition. Appenders serialize on an in-process monitor and an OS file lock, so
 * writers in the same JVM and in other processes never interleave or drop lines. Readers
 * ignore a trailing line without a newline: it is either in flight or torn by a crash.
 */
public final class AuditLedger {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLedger.class);
    private static final DateTimeFormatter PARTITION_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final Pattern PARTITION_FILE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}\\.jsonl$");
    private static final String EXTENSION = ".jsonl";
    private static final int TAIL_WINDOW = 64 * 1024;
    private static final ConcurrentMap<Path, Object> PARTITION_LOCKS = new ConcurrentHashMap<>();

    private final Path logsDir;
    private final String signingSecret;
    private final int maxParameterEntries;
    private final int maxParameterChars;

    public AuditLedger(Path logsDir, String signingSecret, int maxParameterEntries, int maxParameterChars) {
        this.logsDir = logsDir;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.maxParameterEntries = maxParameterEntries;
        this.maxParameterChars = maxParameterChars;
    }

    public static String partitionKey(Instant at) {
        return PARTITION_FORMAT.format(at);
    }

    public Path partitionFile(String partitionKey) {
        if (partitionKey == null || !PARTITION_FILE.matcher(partitionKey + EXTENSION).matches()) {
            throw new IllegalArgumentException("Invalid ledger partition: " + partitionKey);
        }
        return logsDir.resolve(partitionKey + EXTENSION);
    }

    /** Appends to the partition of the entry's own timestamp. */
    public Appended append(AuditLogEntry entry) {
        return append(partitionKey(entry.timestamp()), entry);
    }

    public Appended append(String partitionKey, AuditLogEntry entry) {
        Path file = partitionFile(partitionKey);
        Object monitor = PARTITION_LOCKS.computeIfAbsent(file.toAbsolutePath().normalize(), k -> new Object());
        synchronized (monitor) {
            try {
                Files.createDirectories(logsDir);
                try (FileChannel channel = FileChannel.open(file,
                        StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                     FileLock ignored = channel.lock()) {
                    long size = channel.size();
                    String prevHash = lastHash(channel, size);
                    Map<String, Object> row = toRow(entry, prevHash);
                    String hash = Hashing.sha256Hex(Jsons.toCompactJson(row));
                    row.put("hash", hash);
                    if (!signingSecret.isBlank()) {
                        row.put("signature", Hashing.hmacSha256Hex(signingSecret, hash));
                    }
                    StringBuilder line = new StringBuilder();
                    if (size > 0 && !endsWithNewline(channel, size)) {
                        // terminate a fragment left by a crashed writer so it stays a separate, skipped line
                        line.append('\n');
                    }
                    line.append(Jsons.toCompactJson(row)).append('\n');
                    ByteBuffer buffer = ByteBuffer.wrap(line.toString().getBytes(StandardCharsets.UTF_8));
                    long position = size;
                    while (buffer.hasRemaining()) {
                        position += channel.write(buffer, position);
                    }
                    channel.force(true);
                    return new Appended(partitionKey, hash, prevHash);
                }
            } catch (IOException e) {
                throw new VaultStoreException("Failed to append audit entry to " + file, e);
            }
        }
    }

    /** Complete entries of one partition in append order. */
    public List<AuditLogEntry> read(String partitionKey) {
        List<AuditLogEntry> out = new ArrayList<>();
        for (String line : completeLines(partitionFile(partitionKey))) {
            JsonNode node = parse(line);
            if (node == null) {
                continue;
            }
            try {
                out.add(toEntry(node));
            } catch (RuntimeException e) {
                LOG.debug("Skipping unreadable ledger line in {}: {}", partitionKey, e.getMessage());
            }
        }
        return out;
    }

    public List<String> partitions() {
        if (!Files.isDirectory(logsDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(logsDir)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> PARTITION_FILE.matcher(name).matches())
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new VaultStoreException("Failed to list ledger partitions under " + logsDir, e);
        }
    }

    /** The newest {@code limit} entries across partitions, oldest first. */
    public List<AuditLogEntry> recent(int limit) {
        int safeLimit = Math.max(1, limit);
        List<String> partitions = new ArrayList<>(partitions());
        Collections.reverse(partitions);
        List<AuditLogEntry> newestFirst = new ArrayList<>();
        for (String partition : partitions) {
            List<AuditLogEntry> entries = read(partition);
            for (int i = entries.size() - 1; i >= 0 && newestFirst.size() < safeLimit; i--) {
                newestFirst.add(entries.get(i));
            }
            if (newestFirst.size() >= safeLimit) {
                break;
            }
        }
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    /**
     * Re-computes the hash chain of one partition. Lines that are not JSON (crash fragments) are
     * counted but do not break the chain.
     */
    public VerifyOutcome verify(String partitionKey) {
        List<String> problems = new ArrayList<>();
        int checked = 0;
        int skipped = 0;
        String expectedPrev = "";
        int lineNo = 0;
        for (String line : completeLines(partitionFile(partitionKey))) {
            lineNo++;
            JsonNode node = parse(line);
            if (node == null || !node.isObject()) {
                skipped++;
                continue;
            }
            checked++;
            ObjectNode row = ((ObjectNode) node).deepCopy();
            String hash = row.path("hash").asText("");
            String signature = row.path("signature").asText("");
            row.remove("hash");
            row.remove("signature");
            String prevHash = row.path("prev_hash").asText("");
            if (!expectedPrev.equals(prevHash)) {
                problems.add("line " + lineNo + ": prev_hash_mismatch");
            }
            String recomputed;
            try {
                recomputed = Hashing.sha256Hex(Jsons.compact().writeValueAsString(row));
            } catch (JsonProcessingException e) {
                throw new VaultStoreException("Failed to re-serialize ledger line " + lineNo + " of " + partitionKey, e);
            }
            if (!recomputed.equals(hash)) {
                problems.add("line " + lineNo + ": hash_mismatch");
            }
            if (!signingSecret.isBlank() && !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature)) {
                problems.add("line " + lineNo + ": signature_mismatch");
            }
            expectedPrev = hash;
        }
        return new VerifyOutcome(partitionKey, problems.isEmpty(), checked, skipped, problems);
    }

    private Map<String, Object> toRow(AuditLogEntry entry, String prevHash) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", entry.timestamp().toString());
        row.put("action_type", entry.actionType());
        row.put("actor", entry.actor());
        row.put("target", entry.target());
        row.put("parameters", SensitiveDataMasker.maskedParameters(
                entry.parameters(), maxParameterEntries, maxParameterChars));
        row.put("result", entry.result().code());
        row.put("error_detail", entry.errorDetail());
        row.put("prev_hash", prevHash);
        return row;
    }

    @SuppressWarnings("unchecked")
    private static AuditLogEntry toEntry(JsonNode node) {
        Instant timestamp;
        try {
            timestamp = Instant.parse(node.path("timestamp").asText(""));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("bad timestamp", e);
        }
        JsonNode params = node.path("parameters");
        Map<String, Object> parameters = params.isObject()
                ? Jsons.mapper().convertValue(params, Map.class)
                : Map.of();
        JsonNode error = node.get("error_detail");
        return new AuditLogEntry(
                timestamp,
                node.path("action_type").asText(""),
                node.path("actor").asText(""),
                node.path("target").asText(""),
                parameters,
                AuditResult.fromString(node.path("result").asText("")),
                error == null || error.isNull() ? null : error.asText()
        );
    }

    private static JsonNode parse(String line) {
        try {
            return Jsons.mapper().readTree(line);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static List<String> completeLines(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new VaultStoreException("Failed to read ledger partition " + file, e);
        }
        int end = text.lastIndexOf('\n');
        if (end < 0) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String line : text.substring(0, end).split("\n", -1)) {
            if (!line.isBlank()) {
                out.add(line);
            }
        }
        return out;
    }

    private static boolean endsWithNewline(FileChannel channel, long size) throws IOException {
        ByteBuffer last = ByteBuffer.allocate(1);
        channel.read(last, size - 1);
        return last.get(0) == '\n';
    }

    private static String lastHash(FileChannel channel, long size) throws IOException {
        if (size == 0) {
            return "";
        }
        long window = TAIL_WINDOW;
        while (true) {
            long start = Math.max(0, size - window);
            ByteBuffer buffer = ByteBuffer.allocate((int) (size - start));
            long position = start;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    break;
                }
                position += read;
            }
            String text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
            int end = text.lastIndexOf('\n');
            if (end >= 0) {
                String[] lines = text.substring(0, end).split("\n", -1);
                // the first piece of a partial window may be the tail of a longer line
                int first = start == 0 ? 0 : 1;
                for (int i = lines.length - 1; i >= first; i--) {
                    JsonNode node = parse(lines[i]);
                    if (node != null && node.hasNonNull("hash")) {
                        return node.get("hash").asText("");
                    }
                }
            }
            if (start == 0) {
                return "";
            }
            window = window * 2;
        }
    }

    public record Appended(String partition, String hash, String prevHash) {
    }

    public record VerifyOutcome(
            String partition,
            boolean ok,
            int checkedEntries,
            int skippedLines,
            List<String> problems
    ) {
    }
}
