package com.phasegate.core.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phasegate.core.model.Phase;
import com.phasegate.core.model.TransitionKind;
import com.phasegate.core.util.Hashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Append-only, hash-chained record of committed transitions.
 * <p>
 * Each entry carries the hash of the one before it, so editing or deleting a line breaks the
 * chain at that point and {@link #verify()} reports where. Append failures are logged and
 * never propagate into the transition that caused them. A line left half-written by a crash is
 * reported by {@link #verify()} but does not stop later appends, which chain from the last
 * complete entry.
 */
public class PhaseLedger {

    public static final String GENESIS = "genesis";

    private static final Logger log = LoggerFactory.getLogger(PhaseLedger.class);

    private final Path path;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Object lock = new Object();
    private String lastHash;

    public PhaseLedger(Path path, ObjectMapper mapper, Clock clock) {
        this.path = path;
        this.mapper = mapper;
        this.clock = clock;
    }

    public Path path() {
        return path;
    }

    /**
     * Appends one transition.
     *
     * @return the written entry, empty when the append failed
     */
    public Optional<LedgerEntry> append(String taskId, Phase from, Phase to, TransitionKind kind,
                                        List<String> evidenceArtifacts, boolean evidenceValidated) {
        synchronized (lock) {
            try {
                String previous = lastHash();
                var unsigned = new LedgerEntry(UUID.randomUUID().toString(), clock.instant(), previous, null,
                        taskId, from, to, kind, evidenceArtifacts, evidenceValidated);
                LedgerEntry entry = unsigned.withEntryHash(computeHash(unsigned));

                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                String line = mapper.writeValueAsString(entry) + "\n";
                if (!endsWithNewline()) {
                    line = "\n" + line;
                }
                Files.writeString(path, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                lastHash = entry.entryHash();
                log.debug("Ledger: task {} {} -> {} ({})", taskId, from != null ? from : "START", to,
                        Hashes.shortHash(entry.entryHash()));
                return Optional.of(entry);
            } catch (IOException e) {
                log.error("Failed to append ledger entry for task {} {} -> {}: {}", taskId, from, to, e.getMessage());
                // re-read the tail next time, the write may have partially landed
                lastHash = null;
                return Optional.empty();
            }
        }
    }

    /**
     * Every readable entry in file order. Unparseable lines are skipped; {@link #verify()} reports them.
     */
    public List<LedgerEntry> entries() throws IOException {
        var entries = new ArrayList<LedgerEntry>();
        for (String line : lines()) {
            parse(line).ifPresentOrElse(entries::add,
                    () -> log.warn("Skipping unparseable ledger line in {}", path));
        }
        return entries;
    }

    public List<LedgerEntry> entries(String taskId) throws IOException {
        return entries().stream()
                .filter(e -> taskId.equals(e.taskId()))
                .toList();
    }

    /**
     * Walks the chain from genesis. Stops at the first entry whose link or hash is wrong.
     */
    public LedgerVerification verify() throws IOException {
        String expectedPrevious = GENESIS;
        int checked = 0;
        List<String> lines = lines();
        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            LedgerEntry entry;
            try {
                entry = mapper.readValue(lines.get(i), LedgerEntry.class);
            } catch (JsonProcessingException e) {
                return LedgerVerification.broken(checked, lineNumber, "unparseable entry");
            }
            checked++;
            if (!expectedPrevious.equals(entry.previousHash())) {
                return LedgerVerification.broken(checked, lineNumber, "previous hash does not match the entry before it");
            }
            String recomputed = computeHash(entry);
            if (!recomputed.equals(entry.entryHash())) {
                return LedgerVerification.broken(checked, lineNumber, "entry hash does not match its content");
            }
            expectedPrevious = entry.entryHash();
        }
        return LedgerVerification.ok(checked);
    }

    String computeHash(LedgerEntry entry) throws JsonProcessingException {
        // keys sorted, entryHash excluded
        var canonical = new TreeMap<String, Object>();
        canonical.put("entryId", entry.entryId());
        canonical.put("timestamp", entry.timestamp().toString());
        canonical.put("previousHash", entry.previousHash());
        canonical.put("taskId", entry.taskId());
        canonical.put("fromPhase", entry.fromPhase() != null ? entry.fromPhase().name() : null);
        canonical.put("toPhase", entry.toPhase().name());
        canonical.put("kind", entry.kind().name());
        canonical.put("evidenceArtifacts", entry.evidenceArtifacts());
        canonical.put("evidenceValidated", entry.evidenceValidated());
        return Hashes.sha256(mapper.writeValueAsString(canonical));
    }

    private String lastHash() throws IOException {
        if (lastHash == null) {
            List<String> lines = lines();
            lastHash = GENESIS;
            for (int i = lines.size() - 1; i >= 0; i--) {
                Optional<LedgerEntry> entry = parse(lines.get(i));
                if (entry.isPresent()) {
                    lastHash = entry.get().entryHash();
                    log.info("Resuming ledger {} after {} lines", path, i + 1);
                    break;
                }
                log.warn("Ledger {} line {} is unparseable, chaining from the entry before it", path, i + 1);
            }
        }
        return lastHash;
    }

    private Optional<LedgerEntry> parse(String line) {
        try {
            return Optional.of(mapper.readValue(line, LedgerEntry.class));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private boolean endsWithNewline() throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0) {
            return true;
        }
        try (SeekableByteChannel channel = Files.newByteChannel(path, StandardOpenOption.READ)) {
            channel.position(channel.size() - 1);
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.read(last);
            return last.get(0) == '\n';
        }
    }

    private List<String> lines() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        return Files.readAllLines(path, StandardCharsets.UTF_8).stream()
                .filter(l -> !l.isBlank())
                .toList();
    }
}
