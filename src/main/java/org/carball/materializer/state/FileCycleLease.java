package org.carball.materializer.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Lease backed by a file created with create-new semantics. The file holds the owner and expiry.
 */
@Slf4j
public class FileCycleLease implements CycleLease {

    static final String FILE_NAME = "cycle.lease";

    private final Path file;
    private final String owner;
    private final Duration ttl;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private volatile boolean held;

    public FileCycleLease(Path stateDirectory, Duration ttl) {
        this(stateDirectory, defaultOwner(), ttl, Clock.systemUTC());
    }

    public FileCycleLease(Path stateDirectory, String owner, Duration ttl, Clock clock) {
        this.file = stateDirectory.resolve(FILE_NAME);
        this.owner = owner;
        this.ttl = ttl;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void acquire() throws LockContentionException, IOException {
        Files.createDirectories(file.getParent());

        for (int attempt = 0; attempt < 2; attempt++) {
            try {
                Files.createFile(file);
                try {
                    write(file);
                } catch (IOException e) {
                    Files.deleteIfExists(file);
                    throw e;
                }
                held = true;
                log.info("Acquired cycle lease {} as {} until {}", file, owner, clock.instant().plus(ttl));
                return;
            } catch (FileAlreadyExistsException e) {
                Optional<LeaseRecord> existing = read();
                if (existing.isPresent() && !existing.get().expiresAt().isAfter(clock.instant())) {
                    log.warn("Taking over expired lease held by {} (expired {})",
                            existing.get().owner(), existing.get().expiresAt());
                    Files.deleteIfExists(file);
                    continue;
                }
                String holder = existing.map(LeaseRecord::owner).orElse("unknown");
                String until = existing.map(r -> r.expiresAt().toString()).orElse("unknown");
                throw new LockContentionException("Cycle lease is held by " + holder + " until " + until);
            }
        }
        throw new LockContentionException("Cycle lease was taken by another process while acquiring");
    }

    @Override
    public synchronized void renew() throws IOException {
        if (!held) {
            throw new IllegalStateException("Cannot renew a lease that is not held");
        }
        Optional<LeaseRecord> existing = read();
        if (existing.isEmpty() || !owner.equals(existing.get().owner())) {
            held = false;
            throw new IOException("Cycle lease was lost to " + existing.map(LeaseRecord::owner).orElse("nobody"));
        }
        Path temp = file.resolveSibling(FILE_NAME + "." + owner + ".tmp");
        write(temp);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Renewed cycle lease until {}", clock.instant().plus(ttl));
    }

    @Override
    public synchronized void release() {
        if (!held) {
            return;
        }
        held = false;
        try {
            Optional<LeaseRecord> existing = read();
            if (existing.isPresent() && owner.equals(existing.get().owner())) {
                Files.deleteIfExists(file);
                log.info("Released cycle lease {}", file);
            } else {
                log.warn("Cycle lease {} is no longer ours, leaving it in place", file);
            }
        } catch (IOException e) {
            log.error("Failed to release cycle lease {}; it expires on its own after {}", file, ttl, e);
        }
    }

    @Override
    public String getOwner() {
        return owner;
    }

    private void write(Path target) throws IOException {
        Instant now = clock.instant();
        objectMapper.writeValue(target.toFile(), new LeaseRecord(owner, now, now.plus(ttl)));
    }

    /**
     * Empty when the file is missing. A file still being written, or left half-written by a crash,
     * counts as held by an unknown owner until its modification time plus the TTL.
     */
    private Optional<LeaseRecord> read() throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            if (Files.size(file) > 0) {
                return Optional.of(objectMapper.readValue(file.toFile(), LeaseRecord.class));
            }
        } catch (IOException e) {
            log.debug("Unreadable lease file {}: {}", file, e.getMessage());
        }
        Instant modified = Files.getLastModifiedTime(file).toInstant();
        return Optional.of(new LeaseRecord("unknown", modified, modified.plus(ttl)));
    }

    private static String defaultOwner() {
        return ManagementFactory.getRuntimeMXBean().getName() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    record LeaseRecord(String owner, Instant acquiredAt, Instant expiresAt) {}
}
