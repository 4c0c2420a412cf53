package alertdedup.dedup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * 基于本地目录的告警缓存，每个指纹一个 JSON 文件
 * <p>
 * 目录结构：
 * <pre>
 *   &lt;dir&gt;/&lt;fingerprint&gt;.json          缓存记录
 *   &lt;dir&gt;/&lt;fingerprint&gt;.json.&lt;uuid&gt;.tmp  写入中的临时文件，写完后 ATOMIC_MOVE 覆盖记录
 *   &lt;dir&gt;/.locks/stripe-NN.lock        分段锁文件
 * </pre>
 * 每次操作先拿 JVM 内的 Guava 分段锁，再拿对应锁文件的 {@link FileLock}。
 * FileLock 在进程之间互斥，但同一个 JVM 对同一文件只能持有一把，所以进程内需要先串行化；
 * 进程内的锁按锁文件路径分段并在所有实例间共享，同一目录上的多个实例也互斥。
 */
@Slf4j
public class FileAlertCacheStore implements AlertCacheStore {
    private static final String RECORD_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final String LOCK_DIR = ".locks";
    private static final Pattern FINGERPRINT = Pattern.compile("[0-9a-f]{64}");
    private static final Striped<Lock> LOCAL_LOCKS = Striped.lock(256);

    private final Path cacheDir;
    private final Path lockDir;
    private final Duration ttl;
    private final int lockStripes;
    private final ObjectMapper objectMapper;

    public FileAlertCacheStore(Path cacheDir, Duration ttl, int lockStripes) {
        this.cacheDir = cacheDir;
        this.lockDir = cacheDir.resolve(LOCK_DIR);
        this.ttl = ttl;
        this.lockStripes = lockStripes;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        try {
            Files.createDirectories(lockDir);
        } catch (IOException e) {
            log.warn("创建缓存目录失败，后续操作将重试: {} ({})", cacheDir, e.toString());
        }
    }

    @Override
    public Optional<CacheRecord> lookupAndTouch(String fingerprint, Instant now) {
        checkFingerprint(fingerprint);
        return withKeyLock(fingerprint, () -> {
            Path file = recordFile(fingerprint);
            StoredRecord stored = readRecord(fingerprint, file);
            if (stored.isAbsent()) {
                return Optional.empty();
            }
            if (stored.isCorrupt()) {
                Files.deleteIfExists(file);
                return Optional.empty();
            }

            CacheRecord record = stored.record;
            if (record.isExpired(now, ttl)) {
                log.debug("缓存记录已过期，删除: {}", AlertFingerprinter.shortId(fingerprint));
                Files.deleteIfExists(file);
                return Optional.empty();
            }

            record.touch(now);
            writeRecord(file, record);
            return Optional.of(record);
        });
    }

    @Override
    public CacheRecord insert(String fingerprint, AlertFields fields, Instant now) {
        checkFingerprint(fingerprint);
        return withKeyLock(fingerprint, () -> {
            Path file = recordFile(fingerprint);
            StoredRecord stored = readRecord(fingerprint, file);
            if (stored.isPresent() && !stored.record.isExpired(now, ttl)) {
                throw new FingerprintConflictException(fingerprint);
            }

            CacheRecord record = CacheRecord.firstOccurrence(fingerprint, fields, now);
            writeRecord(file, record);
            log.debug("Cached alert with hash {}", AlertFingerprinter.shortId(fingerprint));
            return record;
        });
    }

    @Override
    public void delete(String fingerprint) {
        checkFingerprint(fingerprint);
        withKeyLock(fingerprint, () -> Files.deleteIfExists(recordFile(fingerprint)));
    }

    @Override
    public List<String> fingerprints() {
        if (!Files.isDirectory(cacheDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(cacheDir)) {
            return files
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(RECORD_SUFFIX))
                    .map(name -> name.substring(0, name.length() - RECORD_SUFFIX.length()))
                    .filter(name -> FINGERPRINT.matcher(name).matches())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new CacheStoreException("读取缓存目录失败: " + cacheDir, e);
        }
    }

    @Override
    public boolean expireIfStale(String fingerprint, Instant now) {
        checkFingerprint(fingerprint);
        return withKeyLock(fingerprint, () -> {
            Path file = recordFile(fingerprint);
            StoredRecord stored = readRecord(fingerprint, file);
            if (stored.isAbsent()) {
                return false;
            }
            if (stored.isCorrupt() || stored.record.isExpired(now, ttl)) {
                return Files.deleteIfExists(file);
            }
            return false;
        });
    }

    @Override
    public int purgeOrphans(Instant now) {
        Instant cutoff = now.minus(ttl);
        int removed = 0;
        if (!Files.isDirectory(cacheDir)) {
            return removed;
        }
        try (Stream<Path> files = Files.list(cacheDir)) {
            List<Path> temps = files
                    .filter(path -> path.getFileName().toString().endsWith(TEMP_SUFFIX))
                    .collect(Collectors.toList());
            for (Path temp : temps) {
                try {
                    if (Files.getLastModifiedTime(temp).toInstant().isBefore(cutoff)
                            && Files.deleteIfExists(temp)) {
                        removed++;
                    }
                } catch (IOException e) {
                    log.warn("清理临时文件失败: {}", temp, e);
                }
            }
        } catch (IOException e) {
            throw new CacheStoreException("读取缓存目录失败: " + cacheDir, e);
        }
        return removed;
    }

    Path recordFile(String fingerprint) {
        return cacheDir.resolve(fingerprint + RECORD_SUFFIX);
    }

    private <T> T withKeyLock(String fingerprint, KeyAction<T> action) {
        Path lockFile = lockFile(stripeOf(fingerprint));
        Lock localLock = LOCAL_LOCKS.get(lockFile);
        localLock.lock();
        try {
            Files.createDirectories(lockDir);
            try (FileChannel channel = FileChannel.open(lockFile, CREATE, WRITE);
                 FileLock ignored = channel.lock()) {
                return action.run();
            }
        } catch (IOException e) {
            throw new CacheStoreException("缓存操作失败: " + fingerprint, e);
        } finally {
            localLock.unlock();
        }
    }

    private int stripeOf(String fingerprint) {
        return Integer.parseInt(fingerprint.substring(0, 6), 16) % lockStripes;
    }

    private Path lockFile(int stripe) {
        return lockDir.resolve(String.format(Locale.ROOT, "stripe-%02d.lock", stripe)).toAbsolutePath().normalize();
    }

    private StoredRecord readRecord(String fingerprint, Path file) throws IOException {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return StoredRecord.ABSENT;
        }

        try {
            CacheRecord record = objectMapper.readValue(content, CacheRecord.class);
            if (record != null && record.isWellFormed() && fingerprint.equals(record.getFingerprint())) {
                return StoredRecord.of(record);
            }
            log.warn("缓存记录内容不合法，将被删除: {}", file);
        } catch (JsonProcessingException e) {
            log.warn("缓存记录无法解析，将被删除: {} ({})", file, e.getOriginalMessage());
        }
        return StoredRecord.CORRUPT;
    }

    private void writeRecord(Path file, CacheRecord record) throws IOException {
        Path temp = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            Files.write(temp, objectMapper.writeValueAsBytes(record));
            Files.move(temp, file, REPLACE_EXISTING, ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void checkFingerprint(String fingerprint) {
        if (fingerprint == null || !FINGERPRINT.matcher(fingerprint).matches()) {
            throw new IllegalArgumentException("Invalid fingerprint: " + fingerprint);
        }
    }

    @FunctionalInterface
    private interface KeyAction<T> {
        T run() throws IOException;
    }

    private static final class StoredRecord {
        private static final StoredRecord ABSENT = new StoredRecord(null, false);
        private static final StoredRecord CORRUPT = new StoredRecord(null, true);

        private final CacheRecord record;
        private final boolean corrupt;

        private StoredRecord(CacheRecord record, boolean corrupt) {
            this.record = record;
            this.corrupt = corrupt;
        }

        static StoredRecord of(CacheRecord record) {
            return new StoredRecord(record, false);
        }

        boolean isAbsent() {
            return record == null && !corrupt;
        }

        boolean isCorrupt() {
            return corrupt;
        }

        boolean isPresent() {
            return record != null;
        }
    }
}
