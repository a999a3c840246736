package com.fintech.ticks.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Append-only delimited text file holding one record type.
 *
 * <p>Every operation (header write, append, read-back) runs under a single
 * {@link ReentrantLock} owned by this file, so rows from concurrent callers never
 * interleave. Appends go through a {@link FileChannel} opened in append mode and are
 * forced to disk before returning. Reads use an independent reader, so they never move
 * the append channel's position.
 *
 * <p>A row is only complete once its line separator is on disk. A partial trailing row
 * left by a crash is cut off when the file is opened, and a failed append truncates the
 * file back to its length before the write.
 *
 * @param <T> record type
 */
public class AppendOnlyCsvFile<T> implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(AppendOnlyCsvFile.class);
    private static final byte[] LINE_SEPARATOR = "\n".getBytes(StandardCharsets.UTF_8);

    private final Path path;
    private final RowCodec<T> codec;
    private final FileChannel channel;
    private final ReentrantLock lock = new ReentrantLock();

    private AppendOnlyCsvFile(Path path, RowCodec<T> codec, FileChannel channel) {
        this.path = path;
        this.codec = codec;
        this.channel = channel;
    }

    /**
     * Opens the file for appending, creating it if missing. Nothing is written, except
     * that bytes after the last line separator are truncated away.
     *
     * @throws IOException if the file cannot be opened, created or repaired
     */
    public static <T> AppendOnlyCsvFile<T> open(Path path, RowCodec<T> codec) throws IOException {
        FileChannel channel = FileChannel.open(path,
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.APPEND);
        try {
            truncateTornTail(path, channel);
        } catch (IOException e) {
            try {
                channel.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return new AppendOnlyCsvFile<>(path, codec, channel);
    }

    /**
     * Writes the header row iff the file holds zero bytes.
     *
     * @return true if the header was written by this call
     */
    public boolean writeHeaderIfBlank() {
        lock.lock();
        long sizeBefore = -1L;
        try {
            sizeBefore = channel.size();
            return writeHeaderIfBlankLocked();
        } catch (IOException e) {
            rollBack(sizeBefore, e);
            throw new TickLogException("Failed to write header to " + path, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends one record. Writes the header first if the file is still blank.
     */
    public void append(T value) {
        append(() -> value);
    }

    /**
     * Appends the record produced by {@code factory}. The factory runs while the lock is
     * held, so values it derives (such as a write timestamp) follow append order.
     *
     * @return the record that was written
     */
    public T append(Supplier<T> factory) {
        lock.lock();
        long sizeBefore = -1L;
        try {
            sizeBefore = channel.size();
            writeHeaderIfBlankLocked();
            T value = factory.get();
            writeRow(codec.format(value));
            channel.force(false);
            return value;
        } catch (IOException e) {
            rollBack(sizeBefore, e);
            throw new TickLogException("Failed to append to " + path, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reads every data row from the start of the file and returns, in file order, the
     * records accepted by {@code filter}. The header row and blank lines are skipped.
     *
     * @throws MalformedRecordException on the first row that fails to parse
     */
    public List<T> readAll(Predicate<T> filter) {
        lock.lock();
        try {
            List<T> records = new ArrayList<>();
            if (channel.size() == 0) {
                return records;
            }
            try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                String line;
                long lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank() || (lineNumber == 1 && line.equals(codec.header()))) {
                        continue;
                    }
                    T record = parse(line, lineNumber);
                    if (filter.test(record)) {
                        records.add(record);
                    }
                }
            }
            return records;
        } catch (IOException e) {
            throw new TickLogException("Failed to read " + path, e);
        } finally {
            lock.unlock();
        }
    }

    /** Reads every data row. */
    public List<T> readAll() {
        return readAll(record -> true);
    }

    /**
     * Returns true if the file holds no data rows (it may hold a header).
     */
    public boolean hasNoDataRows() {
        lock.lock();
        try {
            if (channel.size() == 0) {
                return true;
            }
            try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                String line;
                long lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank() || (lineNumber == 1 && line.equals(codec.header()))) {
                        continue;
                    }
                    return false;
                }
                return true;
            }
        } catch (IOException e) {
            throw new TickLogException("Failed to read " + path, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Parses the last data row, if any.
     *
     * @throws MalformedRecordException if that row fails to parse
     */
    public Optional<T> readLast() {
        lock.lock();
        try {
            if (channel.size() == 0) {
                return Optional.empty();
            }
            String last = null;
            long lastLineNumber = 0;
            try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                String line;
                long lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank() || (lineNumber == 1 && line.equals(codec.header()))) {
                        continue;
                    }
                    last = line;
                    lastLineNumber = lineNumber;
                }
            }
            return last == null ? Optional.empty() : Optional.of(parse(last, lastLineNumber));
        } catch (IOException e) {
            throw new TickLogException("Failed to read " + path, e);
        } finally {
            lock.unlock();
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        lock.lock();
        try {
            if (channel.isOpen()) {
                channel.close();
                log.debug("Closed {}", path);
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean writeHeaderIfBlankLocked() throws IOException {
        if (channel.size() != 0) {
            return false;
        }
        writeRow(codec.header());
        channel.force(false);
        log.debug("Wrote header to {}", path);
        return true;
    }

    private void writeRow(String row) throws IOException {
        byte[] bytes = row.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(bytes.length + LINE_SEPARATOR.length);
        buffer.put(bytes).put(LINE_SEPARATOR).flip();
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private void rollBack(long size, IOException failure) {
        if (size < 0) {
            return;
        }
        try {
            if (channel.size() > size) {
                channel.truncate(size);
                log.warn("Rolled back partial write to {}: length restored to {}", path, size);
            }
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static void truncateTornTail(Path path, FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0) {
            return;
        }
        long keep = lastLineEnd(path, size);
        if (keep < size) {
            channel.truncate(keep);
            channel.force(false);
            log.warn("Truncated torn trailing row in {}: {} bytes dropped", path, size - keep);
        }
    }

    /** Offset just past the last line separator, or 0 if there is none. */
    private static long lastLineEnd(Path path, long size) throws IOException {
        try (FileChannel reader = FileChannel.open(path, StandardOpenOption.READ)) {
            ByteBuffer buffer = ByteBuffer.allocate(4096);
            long end = size;
            while (end > 0) {
                long from = Math.max(0L, end - buffer.capacity());
                buffer.clear();
                buffer.limit((int) (end - from));
                while (buffer.hasRemaining()) {
                    if (reader.read(buffer, from + buffer.position()) < 0) {
                        break;
                    }
                }
                for (int i = buffer.position() - 1; i >= 0; i--) {
                    if (buffer.get(i) == '\n') {
                        return from + i + 1;
                    }
                }
                end = from;
            }
            return 0L;
        }
    }

    private T parse(String line, long lineNumber) {
        try {
            return codec.parse(line);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new MalformedRecordException(path, lineNumber, line, e);
        }
    }
}
