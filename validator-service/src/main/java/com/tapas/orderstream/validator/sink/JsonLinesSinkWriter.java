package com.tapas.orderstream.validator.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * One sink directory. Each partition slice of a micro-batch becomes one JSON-lines file:
 * {@code partition=<p>/epoch=<e>/from-<first offset>.jsonl}. The slice start comes from the
 * sink's checkpoint, so replaying a batch rewrites the same file.
 */
public class JsonLinesSinkWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesSinkWriter.class);

    private final SinkKind kind;
    private final Path root;

    public JsonLinesSinkWriter(SinkKind kind, Path sinkRoot) {
        this.kind = kind;
        this.root = sinkRoot.resolve(kind.directory());
    }

    public SinkKind kind() {
        return kind;
    }

    public Path slicePath(long epoch, int partition, long sliceStart) {
        return root.resolve("partition=" + partition)
                .resolve("epoch=" + epoch)
                .resolve(String.format("from-%020d.jsonl", sliceStart));
    }

    /**
     * Replaces the slice file with the given lines. An empty slice removes a stale file
     * left by an earlier attempt of the same batch.
     */
    public void writeSlice(long epoch, int partition, long sliceStart, List<String> lines) throws IOException {
        Path target = slicePath(epoch, partition, sliceStart);
        if (lines.isEmpty()) {
            if (Files.deleteIfExists(target)) {
                log.info("Removed stale {} slice {}", kind.directory(), target);
            }
            return;
        }
        StringBuilder content = new StringBuilder();
        for (String line : lines) {
            content.append(line).append('\n');
        }
        AtomicFiles.write(target, content.toString().getBytes(StandardCharsets.UTF_8));
        log.debug("Wrote {} records to {}", lines.size(), target);
    }
}
