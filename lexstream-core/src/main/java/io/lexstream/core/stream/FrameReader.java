package io.lexstream.core.stream;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reassembles {@code text/event-stream} frames from arbitrarily chunked bytes.
 *
 * <p>Frames end at two consecutive {@code \n} bytes, ignoring {@code \r}. Bytes after the
 * last terminator are kept until the next {@link #ingest} call, so the emitted frames do not
 * depend on how the transport split the stream. Decoding to text happens only once a frame is complete, which
 * keeps multi-byte characters that straddle two reads intact.
 *
 * <p>Only {@code data:} lines are retained. Comments, {@code event:}/{@code id:}/{@code retry:}
 * lines, blank data lines and the {@code [DONE]} marker are dropped. Not thread-safe.
 */
public final class FrameReader {
    public static final String DATA_PREFIX = "data:";
    public static final String DONE_MARKER = "[DONE]";

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private boolean lastWasNewline;

    public List<Frame> ingest(byte[] bytes) {
        return ingest(bytes, 0, bytes.length);
    }

    public List<Frame> ingest(byte[] bytes, int offset, int length) {
        List<Frame> frames = new ArrayList<>();
        for (int i = offset; i < offset + length; i++) {
            byte b = bytes[i];
            if (b == '\n' && lastWasNewline) {
                byte[] raw = pending.toByteArray();
                pending.reset();
                lastWasNewline = false;
                parse(raw).ifPresent(frames::add);
                continue;
            }
            pending.write(b);
            // \r never breaks a terminator, so \r\n\r\n ends a frame too
            if (b != '\r') {
                lastWasNewline = b == '\n';
            }
        }
        return frames;
    }

    public Optional<Frame> finish() {
        byte[] raw = pending.toByteArray();
        pending.reset();
        lastWasNewline = false;
        if (raw.length == 0) {
            return Optional.empty();
        }
        return parse(raw);
    }

    private Optional<Frame> parse(byte[] raw) {
        String block = new String(raw, StandardCharsets.UTF_8);
        List<String> data = new ArrayList<>();
        for (String line : block.split("\n", -1)) {
            String payload = dataPayload(line);
            if (payload == null || payload.isEmpty() || DONE_MARKER.equals(payload)) {
                continue;
            }
            data.add(payload);
        }
        if (data.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Frame(String.join("\n", data)));
    }

    private String dataPayload(String line) {
        String value = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        if (!value.startsWith(DATA_PREFIX)) {
            return null;
        }
        return value.substring(DATA_PREFIX.length()).trim();
    }
}
