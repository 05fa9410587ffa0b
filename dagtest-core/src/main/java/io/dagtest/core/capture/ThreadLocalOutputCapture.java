package io.dagtest.core.capture;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// {@link OutputCapture} keeping one buffer per channel per thread.
///
/// Channels are declared up front, each with a short name and a description
/// used when reporting. Tests write through {@link #stream(String)}, a
/// `PrintStream` that resolves the writing thread's buffer on every write, so
/// a single stream instance can be shared by all concurrently running tests.
///
/// ### Default Channels
/// - `stdout` - "Standard Output"
/// - `stderr` - "Standard Error"
///
/// @implNote **Thread-safe**. Buffers are thread-confined. A task
/// {@linkplain #fork(Runnable) forked} to a worker thread writes into buffers
/// of its own, which the owner reads only after joining the task, or never.
public final class ThreadLocalOutputCapture implements OutputCapture {

    public static final String STDOUT = "stdout";
    public static final String STDERR = "stderr";

    private final Map<String, String> channels;
    private final ThreadLocal<Buffers> local;

    /// Creates a capture with the `stdout` and `stderr` channels.
    public ThreadLocalOutputCapture() {
        this(Map.of(STDOUT, "Standard Output", STDERR, "Standard Error"));
    }

    /// Creates a capture with the given channels.
    ///
    /// @param channels channel name to description, not null or empty
    /// @throws IllegalArgumentException if no channel is declared
    public ThreadLocalOutputCapture(Map<String, String> channels) {
        Objects.requireNonNull(channels, "channels must not be null");
        if (channels.isEmpty()) {
            throw new IllegalArgumentException("At least one capture channel is required");
        }
        Map<String, String> ordered = new LinkedHashMap<>();
        channels.keySet().stream().sorted().forEach(name -> ordered.put(name, channels.get(name)));
        this.channels = ordered;
        this.local = ThreadLocal.withInitial(() -> new Buffers(this.channels));
    }

    /// Returns a stream writing into the calling thread's buffer for a channel.
    ///
    /// @param channel declared channel name, not null
    /// @return auto-flushing UTF-8 print stream, never null
    /// @throws IllegalArgumentException if the channel was not declared
    public PrintStream stream(String channel) {
        requireChannel(channel);
        return new PrintStream(new ChannelOutputStream(channel), true, StandardCharsets.UTF_8);
    }

    /// Appends text to the calling thread's buffer for a channel.
    ///
    /// @param channel declared channel name, not null
    /// @param text text to append, not null
    /// @throws IllegalArgumentException if the channel was not declared
    public void write(String channel, String text) {
        requireChannel(channel);
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        local.get().buffer(channel).write(bytes, 0, bytes.length);
    }

    @Override
    public void clear() {
        local.get().reset();
    }

    @Override
    public List<CapturedOutput> retrieve() {
        Buffers buffers = local.get();
        List<CapturedOutput> captured = new ArrayList<>();
        for (Map.Entry<String, String> channel : channels.entrySet()) {
            ByteArrayOutputStream buffer = buffers.buffer(channel.getKey());
            String text;
            synchronized (buffer) {
                text = buffer.toString(StandardCharsets.UTF_8);
                buffer.reset();
            }
            if (!text.isEmpty()) {
                captured.add(new CapturedOutput(channel.getKey(), channel.getValue(), text));
            }
        }
        return captured;
    }

    @Override
    public Fork fork(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        Buffers owner = local.get();
        Buffers forked = new Buffers(channels);
        return new Fork() {
            private volatile boolean abandoned;

            @Override
            public void run() {
                Buffers previous = local.get();
                local.set(forked);
                try {
                    task.run();
                } finally {
                    local.set(previous);
                }
            }

            @Override
            public void join() {
                if (!abandoned) {
                    forked.drainInto(owner);
                }
            }

            @Override
            public void abandon() {
                abandoned = true;
                forked.reset();
            }
        };
    }

    private void requireChannel(String channel) {
        Objects.requireNonNull(channel, "channel must not be null");
        if (!channels.containsKey(channel)) {
            throw new IllegalArgumentException(
                    "Unknown capture channel: "
                            + channel
                            + ". Available: "
                            + String.join(", ", channels.keySet()));
        }
    }

    private static final class Buffers {
        private final Map<String, ByteArrayOutputStream> buffers = new LinkedHashMap<>();

        Buffers(Map<String, String> channels) {
            for (String name : channels.keySet()) {
                buffers.put(name, new ByteArrayOutputStream());
            }
        }

        ByteArrayOutputStream buffer(String channel) {
            return buffers.get(channel);
        }

        void reset() {
            buffers.values().forEach(ByteArrayOutputStream::reset);
        }

        void drainInto(Buffers target) {
            for (Map.Entry<String, ByteArrayOutputStream> entry : buffers.entrySet()) {
                ByteArrayOutputStream source = entry.getValue();
                byte[] bytes;
                synchronized (source) {
                    bytes = source.toByteArray();
                    source.reset();
                }
                target.buffer(entry.getKey()).write(bytes, 0, bytes.length);
            }
        }
    }

    private final class ChannelOutputStream extends OutputStream {
        private final String channel;

        ChannelOutputStream(String channel) {
            this.channel = channel;
        }

        @Override
        public void write(int b) {
            local.get().buffer(channel).write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) {
            local.get().buffer(channel).write(b, off, len);
        }
    }
}
