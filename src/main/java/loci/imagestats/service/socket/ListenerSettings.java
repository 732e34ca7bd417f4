package loci.imagestats.service.socket;

/**
 * Settings of a {@link FrameIngestionListener}.
 *
 * @param host            interface to bind
 * @param port            first port to try; 0 picks an ephemeral port
 * @param activeOnStart   whether connections are accepted right after start
 * @param readTimeoutMs   read timeout on accepted connections
 * @param idleSleepMs     sleep between checks while inactive
 * @param acceptPollMs    accept timeout; bounds how quickly pause and close take effect
 * @param maxMessageBytes largest total of the three declared lengths
 */
public record ListenerSettings(
        String host,
        int port,
        boolean activeOnStart,
        int readTimeoutMs,
        long idleSleepMs,
        int acceptPollMs,
        long maxMessageBytes
) {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 21734;
    public static final long DEFAULT_MAX_MESSAGE_BYTES = 1L << 30;

    public ListenerSettings {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (readTimeoutMs < 0 || idleSleepMs <= 0 || acceptPollMs <= 0 || maxMessageBytes <= 0) {
            throw new IllegalArgumentException("Listener timings and limits must be positive");
        }
    }

    public static ListenerSettings defaults() {
        return new ListenerSettings(DEFAULT_HOST, DEFAULT_PORT, true, 5000, 100, 20, DEFAULT_MAX_MESSAGE_BYTES);
    }

    public ListenerSettings withPort(int newPort) {
        return new ListenerSettings(host, newPort, activeOnStart, readTimeoutMs, idleSleepMs, acceptPollMs,
                maxMessageBytes);
    }
}
