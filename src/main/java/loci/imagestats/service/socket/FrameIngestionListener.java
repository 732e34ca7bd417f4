package loci.imagestats.service.socket;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import loci.imagestats.asset.SocketAsset;
import loci.imagestats.image.CanonicalImage;
import loci.imagestats.image.ImageCodec;
import loci.imagestats.image.ImageIoCodec;
import loci.imagestats.image.ImageNormalizer;
import loci.imagestats.image.RawImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TCP listener that receives images pushed by remote peers.
 *
 * <p>Each accepted connection carries exactly one framed message (see
 * {@link FrameMessageDecoder}). A successfully decoded frame becomes a
 * {@link SocketAsset}; any failure drops that connection, is logged and queued for
 * {@link #pollErrors()}, and the listener carries on accepting. Only a failure of the
 * server socket itself stops the listener, and that too is queued as an error with
 * {@link #isRunning()} turning false.</p>
 *
 * <p>All results are handed to the consumer through queues that it drains at its own
 * pace with the {@code poll} methods. None of the public methods block on network
 * activity.</p>
 *
 * <p>Binding starts at the configured port and walks upwards one port at a time while
 * the port is taken. Walking past 65535 means no port was available and
 * {@link #start()} fails.</p>
 */
public class FrameIngestionListener implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FrameIngestionListener.class);

    private static final int MAX_PORT = 65535;

    private final ListenerSettings settings;
    private final FrameMessageDecoder messageDecoder;
    private final Map<Compression, PayloadDecoder> payloadDecoders;

    // Listener state
    private final AtomicBoolean active;
    private final AtomicBoolean receiving = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    // Hand-off to the consumer
    private final Queue<SocketAsset> assets = new ConcurrentLinkedQueue<>();
    private final Queue<ConnectionEvent> events = new ConcurrentLinkedQueue<>();
    private final Queue<IOException> errors = new ConcurrentLinkedQueue<>();

    private final Object lifecycleLock = new Object();
    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile int boundPort = -1;

    public FrameIngestionListener(ListenerSettings settings) {
        this(settings, new ImageIoCodec());
    }

    public FrameIngestionListener(ListenerSettings settings, ImageCodec codec) {
        this(settings, PayloadDecoders.defaults(codec));
    }

    public FrameIngestionListener(ListenerSettings settings, Map<Compression, PayloadDecoder> payloadDecoders) {
        this.settings = settings;
        this.messageDecoder = new FrameMessageDecoder(settings.maxMessageBytes());
        this.payloadDecoders = Map.copyOf(payloadDecoders);
        this.active = new AtomicBoolean(settings.activeOnStart());
    }

    /**
     * Binds the server socket and starts the accept thread.
     *
     * @throws IOException if every port from the configured one up to 65535 is taken
     * @throws IllegalStateException if the listener is already running
     */
    public void start() throws IOException {
        synchronized (lifecycleLock) {
            if (running.get()) {
                throw new IllegalStateException("Listener already running on " + boundAddress());
            }

            serverSocket = bindWithRetry(settings.host(), settings.port());
            serverSocket.setSoTimeout(settings.acceptPollMs());
            boundPort = serverSocket.getLocalPort();
            running.set(true);

            acceptThread = new Thread(this::acceptLoop, "FrameIngestionListener-" + boundPort);
            acceptThread.setDaemon(true);
            acceptThread.start();

            logger.info("Socket listener started on {}", boundAddress());
        }
    }

    private ServerSocket bindWithRetry(String host, int firstPort) throws IOException {
        int port = firstPort;
        while (true) {
            ServerSocket socket = new ServerSocket();
            try {
                socket.bind(new InetSocketAddress(host, port));
                return socket;
            } catch (IOException e) {
                closeQuietly(socket);
                if (!(e instanceof BindException)) {
                    throw new IOException("Failed to bind " + host + ":" + port + ": " + e.getMessage(), e);
                }
                logger.warn("Bind {}:{} failed: {}. Trying next port", host, port, e.getMessage());
                if (port == 0 || port >= MAX_PORT) {
                    throw new IOException("Port range exhausted starting from " + host + ":" + firstPort, e);
                }
                port++;
            }
        }
    }

    private void acceptLoop() {
        try {
            while (running.get()) {
                if (!active.get()) {
                    sleep(settings.idleSleepMs());
                    continue;
                }

                Socket client;
                try {
                    client = serverSocket.accept();
                } catch (SocketTimeoutException e) {
                    // poll interval elapsed, re-check active and running
                    continue;
                } catch (IOException e) {
                    if (running.get()) {
                        stopWithError("Accept failed", e);
                    }
                    break;
                }
                handleConnection(client);
            }
        } catch (RuntimeException | Error e) {
            stopWithError("Accept loop failed", e);
            throw e;
        }
        logger.debug("Accept loop on port {} finished", boundPort);
    }

    private void stopWithError(String what, Throwable cause) {
        logger.error("{} on {}, listener stopping", what, boundAddress(), cause);
        errors.add(new IOException("Listener stopped: " + cause, cause));
        running.set(false);
    }

    private void handleConnection(Socket client) {
        String peer = describe(client);
        logger.info("Connected: {}", peer);
        events.add(ConnectionEvent.connected(peer));
        receiving.set(true);

        try (Socket socket = client) {
            socket.setSoTimeout(settings.readTimeoutMs());
            DataInputStream input = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
            SocketAsset asset = receive(input);
            assets.add(asset);
            logger.info("Received '{}' ({}x{}x{}) from {}", asset.name(),
                    asset.image().width(), asset.image().height(), asset.image().channels(), peer);
        } catch (IOException e) {
            logger.warn("Dropping connection from {}: {}", peer, e.getMessage());
            errors.add(e);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure handling frame from {}", peer, e);
            errors.add(new IOException("Failed to process frame from " + peer + ": " + e, e));
        } finally {
            receiving.set(false);
            events.add(ConnectionEvent.disconnected(peer));
            logger.info("Disconnected: {}", peer);
        }
    }

    /**
     * Reads and decodes one frame.
     */
    SocketAsset receive(DataInputStream input) throws IOException {
        FrameMessage message = messageDecoder.read(input);
        PayloadDecoder decoder = payloadDecoders.get(message.metadata().compression());
        if (decoder == null) {
            throw new FrameFormatException("No decoder for compression "
                    + message.metadata().compression().wireName(), message.name());
        }

        RawImage raw = decoder.decode(message);
        CanonicalImage image;
        try {
            image = ImageNormalizer.normalize(raw);
        } catch (IllegalArgumentException e) {
            throw new FrameFormatException("Cannot normalize payload: " + e.getMessage(), message.name(), e);
        }
        return new SocketAsset(message.name(), image);
    }

    /**
     * Pauses or resumes accepting. The server socket stays bound while paused; peers
     * connecting in the meantime wait in the backlog.
     */
    public void setActive(boolean value) {
        if (active.getAndSet(value) != value) {
            logger.info("Socket listener {}", value ? "resumed" : "paused");
        }
    }

    public boolean isActive() {
        return active.get();
    }

    /** True while a connection is being read and decoded. */
    public boolean isReceiving() {
        return receiving.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Assets received since the last call, oldest first. */
    public List<SocketAsset> pollAssets() {
        return drain(assets);
    }

    /** Connect and disconnect transitions since the last call, in order. */
    public List<ConnectionEvent> pollConnectionEvents() {
        return drain(events);
    }

    /** Per-connection failures since the last call, in order. */
    public List<IOException> pollErrors() {
        return drain(errors);
    }

    public String host() {
        return settings.host();
    }

    /** Bound port, or -1 before {@link #start()}. */
    public int port() {
        return boundPort;
    }

    /** {@code host:port}, or an empty string before {@link #start()}. */
    public String boundAddress() {
        return boundPort < 0 ? "" : settings.host() + ":" + boundPort;
    }

    /**
     * Stops the accept thread and releases the port. A connection being read is allowed
     * to finish or time out.
     */
    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (!running.getAndSet(false) && serverSocket == null) {
                return;
            }
            closeQuietly(serverSocket);
            serverSocket = null;

            if (acceptThread != null) {
                try {
                    acceptThread.join(settings.readTimeoutMs() + settings.acceptPollMs() + settings.idleSleepMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while waiting for the accept thread to stop");
                }
                acceptThread = null;
            }
            logger.info("Socket listener on port {} closed", boundPort);
        }
    }

    private static <T> List<T> drain(Queue<T> queue) {
        List<T> out = new ArrayList<>();
        T item;
        while ((item = queue.poll()) != null) {
            out.add(item);
        }
        return out;
    }

    private static String describe(Socket socket) {
        if (socket.getInetAddress() == null) {
            return "unknown";
        }
        return socket.getInetAddress().getHostAddress() + ":" + socket.getPort();
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
        }
    }

    private static void closeQuietly(ServerSocket socket) {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing server socket", e);
        }
    }
}
