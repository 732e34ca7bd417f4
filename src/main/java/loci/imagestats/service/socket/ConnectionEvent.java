package loci.imagestats.service.socket;

/**
 * Connection transition reported by the listener.
 *
 * @param type connected or disconnected
 * @param peer remote address as {@code host:port}
 */
public record ConnectionEvent(Type type, String peer) {

    public enum Type {
        CONNECTED,
        DISCONNECTED
    }

    public static ConnectionEvent connected(String peer) {
        return new ConnectionEvent(Type.CONNECTED, peer);
    }

    public static ConnectionEvent disconnected(String peer) {
        return new ConnectionEvent(Type.DISCONNECTED, peer);
    }
}
