package fr.lapetina.stickyproxy.domain.upstream;

/**
 * Thrown at construction when a backend address cannot be used as a proxy target.
 * Not recoverable: the process is expected to refuse to start.
 */
public final class InvalidUpstreamAddressException extends RuntimeException {

    private final String address;

    public InvalidUpstreamAddressException(String address, String reason) {
        super("Invalid upstream address '" + address + "': " + reason);
        this.address = address;
    }

    public InvalidUpstreamAddressException(String address, Throwable cause) {
        super("Invalid upstream address '" + address + "': " + cause.getMessage(), cause);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
