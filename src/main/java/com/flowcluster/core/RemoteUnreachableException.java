package com.flowcluster.core;

/**
 * Exception raised by a transport when a remote runtime cannot be reached.
 *
 * <p>This exception is typically raised when:
 * <ul>
 *   <li>No runtime is listening at the endpoint</li>
 *   <li>The remote call exceeded the transport's timeout</li>
 *   <li>The connection broke while the call was in flight</li>
 * </ul>
 *
 * <p>It travels inside failed futures. The connect protocol turns it into the
 * {@link ConnectionError#UNREACHABLE} value.
 *
 * @author flowcluster
 */
public class RemoteUnreachableException extends RuntimeException {

    private final Endpoint endpoint;

    public RemoteUnreachableException(Endpoint endpoint, String message) {
        this(endpoint, message, null);
    }

    /**
     * Creates an exception for an unreachable endpoint.
     *
     * @param endpoint the endpoint that could not be reached
     * @param message what was being attempted
     * @param cause the underlying transport failure, or null
     */
    public RemoteUnreachableException(Endpoint endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }
}
