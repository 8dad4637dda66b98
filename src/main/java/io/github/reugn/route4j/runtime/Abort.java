package io.github.reugn.route4j.runtime;

/**
 * Aborts request handling with an HTTP error status.
 *
 * <p>Thrown by host containers when a required value is missing or malformed; the host
 * framework turns it into an error response.
 */
public class Abort extends RuntimeException {

    private final int status;

    public Abort(int status, String reason) {
        super(reason);
        this.status = status;
    }

    public static Abort badRequest(String reason) {
        return new Abort(400, reason);
    }

    public static Abort unauthorized(String reason) {
        return new Abort(401, reason);
    }

    /**
     * Returns the HTTP status code of the error response.
     *
     * @return the status code
     */
    public int status() {
        return status;
    }
}
