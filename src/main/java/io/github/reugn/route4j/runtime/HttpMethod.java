package io.github.reugn.route4j.runtime;

import java.util.Locale;
import java.util.Objects;

/**
 * An HTTP request method.
 *
 * <p>Standard methods are available as constants; any other valid token can be obtained
 * with {@link #of(String)}.
 */
public final class HttpMethod {

    public static final HttpMethod GET = new HttpMethod("GET");
    public static final HttpMethod POST = new HttpMethod("POST");
    public static final HttpMethod PUT = new HttpMethod("PUT");
    public static final HttpMethod DELETE = new HttpMethod("DELETE");
    public static final HttpMethod PATCH = new HttpMethod("PATCH");
    public static final HttpMethod HEAD = new HttpMethod("HEAD");
    public static final HttpMethod OPTIONS = new HttpMethod("OPTIONS");
    public static final HttpMethod MOVE = new HttpMethod("MOVE");
    public static final HttpMethod COPY = new HttpMethod("COPY");

    private final String name;

    private HttpMethod(String name) {
        this.name = name;
    }

    /**
     * Returns the method with the given name, case-insensitively.
     *
     * @param name the method name
     * @return the method
     * @throws IllegalArgumentException if the name is not an HTTP token
     */
    public static HttpMethod of(String name) {
        Objects.requireNonNull(name, "name");
        String upper = name.toUpperCase(Locale.ROOT);
        return switch (upper) {
            case "GET" -> GET;
            case "POST" -> POST;
            case "PUT" -> PUT;
            case "DELETE" -> DELETE;
            case "PATCH" -> PATCH;
            case "HEAD" -> HEAD;
            case "OPTIONS" -> OPTIONS;
            case "MOVE" -> MOVE;
            case "COPY" -> COPY;
            default -> {
                if (!isToken(upper)) {
                    throw new IllegalArgumentException("Not an HTTP method token: '" + name + "'");
                }
                yield new HttpMethod(upper);
            }
        };
    }

    /**
     * Checks whether a string is a valid method token (RFC 9110 {@code tchar} sequence).
     *
     * @param value the candidate
     * @return {@code true} if the value is a non-empty token
     */
    public static boolean isToken(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean alphaNum = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
            if (!alphaNum && "!#$%&'*+-.^_`|~".indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpMethod)) return false;
        return name.equals(((HttpMethod) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
