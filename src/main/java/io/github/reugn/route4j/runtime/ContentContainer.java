package io.github.reugn.route4j.runtime;

/**
 * The request body, decodable into user types.
 */
public interface ContentContainer {

    /**
     * Decodes the whole body as the given type.
     *
     * @param type the target type
     * @param <T>  the target type
     * @return the decoded value
     * @throws Abort if the body is missing or cannot be decoded
     */
    <T> T decode(Class<T> type);
}
