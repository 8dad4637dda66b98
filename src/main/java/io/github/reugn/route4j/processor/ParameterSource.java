package io.github.reugn.route4j.processor;

import java.util.List;

/**
 * The request value source of one handler parameter.
 *
 * @param kind the source kind
 * @param key  the lookup key of {@link SourceKind.Shape#KEYED} sources, {@code null} otherwise
 * @param path the accessor path of {@link SourceKind.Shape#PROJECTION} sources (empty for the
 *             request itself), empty otherwise
 */
record ParameterSource(SourceKind kind, String key, List<String> path) {

    ParameterSource {
        path = List.copyOf(path);
    }

    static ParameterSource pathParam(String key) {
        return new ParameterSource(SourceKind.PATH_PARAM, key, List.of());
    }

    static ParameterSource queryParam(String key) {
        return new ParameterSource(SourceKind.QUERY_PARAM, key, List.of());
    }

    static ParameterSource whole(SourceKind kind) {
        return new ParameterSource(kind, null, List.of());
    }

    static ParameterSource projection(SourceKind kind, List<String> path) {
        return new ParameterSource(kind, null, path);
    }

    @Override
    public String toString() {
        return switch (kind.shape()) {
            case KEYED -> kind.displayName() + "(" + key + ")";
            case WHOLE -> kind.displayName();
            case PROJECTION -> kind.displayName() + "(" + (path.isEmpty() ? "<request>" : String.join(".", path)) + ")";
        };
    }
}
