package io.github.reugn.route4j.processor;

import javax.lang.model.SourceVersion;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.VariableElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Decides which request value source a handler parameter binds to.
 *
 * <p><b>Rules:</b>
 * <ul>
 *   <li>No source annotation: {@code @PathParam} keyed by the parameter name</li>
 *   <li>Exactly one: that source, configured from the annotation's {@code value}</li>
 *   <li>More than one, in any combination: an error</li>
 * </ul>
 *
 * <p>Keys default to the parameter name. Accessor paths are dot-separated Java identifiers
 * and default to the request itself.
 */
final class SourceClassifier {

    private SourceClassifier() {
    }

    static Expansion<ParameterSource> classify(VariableElement parameter) {
        String name = parameter.getSimpleName().toString();
        List<AnnotationMirror> markers = new ArrayList<>();
        List<SourceKind> kinds = new ArrayList<>();
        for (AnnotationMirror mirror : parameter.getAnnotationMirrors()) {
            SourceKind kind = SourceKind.forAnnotation(AnnotationArguments.qualifiedName(mirror));
            if (kind != null) {
                markers.add(mirror);
                kinds.add(kind);
            }
        }

        if (markers.isEmpty()) {
            return Expansion.success(ParameterSource.pathParam(name));
        }
        if (markers.size() > 1) {
            List<String> names = kinds.stream().map(SourceKind::displayName).toList();
            return Expansion.failure(Problem.withFix(parameter, markers.get(1),
                    "Parameter for request should have only one type: '" + name + "' declares "
                            + String.join(" and ", names) + ".",
                    "keep exactly one of " + String.join(", ", names)));
        }

        AnnotationMirror marker = markers.get(0);
        SourceKind kind = kinds.get(0);
        String value;
        try {
            List<List<Argument<AnnotationValue>>> buckets =
                    ArgumentMatcher.match(kind.rules(), AnnotationArguments.of(marker));
            value = buckets.isEmpty() || buckets.get(0).isEmpty()
                    ? ""
                    : (String) buckets.get(0).get(0).value().getValue();
        } catch (ArgumentMatchException e) {
            return Expansion.failure(Problem.of(parameter, marker,
                    "Invalid " + kind.displayName() + " arguments: " + e.getMessage()));
        }

        return switch (kind.shape()) {
            case KEYED -> {
                String key = value.isEmpty() ? name : value;
                yield Expansion.success(kind == SourceKind.PATH_PARAM
                        ? ParameterSource.pathParam(key)
                        : ParameterSource.queryParam(key));
            }
            case WHOLE -> Expansion.success(ParameterSource.whole(kind));
            case PROJECTION -> classifyProjection(parameter, marker, kind, value);
        };
    }

    private static Expansion<ParameterSource> classifyProjection(VariableElement parameter,
                                                                 AnnotationMirror marker,
                                                                 SourceKind kind, String value) {
        if (value.isEmpty()) {
            return Expansion.success(ParameterSource.projection(kind, List.of()));
        }
        List<String> path = Arrays.asList(value.split("\\.", -1));
        for (String segment : path) {
            if (!SourceVersion.isIdentifier(segment) || SourceVersion.isKeyword(segment)) {
                return Expansion.failure(Problem.of(parameter, marker,
                        "Invalid request field path '" + value + "': '" + segment
                                + "' is not a Java identifier."));
            }
        }
        return Expansion.success(ParameterSource.projection(kind, path));
    }
}
