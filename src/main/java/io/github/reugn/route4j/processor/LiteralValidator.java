package io.github.reugn.route4j.processor;

import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeMirror;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Validates {@code @DefaultValue} literals against the type they must produce.
 * <p>
 * Handles:
 * <ul>
 *   <li>Numeric types (int, long, double, float, byte, short and their wrappers)</li>
 *   <li>Boolean types (boolean and Boolean)</li>
 *   <li>Character types (char and Character), which take exactly one character</li>
 *   <li>Enum types, which take the name of a constant</li>
 *   <li>Null literals for reference types</li>
 * </ul>
 * String and other reference types accept any value.
 *
 * @see ValidationUtils
 */
final class LiteralValidator {

    private static final Set<String> PRIMITIVE_TYPES = Set.of(
            "int", "long", "double", "float", "byte", "short", "char", "boolean"
    );

    private LiteralValidator() {
    }

    /**
     * Validates that a literal can be parsed as the target type.
     *
     * @param value            the literal
     * @param type             the type the default must produce
     * @param annotatedElement the element to report errors against
     * @param errorReporter    callback for reporting errors
     * @return {@code true} if the value is valid, {@code false} if an error was reported
     */
    static boolean validateParseable(String value, TypeMirror type,
                                     Element annotatedElement, ErrorReporter errorReporter) {
        String typeStr = type.toString();

        if ("null".equals(value)) {
            if (isPrimitive(typeStr)) {
                errorReporter.error(annotatedElement,
                        "'null' is not a valid default for primitive type '" + typeStr + "'.");
                return false;
            }
            return true;
        }

        String problem = switch (typeStr) {
            case "int", "java.lang.Integer" -> parse(value, "int", v -> Integer.parseInt(v));
            case "long", "java.lang.Long" -> parse(value, "long", v -> Long.parseLong(stripSuffix(v, "Ll")));
            case "double", "java.lang.Double" -> parse(value, "double", v -> Double.parseDouble(stripSuffix(v, "Dd")));
            case "float", "java.lang.Float" -> parse(value, "float", v -> Float.parseFloat(stripSuffix(v, "Ff")));
            case "byte", "java.lang.Byte" -> parse(value, "byte", v -> Byte.parseByte(v));
            case "short", "java.lang.Short" -> parse(value, "short", v -> Short.parseShort(v));
            case "boolean", "java.lang.Boolean" -> "true".equals(value) || "false".equals(value)
                    ? null
                    : "'" + value + "' is not a valid boolean. Use 'true' or 'false'.";
            case "char", "java.lang.Character" -> value.length() == 1
                    ? null
                    : "'" + value + "' is not a valid char. Use exactly one character.";
            default -> validateEnumConstant(value, type);
        };

        if (problem != null) {
            errorReporter.error(annotatedElement, problem);
            return false;
        }
        return true;
    }

    private static String validateEnumConstant(String value, TypeMirror type) {
        TypeElement enumType = CodeGenUtils.enumType(type);
        if (enumType == null) {
            return null;
        }
        List<String> constants = new ArrayList<>();
        for (Element enclosed : enumType.getEnclosedElements()) {
            if (enclosed.getKind() == ElementKind.ENUM_CONSTANT) {
                constants.add(enclosed.getSimpleName().toString());
            }
        }
        if (constants.contains(value)) {
            return null;
        }
        String suggestion = ReferenceValidator.findSimilar(value, constants);
        return "'" + value + "' is not a constant of " + enumType.getSimpleName() + "."
                + (suggestion != null
                ? " Did you mean '" + suggestion + "'?"
                : " Available constants: " + String.join(", ", constants) + ".");
    }

    private static String parse(String value, String typeName, NumberParser parser) {
        try {
            parser.parse(value);
            return null;
        } catch (NumberFormatException e) {
            return "'" + value + "' is not a valid " + typeName + ".";
        }
    }

    private static String stripSuffix(String value, String suffixes) {
        if (!value.isEmpty() && suffixes.indexOf(value.charAt(value.length() - 1)) >= 0) {
            return value.substring(0, value.length() - 1);
        }
        return value;
    }

    static boolean isPrimitive(String typeStr) {
        return PRIMITIVE_TYPES.contains(typeStr);
    }

    static String getSimpleTypeName(String typeStr) {
        int lastDot = typeStr.lastIndexOf('.');
        return lastDot >= 0 ? typeStr.substring(lastDot + 1) : typeStr;
    }

    @FunctionalInterface
    private interface NumberParser {
        void parse(String value);
    }
}
