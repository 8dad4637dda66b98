package io.github.reugn.route4j.processor;

import javax.lang.model.SourceVersion;
import java.util.Map;

/**
 * Processor configuration read from {@code -A} compiler options.
 *
 * <p><b>Options:</b>
 * <table border="1">
 *   <caption>Supported processor options</caption>
 *   <tr><th>Option</th><th>Default</th><th>Effect</th></tr>
 *   <tr>
 *     <td>{@code route4j.verbose}</td>
 *     <td>{@code false}</td>
 *     <td>Print a note for every registered route and every skipped declaration</td>
 *   </tr>
 *   <tr>
 *     <td>{@code route4j.classSuffix}</td>
 *     <td>{@code Routes}</td>
 *     <td>Suffix of generated class names</td>
 *   </tr>
 * </table>
 *
 * <p>Invalid values are reported as warnings and replaced by the defaults.
 *
 * @param verbose     whether to print progress notes
 * @param classSuffix the generated class name suffix
 */
record ProcessorOptions(boolean verbose, String classSuffix) {

    static final String VERBOSE = "route4j.verbose";
    static final String CLASS_SUFFIX = "route4j.classSuffix";
    static final String DEFAULT_CLASS_SUFFIX = "Routes";

    /**
     * Parses the processor options.
     *
     * @param options       the raw options passed to the compiler
     * @param errorReporter callback for reporting invalid values
     * @return the parsed options
     */
    static ProcessorOptions parse(Map<String, String> options, ErrorReporter errorReporter) {
        boolean verbose = false;
        String verboseValue = options.get(VERBOSE);
        if (verboseValue != null) {
            // -Aroute4j.verbose without a value arrives as null or empty
            if (verboseValue.isEmpty() || "true".equalsIgnoreCase(verboseValue)) {
                verbose = true;
            } else if (!"false".equalsIgnoreCase(verboseValue)) {
                errorReporter.warning(null, "Ignoring invalid value '" + verboseValue + "' for option "
                        + VERBOSE + ". Use 'true' or 'false'.");
            }
        } else if (options.containsKey(VERBOSE)) {
            verbose = true;
        }

        String suffix = DEFAULT_CLASS_SUFFIX;
        String suffixValue = options.get(CLASS_SUFFIX);
        if (suffixValue != null) {
            if (SourceVersion.isIdentifier("A" + suffixValue) && !suffixValue.isEmpty()) {
                suffix = suffixValue;
            } else {
                errorReporter.warning(null, "Ignoring invalid value '" + suffixValue + "' for option "
                        + CLASS_SUFFIX + ". The suffix must consist of Java identifier characters.");
            }
        }

        return new ProcessorOptions(verbose, suffix);
    }
}
