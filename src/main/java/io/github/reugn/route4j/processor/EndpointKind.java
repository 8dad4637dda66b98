package io.github.reugn.route4j.processor;

import java.util.List;

import static io.github.reugn.route4j.processor.ParsingRule.labeled;
import static io.github.reugn.route4j.processor.ParsingRule.labeledVarArg;
import static io.github.reugn.route4j.processor.ParsingRule.unlabeledVarArg;

/**
 * The kinds of route-producing method annotations, each with its argument rule table.
 */
enum EndpointKind {
    /**
     * {@code @EndPoint(method, path, middleware, body)}.
     */
    ENDPOINT(endpointRules()),
    /**
     * {@code @GET(path..., middleware)} and its siblings; the method is implied.
     */
    METHOD_SHORTHAND(List.of(
            unlabeledVarArg().optional(),
            labeledVarArg("middleware").optional())),
    /**
     * {@code @CustomEndPoint}; same arguments as {@link #ENDPOINT}.
     */
    CUSTOM_ENDPOINT(endpointRules()),
    CUSTOM_ROUTE_BUILDER(List.of(
            labeled("useControllerGlobalSetting").optional(),
            labeled("globalSettingCondition").optional()));

    static final int METHOD = 0;
    static final int PATH = 1;
    static final int MIDDLEWARE = 2;
    static final int BODY = 3;

    static final int SHORTHAND_PATH = 0;
    static final int SHORTHAND_MIDDLEWARE = 1;

    static final int USE_GLOBAL_SETTING = 0;
    static final int GLOBAL_SETTING_CONDITION = 1;

    private final List<ParsingRule> rules;

    EndpointKind(List<ParsingRule> rules) {
        this.rules = rules;
    }

    List<ParsingRule> rules() {
        return rules;
    }

    private static List<ParsingRule> endpointRules() {
        return List.of(
                labeled("method").optional(),
                labeledVarArg("path").optional(),
                labeledVarArg("middleware").optional(),
                labeled("body").optional());
    }
}
