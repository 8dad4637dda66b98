/**
 * Annotation processor implementation for route4j.
 * <p>
 * This package contains the compile-time processor that generates a
 * {@link io.github.reugn.route4j.runtime.RouteCollection} for every
 * {@link io.github.reugn.route4j.annotation.Controller} type.
 * <p>
 * <b>Internal implementation</b> - not part of the public API.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * RouteControllerProcessor (entry point)
 *     └── ControllerAssembler ── EndpointSpecBuilder (one per annotated method)
 *             │                      ├── ArgumentMatcher      - annotation arguments to rule buckets
 *             │                      ├── SourceClassifier     - parameter to request value source
 *             │                      └── ExtractionSynthesizer - adapter method emission
 *             └── RouteCollectionWriter - route collection class emission
 *
 * Support utilities:
 *     ├── CodeGenUtils       - Naming, default expressions, string escaping
 *     ├── ValidationUtils    - Compile-time validation checks
 *     ├── LiteralValidator   - Default literal parsing checks
 *     ├── ReferenceValidator - Default field and factory reference checks
 *     └── ErrorReporter      - Diagnostic reporting interface
 * </pre>
 *
 * @see io.github.reugn.route4j.annotation
 */
package io.github.reugn.route4j.processor;
