package io.github.reugn.route4j.processor;

import com.google.auto.service.AutoService;
import com.squareup.javapoet.JavaFile;
import io.github.reugn.route4j.annotation.Controller;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Messager;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedOptions;
import javax.annotation.processing.SupportedSourceVersion;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.ElementFilter;
import java.io.IOException;
import java.util.Set;

/**
 * Main annotation processor for route4j: generates route collections for controller classes.
 *
 * <p>This is the entry point for the route4j annotation processor, registered via
 * {@link com.google.auto.service.AutoService} for automatic discovery by the Java compiler.
 *
 * <p><b>Generated Output:</b>
 * <p>For each {@code @Controller} type, generates a {@code {ClassName}Routes} class that
 * registers every endpoint with a {@link io.github.reugn.route4j.runtime.RoutesBuilder}:
 * <pre>
 * {@code // Source
 * @Controller(path = "api")
 * public class BookController {
 *     @GET(":id")
 *     public Book show(@PathParam("id") long id) { ... }
 * }
 *
 * // Usage
 * new BookControllerRoutes(new BookController()).boot(routes);}
 * </pre>
 *
 * <p><b>Processing Pipeline:</b>
 * <ol>
 *   <li><b>Attachment</b>: Reject route annotations outside {@code @Controller} types</li>
 *   <li><b>Assembly</b>: Expand every route annotation of a controller ({@link ControllerAssembler})</li>
 *   <li><b>Generation</b>: Emit and write the route collection ({@link RouteCollectionWriter})</li>
 * </ol>
 *
 * <p><b>Error Handling:</b>
 * <p>Errors are reported via the {@link Messager} and processing continues, so one compilation
 * reports as many errors as possible. A failing endpoint is left out of the generated class
 * while its siblings are still registered.
 *
 * @see ControllerAssembler
 * @see ProcessorOptions
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes({
        "io.github.reugn.route4j.annotation.Controller",
        "io.github.reugn.route4j.annotation.EndPoint",
        "io.github.reugn.route4j.annotation.CustomEndPoint",
        "io.github.reugn.route4j.annotation.CustomRouteBuilder",
        "io.github.reugn.route4j.annotation.GET",
        "io.github.reugn.route4j.annotation.POST",
        "io.github.reugn.route4j.annotation.PUT",
        "io.github.reugn.route4j.annotation.DELETE",
        "io.github.reugn.route4j.annotation.PATCH",
        "io.github.reugn.route4j.annotation.HEAD",
        "io.github.reugn.route4j.annotation.OPTIONS",
        "io.github.reugn.route4j.annotation.MOVE",
        "io.github.reugn.route4j.annotation.COPY",
        "io.github.reugn.route4j.annotation.PathParam",
        "io.github.reugn.route4j.annotation.QueryParam",
        "io.github.reugn.route4j.annotation.ReqContent",
        "io.github.reugn.route4j.annotation.QueryContent",
        "io.github.reugn.route4j.annotation.AuthContent",
        "io.github.reugn.route4j.annotation.RequestField",
        "io.github.reugn.route4j.annotation.Req",
        "io.github.reugn.route4j.annotation.DefaultValue",
        "io.github.reugn.route4j.annotation.DefaultFactory"
})
@SupportedOptions({ProcessorOptions.VERBOSE, ProcessorOptions.CLASS_SUFFIX})
@SupportedSourceVersion(SourceVersion.RELEASE_17)
public class RouteControllerProcessor extends AbstractProcessor {

    private ErrorReporter errorReporter;
    private ProcessingContext context;
    private ControllerAssembler assembler;

    /**
     * Creates a new RouteControllerProcessor instance.
     *
     * <p>This no-arg constructor is required for annotation processor discovery via
     * {@link java.util.ServiceLoader}. The processor is not usable until
     * {@link #init(ProcessingEnvironment)} is called by the compiler.
     */
    public RouteControllerProcessor() {
        // Required for ServiceLoader-based processor discovery
    }

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        Messager messager = processingEnv.getMessager();
        this.errorReporter = (kind, element, annotation, message) -> {
            if (element == null) {
                messager.printMessage(kind, message);
            } else if (annotation == null) {
                messager.printMessage(kind, message, element);
            } else {
                messager.printMessage(kind, message, element, annotation);
            }
        };
        ProcessorOptions options = ProcessorOptions.parse(processingEnv.getOptions(), errorReporter);
        this.context = new ProcessingContext(processingEnv.getTypeUtils(), processingEnv.getElementUtils(),
                errorReporter, options);
        this.assembler = new ControllerAssembler(context);
    }

    /**
     * Processes {@code @Controller} types and their route annotations.
     *
     * @param annotations the annotation types being processed in this round
     * @param roundEnv    the environment for this processing round
     * @return {@code true} to claim the annotations, preventing other processors from handling them
     */
    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        checkAttachment(roundEnv);

        for (TypeElement controller : ElementFilter.typesIn(roundEnv.getElementsAnnotatedWith(Controller.class))) {
            AnnotationMirror mirror = AnnotationArguments.find(controller, Controller.class.getCanonicalName());
            ControllerSpec spec = assembler.assemble(controller, mirror);
            if (spec == null) {
                continue;
            }
            try {
                JavaFile file = RouteCollectionWriter.write(spec);
                file.writeTo(processingEnv.getFiler());
            } catch (IOException e) {
                errorReporter.error(controller, "Failed to generate route collection: " + e.getMessage());
                continue;
            }
            if (context.options().verbose()) {
                reportRegistrations(spec);
            }
        }
        return true;
    }

    // Route annotations only mean something on members of a controller
    private void checkAttachment(RoundEnvironment roundEnv) {
        for (RouteMarker marker : RouteMarker.values()) {
            TypeElement annotation = processingEnv.getElementUtils().getTypeElement(marker.annotationName());
            if (annotation == null) {
                continue;
            }
            for (Element element : roundEnv.getElementsAnnotatedWith(annotation)) {
                Element enclosing = element.getEnclosingElement();
                if (AnnotationArguments.find(enclosing, Controller.class.getCanonicalName()) == null) {
                    errorReporter.error(Problem.of(element, AnnotationArguments.find(element, marker.annotationName()),
                            marker.displayName() + " can only be attached to member functions of a @Controller class; '"
                                    + enclosing.getSimpleName() + "' is not annotated with @Controller."));
                }
            }
        }
    }

    private void reportRegistrations(ControllerSpec spec) {
        for (EndpointSpec endpoint : spec.endpoints()) {
            errorReporter.note(endpoint.handler(), "Registered " + endpoint.describe(spec.globalPath()));
        }
        for (RouteBuilderSpec routeBuilder : spec.routeBuilders()) {
            errorReporter.note(routeBuilder.handler(), "Registered route builder " + routeBuilder.methodName()
                    + "() with global setting " + routeBuilder.grouping());
        }
        errorReporter.note(spec.element(), "Generated " + spec.generatedType().canonicalName());
    }
}
