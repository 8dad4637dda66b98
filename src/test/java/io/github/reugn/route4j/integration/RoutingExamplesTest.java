package io.github.reugn.route4j.integration;

import com.google.testing.compile.JavaFileObjects;
import io.github.reugn.route4j.runtime.BodyStreamStrategy;
import io.github.reugn.route4j.runtime.HttpMethod;
import io.github.reugn.route4j.util.FakeRequest;
import io.github.reugn.route4j.util.RecordingRoutes;
import io.github.reugn.route4j.util.RuntimeTestHelper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import java.util.concurrent.CompletionStage;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * E2E integration tests for route registration.
 * These tests boot the generated route collections and check what was registered.
 */
@DisplayName("Routing Examples (E2E)")
class RoutingExamplesTest {

    private static final String WRAP_MIDDLEWARE = """
                public static class %1$s implements Middleware {
                    public Object respond(Request request, Responder next) throws Exception {
                        return "[%1$s " + next.respond(request) + "]";
                    }
                }
            """;

    @Test
    @DisplayName("Controller grouping - path prefix and middleware, outermost first")
    void controllerGrouping() throws Exception {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Api",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.*;
                        import io.github.reugn.route4j.runtime.*;
                        
                        @Controller(path = "api", middleware = Api.Outer.class)
                        public class Api {
                        %s
                        %s
                            @GET("plain")
                            public String plain() { return "plain"; }
                        
                            @GET(value = "tagged", middleware = Inner.class)
                            public String tagged() { return "tagged"; }
                        }
                        """.formatted(WRAP_MIDDLEWARE.formatted("Outer"), WRAP_MIDDLEWARE.formatted("Inner")));

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        RecordingRoutes routes = helper.boot("example.Api");

        assertThat(routes.paths()).containsExactly("/api/plain", "/api/tagged");
        assertThat(routes.groupCount()).isEqualTo(1);

        RecordingRoutes.Route plain = routes.route(HttpMethod.GET, "/api/plain");
        assertThat(plain.middlewareNames()).containsExactly("Outer");
        assertThat(plain.handle(FakeRequest.get("/api/plain"))).isEqualTo("[Outer plain]");

        RecordingRoutes.Route tagged = routes.route(HttpMethod.GET, "/api/tagged");
        assertThat(tagged.middlewareNames()).containsExactly("Outer", "Inner");
        assertThat(tagged.handle(FakeRequest.get("/api/tagged"))).isEqualTo("[Outer [Inner tagged]]");
    }

    @Test
    @DisplayName("Registration order - declared endpoints, custom endpoints, then route builders")
    void registrationOrder() {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Shop",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.*;
                        import io.github.reugn.route4j.runtime.*;
                        import java.util.List;
                        
                        @Controller
                        public class Shop {
                            @CustomRouteBuilder
                            public void extra(RoutesBuilder routes) {
                                routes.on(HttpMethod.GET, List.of("extra"), BodyStreamStrategy.COLLECT, request -> "extra");
                            }
                        
                            @CustomEndPoint(path = "raw")
                            public Object raw(Request request) { return "raw"; }
                        
                            @GET("first")
                            public String first() { return "first"; }
                        
                            @POST({})
                            public String root() { return "root"; }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        RecordingRoutes routes = helper.boot("example.Shop");

        assertThat(routes.paths()).containsExactly("/first", "/", "/raw", "/extra");
    }

    @Test
    @DisplayName("Route builder grouping - known and deferred flags")
    void routeBuilderGrouping() throws Exception {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Admin",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.*;
                        import io.github.reugn.route4j.runtime.*;
                        import java.util.List;
                        
                        @Controller(path = "admin")
                        public class Admin {
                            private final boolean secured;
                        
                            public Admin(boolean secured) {
                                this.secured = secured;
                            }
                        
                            public boolean isSecured() {
                                return secured;
                            }
                        
                            @CustomRouteBuilder(useControllerGlobalSetting = true)
                            public void grouped(RoutesBuilder routes) {
                                routes.on(HttpMethod.GET, List.of("grouped"), BodyStreamStrategy.COLLECT, request -> "grouped");
                            }
                        
                            @CustomRouteBuilder
                            public void health(RoutesBuilder routes) {
                                routes.on(HttpMethod.GET, List.of("health"), BodyStreamStrategy.COLLECT, request -> "up");
                            }
                        
                            @CustomRouteBuilder(globalSettingCondition = "controller.isSecured()")
                            public void conditional(RoutesBuilder routes) {
                                routes.on(HttpMethod.GET, List.of("conditional"), BodyStreamStrategy.COLLECT, request -> "c");
                            }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        Class<?> adminClass = helper.loadClass("example.Admin");

        RecordingRoutes secured = helper.boot(adminClass.getConstructor(boolean.class).newInstance(true));
        assertThat(secured.paths()).containsExactly("/admin/grouped", "/health", "/admin/conditional");

        RecordingRoutes open = helper.boot(adminClass.getConstructor(boolean.class).newInstance(false));
        assertThat(open.paths()).containsExactly("/admin/grouped", "/health", "/conditional");
    }

    @Test
    @DisplayName("Custom endpoint - receives the raw request under a non-standard method")
    void customEndpoint() throws Exception {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Files",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.*;
                        import io.github.reugn.route4j.runtime.*;
                        
                        @Controller
                        public class Files {
                            @CustomEndPoint(method = "report", path = {"files", "report"}, body = BodyStreamStrategy.STREAM)
                            public String report(Request request) {
                                return request.method() + " " + request.url();
                            }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        RecordingRoutes routes = helper.boot("example.Files");

        RecordingRoutes.Route route = routes.route(HttpMethod.of("REPORT"), "/files/report");
        assertThat(route.body()).isEqualTo(BodyStreamStrategy.STREAM);
        assertThat(route.handle(FakeRequest.of(HttpMethod.of("REPORT"), "/files/report")))
                .isEqualTo("REPORT /files/report");
    }

    @Test
    @DisplayName("Void and asynchronous handlers - effects are preserved")
    void voidAndAsyncHandlers() throws Exception {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Jobs",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.*;
                        import java.util.concurrent.CompletableFuture;
                        
                        @Controller
                        public class Jobs {
                            private int pings;
                        
                            @POST("ping")
                            public void ping() {
                                pings++;
                            }
                        
                            @GET({"jobs", ":id"})
                            public CompletableFuture<String> job(long id) {
                                return CompletableFuture.supplyAsync(() -> "job " + id);
                            }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        Object jobs = helper.newInstance("example.Jobs");
        RecordingRoutes routes = helper.boot(jobs);

        assertThat(routes.route(HttpMethod.POST, "/ping").handle(FakeRequest.of(HttpMethod.POST, "/ping"))).isNull();
        assertThat(helper.getField(jobs, "pings")).isEqualTo(1);

        Object result = routes.route(HttpMethod.GET, "/jobs/:id").handle(FakeRequest.get("/jobs/7").pathParam("id", "7"));
        assertThat(result).isInstanceOf(CompletionStage.class);
        assertThat(((CompletionStage<?>) result).toCompletableFuture().join()).isEqualTo("job 7");
    }

    @Test
    @DisplayName("Booting twice registers the same routes again")
    void bootIsRepeatable() {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Status",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.*;
                        
                        @Controller(path = "status")
                        public class Status {
                            @HEAD({})
                            public String head() { return ""; }
                        
                            @OPTIONS({})
                            public String options() { return "GET, HEAD"; }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        Object status = helper.newInstance("example.Status");

        RecordingRoutes first = helper.boot(status);
        RecordingRoutes second = helper.boot(status);
        assertThat(second.paths()).isEqualTo(first.paths()).containsExactly("/status", "/status");
        assertThat(second.routes()).extracting(RecordingRoutes.Route::method)
                .containsExactly(HttpMethod.HEAD, HttpMethod.OPTIONS);
    }
}
