package io.github.reugn.route4j.integration;

import com.google.testing.compile.JavaFileObjects;
import io.github.reugn.route4j.runtime.Abort;
import io.github.reugn.route4j.runtime.HttpMethod;
import io.github.reugn.route4j.util.FakeRequest;
import io.github.reugn.route4j.util.RecordingRoutes;
import io.github.reugn.route4j.util.RuntimeTestHelper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * E2E integration tests for argument extraction.
 * These tests boot the generated route collections and dispatch requests to them.
 */
@DisplayName("Extraction Examples (E2E)")
class ExtractionExamplesTest {

    @Test
    @DisplayName("Path parameters - converted and passed in declaration order")
    void pathParameters() throws Exception {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Greeter",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.Controller;
                        import io.github.reugn.route4j.annotation.GET;
                        
                        @Controller
                        public class Greeter {
                            @GET({"greet", ":name", ":age"})
                            public String greet(String name, int age) {
                                return "Hello " + name + ", " + age;
                            }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        RecordingRoutes routes = helper.boot("example.Greeter");
        RecordingRoutes.Route route = routes.route(HttpMethod.GET, "/greet/:name/:age");

        Object result = route.handle(FakeRequest.get("/greet/Ann/30").pathParam("name", "Ann").pathParam("age", "30"));
        assertThat(result).isEqualTo("Hello Ann, 30");

        // Malformed required value aborts with 400
        assertThatThrownBy(() -> route.handle(FakeRequest.get("/greet/Ann/x")
                .pathParam("name", "Ann").pathParam("age", "x")))
                .isInstanceOfSatisfying(Abort.class, abort -> assertThat(abort.status()).isEqualTo(400));
    }

    @Test
    @DisplayName("Optional body - decode failure yields absence instead of an error")
    void optionalBody() throws Exception {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Library",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.Controller;
                        import io.github.reugn.route4j.annotation.POST;
                        import io.github.reugn.route4j.annotation.PUT;
                        import io.github.reugn.route4j.annotation.ReqContent;
                        import java.util.Optional;
                        
                        @Controller
                        public class Library {
                            public static class Book {
                                public final String title;
                        
                                public Book(String title) {
                                    this.title = title;
                                }
                            }
                        
                            @POST("books")
                            public String create(@ReqContent Optional<Book> book) {
                                return book.map(b -> "created " + b.title).orElse("no book");
                            }
                        
                            @PUT("books")
                            public String replace(@ReqContent Book book) {
                                return "replaced " + book.title;
                            }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        RecordingRoutes routes = helper.boot("example.Library");
        Object dune = helper.loadClass("example.Library$Book").getConstructor(String.class).newInstance("Dune");

        RecordingRoutes.Route create = routes.route(HttpMethod.POST, "/books");
        assertThat(create.handle(FakeRequest.of(HttpMethod.POST, "/books").body(dune))).isEqualTo("created Dune");

        FakeRequest malformed = FakeRequest.of(HttpMethod.POST, "/books").body("not a book");
        assertThat(create.handle(malformed)).isEqualTo("no book");
        assertThat(malformed.bodyDecodes()).isEqualTo(1);

        // Required body still fails the request
        RecordingRoutes.Route replace = routes.route(HttpMethod.PUT, "/books");
        assertThat(replace.handle(FakeRequest.of(HttpMethod.PUT, "/books").body(dune))).isEqualTo("replaced Dune");
        assertThatThrownBy(() -> replace.handle(FakeRequest.of(HttpMethod.PUT, "/books").body("not a book")))
                .isInstanceOfSatisfying(Abort.class, abort -> assertThat(abort.status()).isEqualTo(400));
    }

    @Test
    @DisplayName("Query defaults - absent and malformed values fall back")
    void queryDefaults() throws Exception {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Search",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.*;
                        import java.util.Optional;
                        
                        @Controller
                        public class Search {
                            public static int pageFactoryCalls;
                        
                            static int firstPage() {
                                pageFactoryCalls++;
                                return 1;
                            }
                        
                            @GET("search")
                            public String search(@QueryParam("q") String query,
                                                 @QueryParam @DefaultValue("10") int limit,
                                                 @QueryParam @DefaultFactory("firstPage") int page,
                                                 @QueryParam Optional<String> sort) {
                                return query + " limit=" + limit + " page=" + page + " sort=" + sort.orElse("-");
                            }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        RecordingRoutes.Route route = helper.boot("example.Search").route(HttpMethod.GET, "/search");

        assertThat(route.handle(FakeRequest.get("/search").queryParam("q", "java")))
                .isEqualTo("java limit=10 page=1 sort=-");
        assertThat(helper.getStaticField("example.Search", "pageFactoryCalls")).isEqualTo(1);

        // Factory only runs when the value is absent
        assertThat(route.handle(FakeRequest.get("/search").queryParam("q", "java")
                .queryParam("limit", "abc").queryParam("page", "3").queryParam("sort", "title")))
                .isEqualTo("java limit=10 page=3 sort=title");
        assertThat(helper.getStaticField("example.Search", "pageFactoryCalls")).isEqualTo(1);

        assertThatThrownBy(() -> route.handle(FakeRequest.get("/search")))
                .isInstanceOfSatisfying(Abort.class, abort -> assertThat(abort.status()).isEqualTo(400))
                .hasMessageContaining("'q'");
    }

    @Test
    @DisplayName("Authenticated principal - required aborts with 401, optional is empty")
    void authContent() throws Exception {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Account",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.*;
                        import java.util.Optional;
                        
                        @Controller
                        public class Account {
                            @GET("me")
                            public String me(@AuthContent String user) {
                                return "user " + user;
                            }
                        
                            @GET("hello")
                            public String hello(@AuthContent Optional<String> user) {
                                return "hello " + user.orElse("guest");
                            }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        RecordingRoutes routes = helper.boot("example.Account");

        assertThat(routes.route(HttpMethod.GET, "/me").handle(FakeRequest.get("/me").login("ann")))
                .isEqualTo("user ann");
        assertThatThrownBy(() -> routes.route(HttpMethod.GET, "/me").handle(FakeRequest.get("/me")))
                .isInstanceOfSatisfying(Abort.class, abort -> assertThat(abort.status()).isEqualTo(401));

        assertThat(routes.route(HttpMethod.GET, "/hello").handle(FakeRequest.get("/hello")))
                .isEqualTo("hello guest");
    }

    @Test
    @DisplayName("Request projections - raw request and accessor paths")
    void requestProjections() throws Exception {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Echo",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.*;
                        import io.github.reugn.route4j.runtime.Request;
                        
                        @Controller
                        public class Echo {
                            @EndPoint(method = "PATCH", path = "echo")
                            public String echo(@Req Request request, @Req("url") String url,
                                               @RequestField("method.name") String verb) {
                                return verb + " " + url + " " + (request.url() == url);
                            }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        RecordingRoutes routes = helper.boot("example.Echo");

        Object result = routes.route(HttpMethod.PATCH, "/echo").handle(FakeRequest.of(HttpMethod.PATCH, "/echo"));
        assertThat(result).isEqualTo("PATCH /echo true");
    }

    @Test
    @DisplayName("Whole query content - decoded as the parameter type")
    void queryContent() throws Exception {
        JavaFileObject source = JavaFileObjects.forSourceString("example.Reports",
                """
                        package example;
                        
                        import io.github.reugn.route4j.annotation.*;
                        import java.util.Map;
                        
                        @Controller
                        public class Reports {
                            @GET("reports")
                            public String reports(@QueryContent Map<String, String> filter) {
                                return "filter " + filter.get("year");
                            }
                        }
                        """);

        RuntimeTestHelper helper = RuntimeTestHelper.compile(source);
        RecordingRoutes routes = helper.boot("example.Reports");

        Object result = routes.route(HttpMethod.GET, "/reports")
                .handle(FakeRequest.get("/reports").queryContent(java.util.Map.of("year", "2024")));
        assertThat(result).isEqualTo("filter 2024");
    }
}
