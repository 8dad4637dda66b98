package io.github.reugn.route4j.processor;

import com.google.testing.compile.Compilation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static io.github.reugn.route4j.processor.SourceClassificationTest.controller;
import static io.github.reugn.route4j.util.CompileHelper.compile;

/**
 * Tests for the extraction generated for optional parameters and parameters with defaults.
 * <p>
 * Covers:
 * <ul>
 *   <li>Required, optional and defaulted query parameters</li>
 *   <li>Best-effort body and query decoding</li>
 *   <li>Literal, field, factory and enum defaults</li>
 *   <li>Parameterized value types</li>
 *   <li>Default validation errors</li>
 * </ul>
 */
@DisplayName("Default/Optional Matrix")
class DefaultOptionalMatrixTest {

    @Nested
    @DisplayName("Query Parameter")
    class QueryParameter {

        @Test
        @DisplayName("Non-optional without default requires the value")
        void required() {
            Compilation compilation = compile(controller("""
                        @GET("x")
                        public String x(@QueryParam int limit) { return "" + limit; }
                    """));

            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains("int limit = request.query().require(\"limit\", Integer.class);");
        }

        @Test
        @DisplayName("Optional without default fetches best-effort")
        void optional() {
            Compilation compilation = compile(controller("""
                        @GET("x")
                        public String x(@QueryParam Optional<Integer> limit) { return "" + limit; }
                    """));

            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains("Optional<Integer> limit = request.query().get(\"limit\", Integer.class);");
        }

        @Test
        @DisplayName("Default falls back to the literal")
        void withDefault() {
            Compilation compilation = compile(controller("""
                        @GET("x")
                        public String x(@QueryParam @DefaultValue("10") int limit) { return "" + limit; }
                    """));

            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains("int limit = request.query().get(\"limit\", Integer.class).orElse(10);");
        }

        @Test
        @DisplayName("Optional with default stays present")
        void optionalWithDefault() {
            Compilation compilation = compile(controller("""
                        @GET("x")
                        public String x(@QueryParam @DefaultValue("10") Optional<Long> limit) { return "" + limit; }
                    """));

            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains(".get(\"limit\", Long.class).or(() -> Optional.ofNullable(10L));");
        }
    }

    @Nested
    @DisplayName("Decoded Sources")
    class DecodedSources {

        @Test
        @DisplayName("Optional body swallows decode errors")
        void optionalBody() {
            Compilation compilation = compile(controller("""
                        public static class Book { }
                    
                        @POST("books")
                        public String create(@ReqContent Optional<Book> book) { return "ok"; }
                    """));

            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains("Optional<Api.Book> book = Extraction.attempt(() -> request.content().decode(Api.Book.class));");
        }

        @Test
        @DisplayName("Query content with factory default evaluates the factory lazily")
        void queryContentWithFactory() {
            Compilation compilation = compile(controller("""
                        public record Paging(int page) { }
                    
                        static Paging firstPage() { return new Paging(1); }
                    
                        @GET("list")
                        public String list(@QueryContent @DefaultFactory("firstPage") Paging paging) { return "ok"; }
                    """));

            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains(".orElseGet(() -> test.Api.firstPage());");
        }

        @Test
        @DisplayName("Optional principal is fetched best-effort")
        void optionalPrincipal() {
            Compilation compilation = compile(controller("""
                        public record User(String name) { }
                    
                        @GET("me")
                        public String me(@AuthContent Optional<User> user) { return "ok"; }
                    """));

            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains("Optional<Api.User> user = request.auth().get(Api.User.class);");
        }
    }

    @Nested
    @DisplayName("Default Kinds")
    class DefaultKinds {

        @Test
        @DisplayName("Field reference default")
        void fieldDefault() {
            Compilation compilation = compile(controller("""
                        static final String GUEST = "guest";
                    
                        @GET("hi")
                        public String hi(@QueryParam @DefaultValue(field = "GUEST") String name) { return name; }
                    """));

            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains(".orElse(test.Api.GUEST);");
        }

        @Test
        @DisplayName("Enum constant default")
        void enumDefault() {
            Compilation compilation = compile(controller("""
                        public enum Order { ASC, DESC }
                    
                        @GET("list")
                        public String list(@QueryParam @DefaultValue("DESC") Order order) { return order.name(); }
                    """));

            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains(".orElse(Api.Order.DESC);");
        }

        @Test
        @DisplayName("String default is escaped")
        void stringDefault() {
            Compilation compilation = compile(controller("""
                        @GET("hi")
                        public String hi(@QueryParam @DefaultValue("say \\"hi\\"") String text) { return text; }
                    """));

            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains(".orElse(\"say \\\"hi\\\"\");");
        }

        @Test
        @DisplayName("Parameterized value types are cast back from their erasure")
        void parameterizedType() {
            Compilation compilation = compile(controller("""
                        @GET("tags")
                        public String tags(@QueryParam Optional<List<String>> tags) { return "" + tags; }
                    """));

            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains("request.query().get(\"tags\", List.class).map(value -> (List<String>) value);");
            assertThat(compilation).generatedSourceFile("test.ApiRoutes").contentsAsUtf8String()
                    .contains("@SuppressWarnings(\"unchecked\")");
        }
    }

    @Nested
    @DisplayName("Default Validation")
    class DefaultValidation {

        @Test
        @DisplayName("Error when a literal does not parse")
        void unparseableLiteral() {
            Compilation compilation = compile(controller("""
                        @GET("x")
                        public String x(@QueryParam @DefaultValue("ten") int limit) { return "" + limit; }
                    """));

            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("'ten' is not a valid int.");
        }

        @Test
        @DisplayName("Error when null is the default of a primitive")
        void nullForPrimitive() {
            Compilation compilation = compile(controller("""
                        @GET("x")
                        public String x(@QueryParam @DefaultValue("null") int limit) { return "" + limit; }
                    """));

            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("'null' is not a valid default for primitive type 'int'.");
        }

        @Test
        @DisplayName("Error with suggestion for a misspelled enum constant")
        void misspelledEnumConstant() {
            Compilation compilation = compile(controller("""
                        public enum Order { ASC, DESC }
                    
                        @GET("x")
                        public String x(@QueryParam @DefaultValue("DESK") Order order) { return order.name(); }
                    """));

            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Did you mean 'DESC'?");
        }

        @Test
        @DisplayName("Error when both default annotations are present")
        void bothDefaults() {
            Compilation compilation = compile(controller("""
                        static int ten() { return 10; }
                    
                        @GET("x")
                        public String x(@QueryParam @DefaultValue("1") @DefaultFactory("ten") int limit) { return "" + limit; }
                    """));

            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("cannot have both @DefaultValue and @DefaultFactory");
        }

        @Test
        @DisplayName("Error when a factory does not exist")
        void missingFactory() {
            Compilation compilation = compile(controller("""
                        static int ten() { return 10; }
                    
                        @GET("x")
                        public String x(@QueryParam @DefaultFactory("tne") int limit) { return "" + limit; }
                    """));

            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Did you mean 'ten()'?");
        }

        @Test
        @DisplayName("Error for a raw Optional parameter")
        void rawOptional() {
            Compilation compilation = compile(controller("""
                        @SuppressWarnings("rawtypes")
                        @GET("x")
                        public String x(@QueryParam Optional limit) { return "" + limit; }
                    """));

            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Parameter 'limit' is declared as a raw Optional.");
        }
    }
}
