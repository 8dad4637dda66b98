package io.github.reugn.route4j.util;

import io.github.reugn.route4j.runtime.Abort;
import io.github.reugn.route4j.runtime.AuthContainer;
import io.github.reugn.route4j.runtime.ContentContainer;
import io.github.reugn.route4j.runtime.HttpMethod;
import io.github.reugn.route4j.runtime.Parameters;
import io.github.reugn.route4j.runtime.QueryContainer;
import io.github.reugn.route4j.runtime.Request;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link Request} test double.
 *
 * <p>Path and query values are strings converted on lookup to {@code String}, {@code Integer},
 * {@code Long}, {@code Double} or {@code Boolean}. The body and the decoded query are objects
 * handed out as-is when their type matches; any mismatch fails like a decode error.
 */
public final class FakeRequest implements Request {

    private final HttpMethod method;
    private final String url;
    private final Map<String, String> pathParameters = new HashMap<>();
    private final Map<String, String> queryParameters = new HashMap<>();
    private final List<Object> principals = new ArrayList<>();
    private Object body;
    private Object queryContent;
    private int bodyDecodes;

    private FakeRequest(HttpMethod method, String url) {
        this.method = method;
        this.url = url;
    }

    public static FakeRequest of(HttpMethod method, String url) {
        return new FakeRequest(method, url);
    }

    public static FakeRequest get(String url) {
        return of(HttpMethod.GET, url);
    }

    public FakeRequest pathParam(String name, String value) {
        pathParameters.put(name, value);
        return this;
    }

    public FakeRequest queryParam(String key, String value) {
        queryParameters.put(key, value);
        return this;
    }

    public FakeRequest body(Object body) {
        this.body = body;
        return this;
    }

    public FakeRequest queryContent(Object queryContent) {
        this.queryContent = queryContent;
        return this;
    }

    public FakeRequest login(Object principal) {
        principals.add(principal);
        return this;
    }

    /**
     * Returns how many times the body was decoded.
     */
    public int bodyDecodes() {
        return bodyDecodes;
    }

    @Override
    public HttpMethod method() {
        return method;
    }

    @Override
    public String url() {
        return url;
    }

    @Override
    public Parameters parameters() {
        return new Parameters() {
            @Override
            public <T> Optional<T> get(String name, Class<T> type) {
                return lookup(pathParameters, name, type);
            }

            @Override
            public <T> T require(String name, Class<T> type) {
                return lookup(pathParameters, name, type)
                        .orElseThrow(() -> Abort.badRequest("Missing or invalid path parameter '" + name + "'"));
            }
        };
    }

    @Override
    public ContentContainer content() {
        return new ContentContainer() {
            @Override
            public <T> T decode(Class<T> type) {
                bodyDecodes++;
                if (!type.isInstance(body)) {
                    throw Abort.badRequest("Cannot decode body as " + type.getSimpleName());
                }
                return type.cast(body);
            }
        };
    }

    @Override
    public QueryContainer query() {
        return new QueryContainer() {
            @Override
            public <T> T decode(Class<T> type) {
                if (!type.isInstance(queryContent)) {
                    throw Abort.badRequest("Cannot decode query as " + type.getSimpleName());
                }
                return type.cast(queryContent);
            }

            @Override
            public <T> Optional<T> get(String key, Class<T> type) {
                return lookup(queryParameters, key, type);
            }

            @Override
            public <T> T require(String key, Class<T> type) {
                return lookup(queryParameters, key, type)
                        .orElseThrow(() -> Abort.badRequest("Missing or invalid query parameter '" + key + "'"));
            }
        };
    }

    @Override
    public AuthContainer auth() {
        return new AuthContainer() {
            @Override
            public <T> Optional<T> get(Class<T> type) {
                return principals.stream().filter(type::isInstance).map(type::cast).findFirst();
            }

            @Override
            public <T> T require(Class<T> type) {
                return get(type).orElseThrow(() -> Abort.unauthorized("Not authenticated as " + type.getSimpleName()));
            }
        };
    }

    private static <T> Optional<T> lookup(Map<String, String> values, String key, Class<T> type) {
        String raw = values.get(key);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            Object converted;
            if (type == String.class) {
                converted = raw;
            } else if (type == Integer.class) {
                converted = Integer.valueOf(raw);
            } else if (type == Long.class) {
                converted = Long.valueOf(raw);
            } else if (type == Double.class) {
                converted = Double.valueOf(raw);
            } else if (type == Boolean.class) {
                converted = Boolean.valueOf(raw);
            } else {
                return Optional.empty();
            }
            return Optional.of(type.cast(converted));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
