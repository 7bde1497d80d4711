package in.civicdesk.transport.http;

import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.accesslog.AccessLogHandler;
import io.undertow.server.handlers.accesslog.AccessLogReceiver;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Route table for the HTTP API, wrapped in a permissive CORS handler and an
 * access log ("GET /issues?status=Spam 200 3 ms - 512").
 *
 * The response time needs {@link io.undertow.UndertowOptions#RECORD_REQUEST_START_TIME};
 * without it the field reads "-".
 */
public final class ApiRoutes {
    private static final Logger accessLog = LoggerFactory.getLogger("in.civicdesk.access");

    static final String ACCESS_LOG_FORMAT = "%m %U%q %s %D ms - %b";

    private static final HttpString ALLOW_ORIGIN = HttpString.tryFromString("Access-Control-Allow-Origin");
    private static final HttpString ALLOW_METHODS = HttpString.tryFromString("Access-Control-Allow-Methods");
    private static final HttpString ALLOW_HEADERS = HttpString.tryFromString("Access-Control-Allow-Headers");
    private static final HttpString MAX_AGE = HttpString.tryFromString("Access-Control-Max-Age");

    private ApiRoutes() {}

    public static HttpHandler build(ApiHandlers api, HttpHandler metricsHandler) {
        return build(api, metricsHandler, accessLog::info);
    }

    public static HttpHandler build(ApiHandlers api, HttpHandler metricsHandler, AccessLogReceiver receiver) {
        RoutingHandler routes = Handlers.routing()
            .get("/health", api::health)
            .post("/auth/signup", api::signup)
            .post("/auth/login", api::login)
            .post("/verify", api::verify)
            .get("/issues", api::listIssues)
            .post("/issues", api::createIssue)
            .get("/issues/{id}", api::getIssue)
            .add(Methods.PATCH, "/issues/{id}", api::updateIssue)
            .get("/metrics", metricsHandler)
            .setFallbackHandler(api::notFound);

        HttpHandler cors = new HttpHandler() {
            @Override
            public void handleRequest(HttpServerExchange exchange) throws Exception {
                // handlers run on worker threads
                if (exchange.isInIoThread()) {
                    exchange.dispatch(this);
                    return;
                }
                exchange.getResponseHeaders()
                    .put(ALLOW_ORIGIN, "*")
                    .put(ALLOW_METHODS, "GET, POST, PATCH, OPTIONS")
                    .put(ALLOW_HEADERS, "Content-Type, Authorization, token")
                    .put(MAX_AGE, "3600");

                if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
                    exchange.setStatusCode(200);
                    exchange.endExchange();
                } else {
                    routes.handleRequest(exchange);
                }
            }
        };
        return new AccessLogHandler(cors, receiver, ACCESS_LOG_FORMAT, ApiRoutes.class.getClassLoader());
    }
}
