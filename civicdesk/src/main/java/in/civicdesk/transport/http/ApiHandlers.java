package in.civicdesk.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.civicdesk.auth.AuthService;
import in.civicdesk.domain.common.AuthenticationException;
import in.civicdesk.domain.common.IssueNotFoundException;
import in.civicdesk.domain.common.ValidationException;
import in.civicdesk.domain.issue.Issue;
import in.civicdesk.domain.issue.IssueFilter;
import in.civicdesk.domain.issue.IssueStatus;
import in.civicdesk.domain.issue.Media;
import in.civicdesk.domain.issue.Priority;
import in.civicdesk.service.classification.IssueCategories;
import in.civicdesk.service.classification.IssueClassifier;
import in.civicdesk.service.issue.IssueLifecycleService;
import in.civicdesk.service.media.MediaAssessment;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Deque;

/**
 * HTTP API handlers.
 *
 * Error mapping:
 * - ValidationException / malformed JSON → 400
 * - AuthenticationException → 401
 * - IssueNotFoundException → 404
 * - anything else → 500
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";
    private static final String JSON_ERROR = "error";
    private static final String TOKEN_HEADER = "token";

    private final AuthService authService;
    private final IssueLifecycleService issueService;
    private final IssueClassifier classifier;

    public ApiHandlers(AuthService authService, IssueLifecycleService issueService, IssueClassifier classifier) {
        this.authService = authService;
        this.issueService = issueService;
        this.classifier = classifier;
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());
        send(exchange, 200, health);
    }

    /**
     * POST /auth/signup - {email | aadhaar | nationalId, password, role, language?}
     */
    public void signup(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> respond(ex, () -> {
            JsonNode json = parseObject(body);
            String nationalId = IssueJson.text(json, "nationalId");
            if (nationalId == null) {
                nationalId = IssueJson.text(json, "aadhaar");
            }
            AuthService.AuthResult result = authService.signup(new AuthService.SignupRequest(
                IssueJson.text(json, "email"),
                nationalId,
                IssueJson.text(json, "password"),
                IssueJson.text(json, "role"),
                IssueJson.text(json, "language")
            ));
            return authResponse(result);
        }), StandardCharsets.UTF_8);
    }

    /**
     * POST /auth/login - {identifier, password}
     */
    public void login(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> respond(ex, () -> {
            JsonNode json = parseObject(body);
            AuthService.AuthResult result = authService.login(
                IssueJson.text(json, "identifier"),
                IssueJson.text(json, "password"));
            return authResponse(result);
        }), StandardCharsets.UTF_8);
    }

    /**
     * POST /verify - {media}. Runs the authenticity gate and suggests a category.
     */
    public void verify(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> respond(ex, () -> {
            JsonNode json = parseObject(body);
            Media media = IssueJson.media(json.get("media"));
            MediaAssessment assessment = issueService.assessMedia(media);

            ObjectNode response = MAPPER.createObjectNode();
            response.put("accepted", assessment.accepted());
            if (assessment.reason() != null) {
                response.put("reason", assessment.reason());
            }
            response.put("category", media != null
                ? IssueCategories.normalize(classifier.classify(media))
                : IssueCategories.OTHER);
            return response;
        }), StandardCharsets.UTF_8);
    }

    /**
     * GET /issues?category=&status=&priority=&from=&to= (from/to in epoch millis)
     */
    public void listIssues(HttpServerExchange exchange) {
        respond(exchange, () -> {
            String status = queryParam(exchange, "status");
            String priority = queryParam(exchange, "priority");
            IssueFilter filter = new IssueFilter(
                queryParam(exchange, "category"),
                status != null ? IssueStatus.fromWire(status) : null,
                priority != null ? Priority.fromWire(priority) : null,
                epochMillisParam(exchange, "from"),
                epochMillisParam(exchange, "to")
            );

            ObjectNode response = MAPPER.createObjectNode();
            ArrayNode issues = response.putArray("issues");
            for (Issue issue : issueService.list(filter)) {
                issues.add(IssueJson.issue(MAPPER, issue));
            }
            return response;
        });
    }

    /**
     * GET /issues/{id}
     */
    public void getIssue(HttpServerExchange exchange) {
        respond(exchange, () -> {
            Issue issue = issueService.get(queryParam(exchange, "id"));
            return issueResponse(issue);
        });
    }

    /**
     * POST /issues - requires a bearer token.
     */
    public void createIssue(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> respond(ex, () -> {
            String userId = authService.resolve(extractToken(ex));
            JsonNode json = parseObject(body);
            Issue issue = issueService.create(userId, IssueJson.newIssue(json));
            return issueResponse(issue);
        }), StandardCharsets.UTF_8);
    }

    /**
     * PATCH /issues/{id} - {status?, department?, priority?}
     *
     * No authentication: operators are trusted at this layer.
     */
    public void updateIssue(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> respond(ex, () -> {
            String issueId = queryParam(ex, "id");
            JsonNode json = parseObject(body);
            Issue issue = issueService.updateStatus(issueId, IssueJson.update(json));
            return issueResponse(issue);
        }), StandardCharsets.UTF_8);
    }

    /**
     * Fallback for unknown routes.
     */
    public void notFound(HttpServerExchange exchange) {
        sendError(exchange, 404, "Not found");
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    @FunctionalInterface
    private interface JsonAction {
        ObjectNode run() throws Exception;
    }

    private void respond(HttpServerExchange exchange, JsonAction action) {
        try {
            send(exchange, 200, action.run());
        } catch (ValidationException e) {
            sendError(exchange, 400, e.getMessage());
        } catch (JsonProcessingException e) {
            log.debug("Malformed JSON body: {}", e.getOriginalMessage());
            sendError(exchange, 400, "Invalid request");
        } catch (AuthenticationException e) {
            sendError(exchange, 401, e.getMessage());
        } catch (IssueNotFoundException e) {
            sendError(exchange, 404, "Issue not found");
        } catch (Exception e) {
            log.error("Error handling {} {}: {}", exchange.getRequestMethod(), exchange.getRequestPath(),
                e.getMessage(), e);
            sendError(exchange, 500, "Internal error");
        }
    }

    private ObjectNode authResponse(AuthService.AuthResult result) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("token", result.token());
        response.set("user", IssueJson.user(MAPPER, result.user()));
        return response;
    }

    private ObjectNode issueResponse(Issue issue) {
        ObjectNode response = MAPPER.createObjectNode();
        response.set("issue", IssueJson.issue(MAPPER, issue));
        return response;
    }

    private static JsonNode parseObject(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return MAPPER.createObjectNode();
        }
        JsonNode json = MAPPER.readTree(body);
        if (!json.isObject()) {
            throw new ValidationException("Request body must be a JSON object");
        }
        return json;
    }

    private static String extractToken(HttpServerExchange exchange) {
        // Authorization: Bearer <token>, or the legacy "token" header
        String authHeader = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (authHeader != null && !authHeader.isBlank()) {
            return authHeader;
        }
        return exchange.getRequestHeaders().getFirst(TOKEN_HEADER);
    }

    private static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.peekFirst();
        return value == null || value.isBlank() ? null : value;
    }

    private static Instant epochMillisParam(HttpServerExchange exchange, String name) {
        String value = queryParam(exchange, name);
        if (value == null) {
            return null;
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {} filter: {}", name, value);
            return null;
        }
    }

    private static void send(HttpServerExchange exchange, int status, ObjectNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private static void sendError(HttpServerExchange exchange, int status, String message) {
        ObjectNode error = MAPPER.createObjectNode();
        error.put(JSON_ERROR, message);
        send(exchange, status, error);
    }
}
