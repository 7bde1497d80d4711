package in.civicdesk.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.civicdesk.auth.AuthService;
import in.civicdesk.auth.JwtAuthenticator;
import in.civicdesk.auth.PasswordHasher;
import in.civicdesk.metrics.PrometheusIssueMetrics;
import in.civicdesk.repository.InMemoryIssueRepository;
import in.civicdesk.repository.InMemoryUserRepository;
import in.civicdesk.service.classification.DefaultIssueClassifier;
import in.civicdesk.service.issue.IssueLifecycleService;
import in.civicdesk.service.media.SizeHeuristicMediaGate;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the HTTP API against a live Undertow listener.
 */
@DisplayName("HTTP API Tests")
public class ApiHandlersTest {

    private static final int TEST_PORT = 19091;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Undertow server;
    private HttpClient httpClient;
    private InMemoryIssueRepository issueRepo;
    private List<String> accessLines;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.systemUTC();
        CollectorRegistry registry = new CollectorRegistry();
        PrometheusIssueMetrics metrics = new PrometheusIssueMetrics(registry);

        issueRepo = new InMemoryIssueRepository();
        AuthService authService = new AuthService(new InMemoryUserRepository(),
            new JwtAuthenticator("test-secret", Duration.ZERO, clock), new PasswordHasher(), metrics, clock);
        IssueLifecycleService issueService = new IssueLifecycleService(
            issueRepo, new SizeHeuristicMediaGate(), metrics, clock);
        ApiHandlers api = new ApiHandlers(authService, issueService, new DefaultIssueClassifier());

        accessLines = new CopyOnWriteArrayList<>();
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setServerOption(UndertowOptions.RECORD_REQUEST_START_TIME, true)
            .setHandler(ApiRoutes.build(api, new PrometheusMetricsHandler(registry), accessLines::add))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    private HttpResponse<String> send(String method, String path, String body, String... headers) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .timeout(Duration.ofSeconds(10))
            .method(method, body != null
                ? HttpRequest.BodyPublishers.ofString(body)
                : HttpRequest.BodyPublishers.noBody());
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        if (headers.length > 0) {
            builder.headers(headers);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    private static String photo(int bytes) {
        return "{\"type\":\"photo\",\"data\":\"data:image/jpeg;base64,"
            + Base64.getEncoder().encodeToString(new byte[bytes]) + "\"}";
    }

    private String signupToken(String email) throws Exception {
        HttpResponse<String> response = send("POST", "/auth/signup",
            "{\"email\":\"" + email + "\",\"password\":\"pw-123\",\"role\":\"User\"}");
        assertEquals(200, response.statusCode(), response.body());
        return json(response).get("token").asText();
    }

    private JsonNode createIssue(String token, String body) throws Exception {
        HttpResponse<String> response = send("POST", "/issues", body, "Authorization", "Bearer " + token);
        assertEquals(200, response.statusCode(), response.body());
        return json(response).get("issue");
    }

    // ═══════════════════════════════════════════════════════════════
    // Tests
    // ═══════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Health check answers ok")
    public void testHealth() throws Exception {
        HttpResponse<String> response = send("GET", "/health", null);

        assertEquals(200, response.statusCode());
        assertEquals("ok", json(response).get("status").asText());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("application/json"));
    }

    @Test
    @DisplayName("Signup and login return a token and the public user view")
    public void testSignupAndLogin() throws Exception {
        HttpResponse<String> signup = send("POST", "/auth/signup",
            "{\"aadhaar\":\"1234-5678-9012\",\"password\":\"pw\",\"role\":\"User\",\"language\":\"hi\"}");
        assertEquals(200, signup.statusCode(), signup.body());
        JsonNode user = json(signup).get("user");
        assertEquals("1234-5678-9012", user.get("nationalId").asText());
        assertEquals("User", user.get("role").asText());
        assertEquals("hi", user.get("language").asText());
        assertFalse(signup.body().contains("password"));

        HttpResponse<String> login = send("POST", "/auth/login",
            "{\"identifier\":\"1234-5678-9012\",\"password\":\"pw\"}");
        assertEquals(200, login.statusCode(), login.body());
        assertEquals(user.get("id").asText(), json(login).get("user").get("id").asText());
        assertFalse(json(login).get("token").asText().isEmpty());
    }

    @Test
    @DisplayName("Signup validation and duplicate identifiers answer 400")
    public void testSignupErrors() throws Exception {
        signupToken("citizen@example.com");

        HttpResponse<String> duplicate = send("POST", "/auth/signup",
            "{\"email\":\"citizen@example.com\",\"password\":\"x\",\"role\":\"User\"}");
        HttpResponse<String> missing = send("POST", "/auth/signup", "{\"password\":\"x\",\"role\":\"User\"}");

        assertEquals(400, duplicate.statusCode());
        assertEquals("Email already registered", json(duplicate).get("error").asText());
        assertEquals(400, missing.statusCode());
    }

    @Test
    @DisplayName("Bad credentials answer 401")
    public void testLoginRejected() throws Exception {
        signupToken("citizen@example.com");

        HttpResponse<String> response = send("POST", "/auth/login",
            "{\"identifier\":\"citizen@example.com\",\"password\":\"wrong\"}");

        assertEquals(401, response.statusCode());
        assertEquals("Invalid credentials", json(response).get("error").asText());
    }

    @Test
    @DisplayName("Creating an issue requires a valid token")
    public void testCreateRequiresToken() throws Exception {
        String body = "{\"description\":\"Pothole\",\"priority\":\"Medium\"}";

        HttpResponse<String> none = send("POST", "/issues", body);
        HttpResponse<String> garbage = send("POST", "/issues", body, "Authorization", "Bearer nope");

        assertEquals(401, none.statusCode());
        assertEquals(401, garbage.statusCode());
        assertEquals(0, issueRepo.count());
    }

    @Test
    @DisplayName("Issue without media is Spam, with a large photo Reported")
    public void testCreateIssue() throws Exception {
        String token = signupToken("citizen@example.com");

        JsonNode spam = createIssue(token, "{\"description\":\"Pothole on Main St\",\"priority\":\"Medium\"}");
        JsonNode reported = createIssue(token, "{\"description\":\"Broken light\",\"priority\":\"High\","
            + "\"category\":\"Streetlight\",\"emergency\":true,\"location\":{\"lat\":12.9,\"lng\":77.6},"
            + "\"media\":" + photo(50_000) + "}");

        assertEquals("Spam", spam.get("status").asText());
        assertEquals("Other", spam.get("category").asText());
        assertTrue(spam.get("location").isNull());
        assertEquals("Reported", reported.get("status").asText());
        assertEquals("High", reported.get("priority").asText());
        assertTrue(reported.get("emergency").asBoolean());
        assertEquals(77.6, reported.get("location").get("lng").asDouble());
        assertEquals(reported.get("createdAt").asLong(), reported.get("updatedAt").asLong());
    }

    @Test
    @DisplayName("Legacy token header is accepted")
    public void testLegacyTokenHeader() throws Exception {
        String token = signupToken("citizen@example.com");

        HttpResponse<String> response = send("POST", "/issues",
            "{\"description\":\"Graffiti\",\"priority\":\"Low\"}", "token", token);

        assertEquals(200, response.statusCode(), response.body());
    }

    @Test
    @DisplayName("Invalid issue payloads answer 400")
    public void testCreateValidation() throws Exception {
        String token = signupToken("citizen@example.com");
        String auth = "Bearer " + token;

        HttpResponse<String> noDescription = send("POST", "/issues", "{\"priority\":\"Low\"}", "Authorization", auth);
        HttpResponse<String> badPriority = send("POST", "/issues",
            "{\"description\":\"x\",\"priority\":\"Urgent\"}", "Authorization", auth);
        HttpResponse<String> halfLocation = send("POST", "/issues",
            "{\"description\":\"x\",\"priority\":\"Low\",\"location\":{\"lat\":1.0}}", "Authorization", auth);
        HttpResponse<String> malformed = send("POST", "/issues", "{not json", "Authorization", auth);

        assertEquals(400, noDescription.statusCode());
        assertEquals("description and priority are required", json(noDescription).get("error").asText());
        assertEquals(400, badPriority.statusCode());
        assertEquals(400, halfLocation.statusCode());
        assertEquals(400, malformed.statusCode());
        assertEquals("Invalid request", json(malformed).get("error").asText());
        assertEquals(0, issueRepo.count());
    }

    @Test
    @DisplayName("Listing returns newest first and filters by status")
    public void testListIssues() throws Exception {
        String token = signupToken("citizen@example.com");
        String first = createIssue(token, "{\"description\":\"first\",\"priority\":\"Low\"}").get("id").asText();
        String second = createIssue(token, "{\"description\":\"second\",\"priority\":\"Low\",\"media\":"
            + photo(10_000) + "}").get("id").asText();

        JsonNode all = json(send("GET", "/issues", null)).get("issues");
        JsonNode spam = json(send("GET", "/issues?status=Spam", null)).get("issues");
        HttpResponse<String> badStatus = send("GET", "/issues?status=Closed", null);
        JsonNode ignoredBound = json(send("GET", "/issues?from=yesterday", null)).get("issues");

        assertEquals(2, all.size());
        assertEquals(second, all.get(0).get("id").asText());
        assertEquals(first, all.get(1).get("id").asText());
        assertEquals(1, spam.size());
        assertEquals(first, spam.get(0).get("id").asText());
        assertEquals(400, badStatus.statusCode());
        assertEquals(2, ignoredBound.size());
    }

    @Test
    @DisplayName("Single issue lookup answers 404 for unknown ids")
    public void testGetIssue() throws Exception {
        String token = signupToken("citizen@example.com");
        String id = createIssue(token, "{\"description\":\"x\",\"priority\":\"Low\"}").get("id").asText();

        HttpResponse<String> found = send("GET", "/issues/" + id, null);
        HttpResponse<String> missing = send("GET", "/issues/xyz", null);

        assertEquals(200, found.statusCode());
        assertEquals(id, json(found).get("issue").get("id").asText());
        assertEquals(404, missing.statusCode());
        assertEquals("Issue not found", json(missing).get("error").asText());
    }

    @Test
    @DisplayName("PATCH updates only supplied fields")
    public void testPatchIssue() throws Exception {
        String token = signupToken("citizen@example.com");
        String id = createIssue(token, "{\"description\":\"x\",\"priority\":\"Low\"}").get("id").asText();

        HttpResponse<String> assigned = send("PATCH", "/issues/" + id,
            "{\"status\":\"Assigned\",\"department\":\"Roads\"}");
        assertEquals(200, assigned.statusCode(), assigned.body());
        JsonNode issue = json(assigned).get("issue");
        assertEquals("Assigned", issue.get("status").asText());
        assertEquals("Roads", issue.get("department").asText());
        assertEquals("Low", issue.get("priority").asText());

        JsonNode cleared = json(send("PATCH", "/issues/" + id, "{\"department\":null}")).get("issue");
        assertTrue(cleared.get("department").isNull());
        assertEquals("Assigned", cleared.get("status").asText());
    }

    @Test
    @DisplayName("PATCH of an unknown issue answers 404 and creates nothing")
    public void testPatchUnknown() throws Exception {
        HttpResponse<String> response = send("PATCH", "/issues/xyz", "{\"status\":\"Resolved\"}");

        assertEquals(404, response.statusCode());
        assertEquals(0, issueRepo.count());
        assertEquals(0, json(send("GET", "/issues", null)).get("issues").size());
    }

    @Test
    @DisplayName("Verify reports the gate decision and a category")
    public void testVerify() throws Exception {
        JsonNode accepted = json(send("POST", "/verify", "{\"media\":" + photo(20_000) + "}"));
        JsonNode small = json(send("POST", "/verify", "{\"media\":" + photo(100) + "}"));
        JsonNode none = json(send("POST", "/verify", "{}"));

        assertTrue(accepted.get("accepted").asBoolean());
        assertFalse(accepted.has("reason"));
        assertEquals("Other", accepted.get("category").asText());
        assertFalse(small.get("accepted").asBoolean());
        assertEquals("image too small", small.get("reason").asText());
        assertEquals("no media", none.get("reason").asText());
        assertEquals(0, issueRepo.count());
    }

    @Test
    @DisplayName("Unknown routes answer 404, preflight answers 200 with CORS headers")
    public void testRoutingAndCors() throws Exception {
        HttpResponse<String> unknown = send("GET", "/nope", null);
        HttpResponse<String> preflight = send("OPTIONS", "/issues", null);

        assertEquals(404, unknown.statusCode());
        assertEquals(200, preflight.statusCode());
        assertEquals("*", preflight.headers().firstValue("Access-Control-Allow-Origin").orElse(""));
        assertTrue(preflight.headers().firstValue("Access-Control-Allow-Methods").orElse("").contains("PATCH"));
        assertEquals("*", unknown.headers().firstValue("Access-Control-Allow-Origin").orElse(""));
    }

    @Test
    @DisplayName("Metrics endpoint exposes intake counters")
    public void testMetrics() throws Exception {
        String token = signupToken("citizen@example.com");
        createIssue(token, "{\"description\":\"x\",\"priority\":\"Low\"}");
        send("POST", "/auth/login", "{\"identifier\":\"citizen@example.com\",\"password\":\"bad\"}");

        HttpResponse<String> response = send("GET", "/metrics", null);

        assertEquals(200, response.statusCode());
        String body = response.body();
        assertTrue(body.contains("civicdesk_issues_created_total{status=\"Spam\",} 1.0"), body);
        assertTrue(body.contains("civicdesk_media_rejections_total{reason=\"no media\",} 1.0"), body);
        assertTrue(body.contains("civicdesk_auth_failures_total{op=\"login\",} 1.0"), body);
    }

    @Test
    @DisplayName("Malformed media goes through the gate instead of failing the request")
    public void testVerifyMalformedMedia() throws Exception {
        HttpResponse<String> untyped = send("POST", "/verify", "{\"media\":{\"data\":\"AAAA\"}}");
        HttpResponse<String> unknownType = send("POST", "/verify",
            "{\"media\":{\"type\":\"image\",\"data\":\"AAAA\"}}");
        HttpResponse<String> notAnObject = send("POST", "/verify", "{\"media\":\"abc\"}");
        HttpResponse<String> noPayload = send("POST", "/verify", "{\"media\":{\"type\":\"photo\"}}");

        assertEquals(200, untyped.statusCode(), untyped.body());
        assertTrue(json(untyped).get("accepted").asBoolean());
        assertEquals(200, unknownType.statusCode(), unknownType.body());
        assertTrue(json(unknownType).get("accepted").asBoolean());
        assertEquals(200, notAnObject.statusCode(), notAnObject.body());
        assertFalse(json(notAnObject).get("accepted").asBoolean());
        assertEquals("invalid media data", json(notAnObject).get("reason").asText());
        assertEquals(200, noPayload.statusCode(), noPayload.body());
        assertEquals("invalid media data", json(noPayload).get("reason").asText());
    }

    @Test
    @DisplayName("Issues with malformed media are stored, not refused")
    public void testCreateWithMalformedMedia() throws Exception {
        String token = signupToken("citizen@example.com");

        JsonNode unknownType = createIssue(token, "{\"description\":\"x\",\"priority\":\"Low\","
            + "\"media\":{\"type\":\"image\",\"data\":\"AAAA\"}}");
        JsonNode notAnObject = createIssue(token,
            "{\"description\":\"y\",\"priority\":\"Low\",\"media\":\"abc\"}");

        assertEquals("Reported", unknownType.get("status").asText());
        assertEquals("image", unknownType.get("media").get("type").asText());
        assertEquals("Spam", notAnObject.get("status").asText());
        assertEquals(2, issueRepo.count());
    }

    @Test
    @DisplayName("Bearer scheme is matched in any letter case")
    public void testLowercaseBearer() throws Exception {
        String token = signupToken("citizen@example.com");

        HttpResponse<String> response = send("POST", "/issues",
            "{\"description\":\"x\",\"priority\":\"Low\"}", "Authorization", "bearer " + token);

        assertEquals(200, response.statusCode(), response.body());
    }

    @Test
    @DisplayName("Metrics can be narrowed to named families")
    public void testMetricsNameFilter() throws Exception {
        String token = signupToken("citizen@example.com");
        createIssue(token, "{\"description\":\"x\",\"priority\":\"Low\"}");

        HttpResponse<String> response = send("GET",
            "/metrics?name%5B%5D=civicdesk_issues_created_total", null);

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("civicdesk_issues_created_total"), response.body());
        assertFalse(response.body().contains("civicdesk_media_rejections_total"), response.body());
    }

    @Test
    @DisplayName("Every request is written to the access log")
    public void testAccessLog() throws Exception {
        send("GET", "/health", null);
        send("GET", "/issues/xyz?verbose=1", null);

        long deadline = System.currentTimeMillis() + 5_000;
        while (accessLines.size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertEquals(2, accessLines.size(), accessLines.toString());
        assertTrue(accessLines.stream().anyMatch(line -> line.startsWith("GET /health 200 ")),
            accessLines.toString());
        assertTrue(accessLines.stream().anyMatch(line -> line.startsWith("GET /issues/xyz?verbose=1 404 ")),
            accessLines.toString());
    }
}
