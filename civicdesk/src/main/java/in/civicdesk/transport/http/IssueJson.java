package in.civicdesk.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.civicdesk.domain.common.ValidationException;
import in.civicdesk.domain.issue.GeoLocation;
import in.civicdesk.domain.issue.Issue;
import in.civicdesk.domain.issue.IssueStatus;
import in.civicdesk.domain.issue.IssueUpdate;
import in.civicdesk.domain.issue.Media;
import in.civicdesk.domain.issue.NewIssue;
import in.civicdesk.domain.issue.Priority;
import in.civicdesk.domain.user.User;

/**
 * JSON mapping for the HTTP API. Timestamps are epoch milliseconds,
 * enums use their wire names.
 */
final class IssueJson {

    private IssueJson() {}

    static ObjectNode issue(ObjectMapper mapper, Issue issue) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", issue.id());
        node.put("userId", issue.userId());
        node.put("category", issue.category());
        node.put("description", issue.description());
        node.put("priority", issue.priority().wireName());
        node.put("emergency", issue.emergency());
        node.put("status", issue.status().wireName());
        node.put("department", issue.department());

        if (issue.location() != null) {
            ObjectNode location = node.putObject("location");
            location.put("lat", issue.location().lat());
            location.put("lng", issue.location().lng());
        } else {
            node.putNull("location");
        }
        putMedia(node, "media", issue.media());
        putMedia(node, "voice", issue.voice());

        node.put("createdAt", issue.createdAt().toEpochMilli());
        node.put("updatedAt", issue.updatedAt().toEpochMilli());
        return node;
    }

    /**
     * Public view of a user. The password hash is never included.
     */
    static ObjectNode user(ObjectMapper mapper, User user) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", user.userId());
        node.put("role", user.role().wireName());
        node.put("email", user.email());
        node.put("nationalId", user.nationalId());
        node.put("language", user.language());
        return node;
    }

    static NewIssue newIssue(JsonNode json) {
        String priority = text(json, "priority");
        return new NewIssue(
            text(json, "description"),
            priority != null && !priority.isBlank() ? Priority.fromWire(priority) : null,
            text(json, "category"),
            json.hasNonNull("emergency") ? json.get("emergency").asBoolean() : null,
            location(json.get("location")),
            media(json.get("media")),
            media(json.get("voice")),
            text(json, "department")
        );
    }

    static IssueUpdate update(JsonNode json) {
        String status = text(json, "status");
        String priority = text(json, "priority");

        String department = null;
        if (json.has("department")) {
            // explicit null clears the assignment
            department = json.get("department").isNull() ? "" : json.get("department").asText();
        }

        return new IssueUpdate(
            status != null && !status.isBlank() ? IssueStatus.fromWire(status) : null,
            department,
            priority != null && !priority.isBlank() ? Priority.fromWire(priority) : null
        );
    }

    /**
     * Never fails: a malformed attachment is passed on without a payload and
     * the media gate rejects it.
     */
    static Media media(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (!node.isObject()) {
            return new Media((String) null, null);
        }
        JsonNode data = node.get("data");
        return new Media(text(node, "type"), data != null && data.isTextual() ? data.asText() : null);
    }

    static GeoLocation location(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        boolean hasLat = node.hasNonNull("lat") && node.get("lat").isNumber();
        boolean hasLng = node.hasNonNull("lng") && node.get("lng").isNumber();
        if (hasLat && hasLng) {
            return new GeoLocation(node.get("lat").asDouble(), node.get("lng").asDouble());
        }
        if (!hasLat && !hasLng) {
            return null;
        }
        throw new ValidationException("location requires both lat and lng");
    }

    static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static void putMedia(ObjectNode parent, String field, Media media) {
        if (media == null) {
            parent.putNull(field);
            return;
        }
        ObjectNode node = parent.putObject(field);
        node.put("type", media.type());
        node.put("data", media.data());
    }
}
