package in.civicdesk.domain.issue;

/**
 * WGS84 point where the issue was observed.
 */
public record GeoLocation(double lat, double lng) {
}
