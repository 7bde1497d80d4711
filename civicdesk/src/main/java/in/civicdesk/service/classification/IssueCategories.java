package in.civicdesk.service.classification;

import java.util.List;

/**
 * Categories a classifier may answer with.
 */
public final class IssueCategories {

    public static final String OTHER = "Other";

    public static final List<String> ALL = List.of(
        "Pothole", "Garbage", "Streetlight", "Damaged Sign", "Graffiti", OTHER);

    /**
     * Map a classifier answer onto a known category; anything else becomes "Other".
     */
    public static String normalize(String answer) {
        if (answer == null) {
            return OTHER;
        }
        String trimmed = answer.trim();
        return ALL.contains(trimmed) ? trimmed : OTHER;
    }

    private IssueCategories() {}
}
