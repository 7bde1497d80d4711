package in.civicdesk.service.classification;

import in.civicdesk.domain.issue.Media;

/**
 * Classifier used when no model is wired in. Always answers "Other".
 */
public final class DefaultIssueClassifier implements IssueClassifier {

    @Override
    public String classify(Media media) {
        return IssueCategories.OTHER;
    }
}
