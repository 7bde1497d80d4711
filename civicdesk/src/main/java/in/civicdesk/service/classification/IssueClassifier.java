package in.civicdesk.service.classification;

import in.civicdesk.domain.issue.Media;

/**
 * Suggests a category for submitted media. The real implementation lives
 * outside this service (a generative model called by the client application);
 * the backend only reports a suggestion from /verify.
 */
public interface IssueClassifier {

    /**
     * @return one of {@link IssueCategories#ALL}, never null
     */
    String classify(Media media);
}
