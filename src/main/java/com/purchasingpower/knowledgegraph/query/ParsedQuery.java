package com.purchasingpower.knowledgegraph.query;

import java.util.List;
import java.util.Set;

/**
 * Result of the PARSE stage.
 *
 * @param intent Question form
 * @param seedTerms Name fragments to resolve, most specific first
 * @param answerTypes Entity types an answer must have, or empty for any type
 */
public record ParsedQuery(QueryIntent intent, List<String> seedTerms, Set<String> answerTypes) {
}
