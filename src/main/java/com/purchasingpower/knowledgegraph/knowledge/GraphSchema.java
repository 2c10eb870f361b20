package com.purchasingpower.knowledgegraph.knowledge;

/**
 * Label and property names shared by every stage. Later stages query by these exact keys,
 * so they must not drift.
 */
public final class GraphSchema {

    public static final String ENTITY_ID = "entity_id";
    public static final String CANONICAL_NAME = "canonical_name";
    public static final String ENTITY_TYPE = "entity_type";
    public static final String SURFACE_FORMS = "surface_forms";
    public static final String MENTION_COUNT = "mention_count";
    public static final String MENTION_REFS = "mention_refs";
    public static final String SOURCE_REFS = "source_refs";
    public static final String CONFIDENCE = "confidence";
    public static final String QUALITY_CONFIDENCE = "quality_confidence";
    public static final String QUALITY_TIER = "quality_tier";
    public static final String CREATED_AT = "created_at";

    public static final String PAGERANK_SCORE = "pagerank_score";
    public static final String PAGERANK_RANK = "pagerank_rank";
    public static final String PAGERANK_PERCENTILE = "pagerank_percentile";
    public static final String PAGERANK_CALCULATED_AT = "pagerank_calculated_at";

    public static final String RELATIONSHIP_ID = "relationship_id";
    public static final String RELATIONSHIP_TYPE = "relationship_type";
    public static final String WEIGHT = "weight";
    public static final String EXTRACTION_METHOD = "extraction_method";
    public static final String EVIDENCE_TEXT = "evidence_text";
    public static final String PATTERN_CONFIDENCE = "pattern_confidence";
    public static final String ENTITY_DISTANCE = "entity_distance";

    private GraphSchema() {
    }
}
