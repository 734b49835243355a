package com.relationalizer.pipeline;

import com.relationalizer.rules.TransformRules;
import com.relationalizer.sql.ReferenceFormat;
import com.relationalizer.sql.TypeInferencePolicy;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the relationalizer pipeline.
 */
@Data
@Builder
public class RelationalizerConfig {

    public static final String DEFAULT_ROOT_TABLE = "Listings";
    public static final int DEFAULT_COLLAPSE_THRESHOLD = 3;
    public static final String DEFAULT_DELIMITER = ",";
    public static final String DEFAULT_INTERIOR_SIZE_PATH = "$.Building.SizeInterior";
    public static final String DEFAULT_PRICE_PATH = "$.Property.PriceUnformattedValue";
    public static final String DEFAULT_PRICE_TEXT_PATH = "$.Property.Price";
    public static final String DEFAULT_PRICE_HISTORY_KEY_PATH = "$.MlsNumber";

    /** Name of the table holding one row per document. */
    @Builder.Default
    private String rootTableName = DEFAULT_ROOT_TABLE;

    /** Scalar lists up to this size are collapsed into one delimited string. */
    @Builder.Default
    private int collapseThreshold = DEFAULT_COLLAPSE_THRESHOLD;

    @Builder.Default
    private String delimiter = DEFAULT_DELIMITER;

    @Builder.Default
    private TransformRules rules = TransformRules.empty();

    @Builder.Default
    private TypeInferencePolicy typePolicy = TypeInferencePolicy.TEXT_DEFAULT;

    @Builder.Default
    private ReferenceFormat referenceFormat = ReferenceFormat.JSON_ARRAY;

    /** Worker threads used to profile documents; 1 profiles sequentially. */
    @Builder.Default
    private int parallelism = 1;

    /** Create the discovered tables before inserting rows. */
    @Builder.Default
    private boolean createTables = true;

    /** Root table only, restricted to columns marked MINIMAL and the primary key. */
    private boolean minimal;

    /** Skip documents not newer than the output store's ingest watermark. */
    private boolean incremental;

    /** Add the ComputedSQFT, ComputedPricePerSQFT, ComputedLastUpdated and ComputedNewBuild root columns. */
    private boolean computedColumns;

    /** Record each listing's price in the PriceHistory table whenever it changes. */
    private boolean priceHistory;

    /** Text such as {@code "1200 sqft"} or {@code "111 m2"}. */
    @Builder.Default
    private String interiorSizePath = DEFAULT_INTERIOR_SIZE_PATH;

    /** Numeric asking price, used by computed columns and price history. */
    @Builder.Default
    private String pricePath = DEFAULT_PRICE_PATH;

    /** Advertised price text; new builds mention {@code GST + QST} there. */
    @Builder.Default
    private String priceTextPath = DEFAULT_PRICE_TEXT_PATH;

    /** Value identifying a listing across scrapes, stored as the first PriceHistory column. */
    @Builder.Default
    private String priceHistoryKeyPath = DEFAULT_PRICE_HISTORY_KEY_PATH;

    public static RelationalizerConfig defaults() {
        return RelationalizerConfig.builder().build();
    }
}
