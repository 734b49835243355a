package com.relationalizer.normalize;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;
import com.relationalizer.pipeline.RelationalizerConfig;

/**
 * Derived listing columns added to the root object. Sizes in square metres are converted to
 * square feet, and new builds are priced with sales tax included.
 */
public class ComputedColumns {
    private static final Logger log = LoggerFactory.getLogger(ComputedColumns.class);

    public static final String SQFT = "ComputedSQFT";
    public static final String PRICE_PER_SQFT = "ComputedPricePerSQFT";
    public static final String LAST_UPDATED = "ComputedLastUpdated";
    public static final String NEW_BUILD = "ComputedNewBuild";

    public static final Set<String> NAMES = ImmutableSet.of(SQFT, PRICE_PER_SQFT, LAST_UPDATED, NEW_BUILD);

    static final BigDecimal SQFT_PER_M2 = new BigDecimal("10.764");

    /** Sales tax added on top of the advertised price of new builds (GST + QST). */
    static final BigDecimal NEW_BUILD_TAX = new BigDecimal("1.14975");

    private static final Pattern NEW_BUILD_MARKER = Pattern.compile("GST\\s*\\+\\s*QST");

    private final List<String> interiorSizePath;
    private final List<String> pricePath;
    private final List<String> priceTextPath;

    public ComputedColumns(RelationalizerConfig config) {
        this.interiorSizePath = DocumentPaths.segments(config.getInteriorSizePath());
        this.pricePath = DocumentPaths.segments(config.getPricePath());
        this.priceTextPath = DocumentPaths.segments(config.getPriceTextPath());
    }

    public static boolean isComputed(List<String> sourcePath) {
        return sourcePath.size() == 1 && NAMES.contains(sourcePath.get(0));
    }

    /**
     * Sets all four columns on {@code root}; values that cannot be derived are null. A last
     * update time at the epoch means unknown.
     */
    public void apply(ObjectNode root, Instant lastUpdated) {
        boolean newBuild = isNewBuild(DocumentPaths.resolve(root, priceTextPath));
        Optional<Long> sqft = squareFeet(DocumentPaths.resolve(root, interiorSizePath));
        Optional<BigDecimal> price = DocumentPaths.number(DocumentPaths.resolve(root, pricePath));

        if (sqft.isPresent()) {
            root.put(SQFT, sqft.get());
        } else {
            root.putNull(SQFT);
        }
        if (sqft.isPresent() && price.isPresent()) {
            BigDecimal total = newBuild ? price.get().multiply(NEW_BUILD_TAX) : price.get();
            root.put(PRICE_PER_SQFT, total.divide(BigDecimal.valueOf(sqft.get()), 0, RoundingMode.HALF_UP).longValue());
        } else {
            root.putNull(PRICE_PER_SQFT);
        }
        if (Instant.EPOCH.equals(lastUpdated)) {
            root.putNull(LAST_UPDATED);
        } else {
            root.put(LAST_UPDATED, LocalDate.ofInstant(lastUpdated, ZoneOffset.UTC).toString());
        }
        root.put(NEW_BUILD, newBuild);
    }

    static boolean isNewBuild(JsonNode priceText) {
        return priceText.isTextual() && NEW_BUILD_MARKER.matcher(priceText.textValue()).find();
    }

    /**
     * Reads sizes such as {@code "1200 sqft"} or {@code "111.5 m2"}, rounded to whole square feet.
     * Unknown units and non-positive sizes yield nothing.
     */
    static Optional<Long> squareFeet(JsonNode size) {
        if (!size.isTextual()) {
            return Optional.empty();
        }
        String[] parts = size.textValue().trim().split("\\s+");
        if (parts.length < 2) {
            return Optional.empty();
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(parts[0].replace(",", ""));
        } catch (NumberFormatException e) {
            log.debug("Interior size '{}' has no leading number", size.textValue());
            return Optional.empty();
        }
        BigDecimal sqft = switch (parts[1].toLowerCase(Locale.ROOT)) {
            case "sqft" -> amount;
            case "m2" -> amount.multiply(SQFT_PER_M2);
            default -> BigDecimal.ZERO;
        };
        long rounded = sqft.setScale(0, RoundingMode.HALF_UP).longValue();
        return rounded > 0 ? Optional.of(rounded) : Optional.empty();
    }
}
