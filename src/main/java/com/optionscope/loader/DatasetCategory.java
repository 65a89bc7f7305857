package com.optionscope.loader;

import java.util.List;
import java.util.Locale;

public enum DatasetCategory {
    STREAM("stream", CategorySchema.of(
            List.of(Columns.CONTRACT_ID),
            List.of(Columns.OBSERVED_AT, Columns.ASK, Columns.ASK_SIZE, Columns.BID, Columns.BID_SIZE, Columns.MID))),
    SNAPSHOT("snapshot", CategorySchema.of(
            List.of(Columns.CONTRACT_ID),
            List.of(Columns.MID_PRICE, Columns.ASSET_TYPE))),
    OPTION_SPACE("option_space", CategorySchema.of(
            List.of(Columns.ID, Columns.DESCRIPTION, Columns.EXPIRY, Columns.CONTRACT_TYPE,
                    Columns.STRIKE_PRICE, Columns.UNDERLYING_ID),
            List.of(Columns.EXERCISE_STYLE, Columns.EXCHANGE_ID))),
    STOCK_PRICE("stock_price", CategorySchema.of(
            List.of(Columns.UNDERLYING_ID, Columns.DATE, Columns.CLOSE),
            List.of(Columns.VOLUME))),
    STOCK_OPTION("stock_option", CategorySchema.of(
            List.of(Columns.ID, Columns.DESCRIPTION),
            List.of(Columns.EXERCISE_STYLE, Columns.EXCHANGE_ID, Columns.EXPIRY, Columns.CONTRACT_TYPE,
                    Columns.STRIKE_PRICE, Columns.UNDERLYING_ID))),
    MONEYNESS_PRICE("moneyness_price", CategorySchema.of(
            List.of(Columns.UNDERLYING_ID, Columns.DATE, Columns.CLOSE),
            List.of(Columns.VOLUME)));

    private final String key;
    private final CategorySchema schema;

    DatasetCategory(String key, CategorySchema schema) {
        this.key = key;
        this.schema = schema;
    }

    public String key() {
        return key;
    }

    public CategorySchema schema() {
        return schema;
    }

    public static DatasetCategory fromKey(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (DatasetCategory category : values()) {
            if (category.key.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("unknown dataset category: " + raw);
    }

    /**
     * Header names shared by the category schemas and the typed readers.
     */
    public static final class Columns {
        public static final String ID = "id";
        public static final String DESCRIPTION = "description";
        public static final String EXERCISE_STYLE = "exercise_style";
        public static final String EXCHANGE_ID = "exchange_id";
        public static final String EXPIRY = "expiry";
        public static final String CONTRACT_TYPE = "contract_type";
        public static final String STRIKE_PRICE = "strike_price";
        public static final String UNDERLYING_ID = "underlying_id";
        public static final String CONTRACT_ID = "contract_id";
        public static final String OBSERVED_AT = "observed_at";
        public static final String ASK = "ask";
        public static final String ASK_SIZE = "ask_size";
        public static final String BID = "bid";
        public static final String BID_SIZE = "bid_size";
        public static final String MID = "mid";
        public static final String MID_PRICE = "mid_price";
        public static final String ASSET_TYPE = "asset_type";
        public static final String DATE = "date";
        public static final String CLOSE = "close";
        public static final String VOLUME = "volume";

        private Columns() {
        }
    }
}
