package com.optionscope.price;

import com.optionscope.loader.DatasetCategory.Columns;
import com.optionscope.loader.RawRow;
import com.optionscope.loader.RawTable;
import com.optionscope.model.UnderlyingDailyPrice;
import com.optionscope.utils.Values;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Daily close/volume per underlying, unique per (underlying id, calendar date).
 * <p>
 * Raw rows are deduplicated on (underlying id, date cell) keeping the first, then the date is
 * normalized. Two spellings of the same day collapse to the first as well. Rows without an
 * underlying id or a readable date cannot be joined and are dropped.
 */
public final class StockPriceRegistry {
    private static final Logger LOG = LogManager.getLogger(StockPriceRegistry.class);

    private final List<UnderlyingDailyPrice> prices;
    private final Map<Key, UnderlyingDailyPrice> byKey;
    private final int duplicateRows;
    private final int droppedRows;

    private StockPriceRegistry(List<UnderlyingDailyPrice> prices, int duplicateRows, int droppedRows) {
        Map<Key, UnderlyingDailyPrice> index = new LinkedHashMap<>();
        for (UnderlyingDailyPrice price : prices) {
            index.put(new Key(price.underlyingId, price.date), price);
        }
        this.prices = Collections.unmodifiableList(new ArrayList<>(prices));
        this.byKey = Collections.unmodifiableMap(index);
        this.duplicateRows = duplicateRows;
        this.droppedRows = droppedRows;
    }

    public static StockPriceRegistry build(RawTable table) {
        Set<String> rawSeen = new HashSet<>();
        Set<Key> seen = new HashSet<>();
        List<UnderlyingDailyPrice> out = new ArrayList<>();
        int duplicates = 0;
        int dropped = 0;
        for (RawRow row : table.rows()) {
            String underlyingId = Values.text(row.get(Columns.UNDERLYING_ID));
            String rawDate = Values.text(row.get(Columns.DATE));
            if (!rawSeen.add(underlyingId + '\u0000' + rawDate)) {
                duplicates++;
                continue;
            }
            LocalDate date = Values.parseDate(rawDate);
            if (underlyingId == null || date == null) {
                dropped++;
                continue;
            }
            Key key = new Key(underlyingId, date);
            if (!seen.add(key)) {
                duplicates++;
                continue;
            }
            out.add(new UnderlyingDailyPrice(
                    underlyingId,
                    date,
                    Values.parseDouble(row.get(Columns.CLOSE)),
                    Values.parseDouble(row.get(Columns.VOLUME)),
                    row.sourceFile
            ));
        }
        LOG.info("Price registry [{}]: raw={} kept={} duplicates={} dropped={}",
                table.category().key(), table.size(), out.size(), duplicates, dropped);
        return new StockPriceRegistry(out, duplicates, dropped);
    }

    public UnderlyingDailyPrice lookup(String underlyingId, LocalDate date) {
        if (underlyingId == null || date == null) {
            return null;
        }
        return byKey.get(new Key(underlyingId, date));
    }

    public int size() {
        return prices.size();
    }

    public int duplicateRows() {
        return duplicateRows;
    }

    public int droppedRows() {
        return droppedRows;
    }

    private static final class Key {
        private final String underlyingId;
        private final LocalDate date;

        private Key(String underlyingId, LocalDate date) {
            this.underlyingId = underlyingId;
            this.date = date;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key other = (Key) o;
            return underlyingId.equals(other.underlyingId) && date.equals(other.date);
        }

        @Override
        public int hashCode() {
            return Objects.hash(underlyingId, date);
        }
    }
}
