package com.optionscope.testing;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A small consistent set of extracts covering every category.
 */
public final class SampleDataSet {

    private SampleDataSet() {
    }

    public static void write(Path dir) throws IOException {
        Fixtures.write(dir, "option_space_1.csv",
                "id,description,exercise_style,exchange_id,expiry,contract_type,strike_price,underlying_id",
                "C140,AAPL 140 C,American,X,2024-01-19,Call,140,S1",
                "C150,AAPL 150 C,American,X,2024-01-19,Call,150,S1",
                "C160,AAPL 160 C,American,X,2024-01-19,Call,160,S1",
                "P140,AAPL 140 P,American,X,2024-01-19,Put,140,S1",
                "N1,no price,American,X,2024-02-16,Call,140,S1");
        Fixtures.write(dir, "option_space_2.csv",
                "id,description,exercise_style,exchange_id,expiry,contract_type,strike_price,underlying_id",
                "C140,AAPL 140 C,American,X,2024-01-19,Call,140,S1");
        Fixtures.write(dir, "stock_option_1.csv",
                "id,description",
                "C150,AAPL 150 C",
                "P140,AAPL 140 P");
        Fixtures.write(dir, "stream_1.csv",
                "contract_id,observed_at,ask,ask_size,bid,bid_size,mid",
                "C150,2024-01-10 09:30:00,2.0,5,1.8,6,1.9",
                "C150,2024-01-10 09:30:01,,,,,",
                "C140,2024-01-10 09:30:02,,,,,",
                "GHOST,2024-01-10 09:30:03,1.0,1,0.9,1,0.95");
        Fixtures.write(dir, "snapshot_1.csv",
                "contract_id,mid_price,asset_type",
                "C150,1.9,OPTION",
                "GHOST,0.95,OPTION");
        Fixtures.write(dir, "moneyness_1.csv",
                "underlying_id,date,close,volume",
                "S1,2024-01-19,150,10000",
                "S1,2024-01-19,151,1");
        Fixtures.write(dir, "stock_price_1.csv",
                "underlying_id,date,close,volume",
                "S1,2024-01-18,149,9000",
                "S1,2024-01-19,150,10000");
    }
}
