package com.optionscope.model;

import java.time.LocalDate;

public final class UnderlyingDailyPrice {
    public final String underlyingId;
    public final LocalDate date;
    public final Double close;
    public final Double volume;
    public final String sourceFile;

    public UnderlyingDailyPrice(String underlyingId, LocalDate date, Double close, Double volume, String sourceFile) {
        this.underlyingId = underlyingId;
        this.date = date;
        this.close = close;
        this.volume = volume;
        this.sourceFile = sourceFile;
    }
}
