package com.optionscope.model;

public final class SnapshotObservation {
    public final String contractId;
    public final Double midPrice;
    public final String assetType;
    public final String sourceFile;

    public SnapshotObservation(String contractId, Double midPrice, String assetType, String sourceFile) {
        this.contractId = contractId;
        this.midPrice = midPrice;
        this.assetType = assetType;
        this.sourceFile = sourceFile;
    }
}
