package com.ledger.anomaly.model;

public enum OutlierMethod {
    Z_SCORE,
    IQR,
    MAD
}
