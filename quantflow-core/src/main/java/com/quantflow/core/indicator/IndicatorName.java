package com.quantflow.core.indicator;

public enum IndicatorName {
    MA_SHORT("ma_short"),
    MA_LONG("ma_long"),
    RSI("rsi"),
    MACD("macd"),
    BOLLINGER("bollinger"),
    VOLUME_MA("volume_ma"),
    ATR("atr"),
    MOMENTUM("momentum");

    private final String key;

    IndicatorName(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
