package com.agenttrader.core.exception;

public class ModelNotTrainedException extends TradingException {

    public ModelNotTrainedException(String symbol) {
        super(symbol, "Forecasting model has not been trained yet");
    }
}
