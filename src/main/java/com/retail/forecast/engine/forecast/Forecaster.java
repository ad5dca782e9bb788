package com.retail.forecast.engine.forecast;

import com.retail.forecast.model.ForecastModelType;

/**
 * Interface for in-process statistical forecasting models.
 * Each implementation handles one ForecastModelType.
 */
public interface Forecaster {

    /**
     * The model type this forecaster implements.
     */
    ForecastModelType getModelType();

    /**
     * Forecast the days following the history.
     *
     * @param history daily values, oldest first; may be empty
     * @param horizon number of future days, at least 1
     * @return one non-negative value per future day
     */
    double[] forecast(double[] history, int horizon);
}
