package com.retail.forecast.engine.forecast;

import com.retail.forecast.model.ForecastModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a ForecastModelType to its registered Forecaster.
 */
@Component
public class ForecasterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ForecasterRegistry.class);

    private final Map<ForecastModelType, Forecaster> forecasters = new EnumMap<>(ForecastModelType.class);

    public ForecasterRegistry(List<Forecaster> forecasters) {
        for (Forecaster forecaster : forecasters) {
            this.forecasters.put(forecaster.getModelType(), forecaster);
            log.info("Registered forecaster: {} -> {}",
                    forecaster.getModelType(), forecaster.getClass().getSimpleName());
        }
    }

    /**
     * The forecaster for the requested type, or Holt-Winters when the type has no implementation.
     */
    public Forecaster resolve(ForecastModelType type) {
        Forecaster forecaster = type != null ? forecasters.get(type) : null;
        if (forecaster != null) {
            return forecaster;
        }
        log.warn("No forecaster registered for model type {}; using {}", type, ForecastModelType.HOLT_WINTERS);
        Forecaster fallback = forecasters.get(ForecastModelType.HOLT_WINTERS);
        if (fallback == null) {
            throw new IllegalStateException("No Holt-Winters forecaster registered");
        }
        return fallback;
    }
}
