package com.example.footprint.service.calculation;

import java.util.OptionalDouble;
import java.util.Set;

/**
 * Источник версионированных таблиц GWP факторов.
 */
public interface GwpFactorSource {

    /**
     * @return фактор газа или пусто, если газ или версия неизвестны
     */
    OptionalDouble getGwpFactor(String gasFormula, String factorVersion);

    /**
     * @throws com.example.footprint.exception.EngineDataException версия неизвестна
     */
    GwpFactorTable table(String factorVersion);

    Set<String> availableVersions();
}
