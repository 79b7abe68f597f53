package com.example.footprint.service.calculation;

import java.util.Set;

/**
 * Формулы парниковых газов, распознаваемые при агрегации (Киотская корзина).
 * Сопоставление точное, без нормализации регистра.
 */
public final class GreenhouseGases {

    public static final Set<String> FORMULAS = Set.of(
            "CO2", "CH4", "N2O", "SF6", "NF3",
            "HFC-23", "HFC-32", "HFC-125", "HFC-134a", "HFC-143a", "HFC-152a",
            "HFC-227ea", "HFC-236fa", "HFC-245fa", "HFC-365mfc",
            "CF4", "C2F6", "C3F8", "c-C4F8"
    );

    private GreenhouseGases() {
    }

    public static boolean isKnown(String name) {
        return name != null && FORMULAS.contains(name);
    }
}
