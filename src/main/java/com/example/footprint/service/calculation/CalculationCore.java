package com.example.footprint.service.calculation;

import com.example.footprint.exception.EngineDataException;
import com.example.footprint.model.CalculationOptions;
import com.example.footprint.model.FootprintMetadata;
import com.example.footprint.model.FootprintResult;
import com.example.footprint.model.GasContribution;
import com.example.footprint.model.InventoryFlow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

/**
 * Агрегация потоков инвентаризации в CO2-эквивалент по газам.
 * <p>
 * Чистая функция без ввода-вывода. Потоки сортируются до суммирования, поэтому
 * итог не зависит от порядка, в котором движок вернул потоки.
 */
@Component
public class CalculationCore {
    public static final String METHOD = "gwp100-gas-aggregation";

    private static final Comparator<InventoryFlow> FLOW_ORDER = Comparator
            .comparing(InventoryFlow::getName)
            .thenComparing(flow -> flow.getCategory() == null ? "" : flow.getCategory())
            .thenComparingDouble(InventoryFlow::getAmount)
            .thenComparing(flow -> flow.getUnit() == null ? "" : flow.getUnit());

    /**
     * Рассчитывает след по инвентаризации.
     *
     * @param flows         потоки от внешнего движка
     * @param factors       таблица GWP факторов запрошенной версии
     * @param options       параметры расчёта
     * @param engineVersion версия движка для метаданных
     * @param durationMs    длительность получения инвентаризации
     * @return результат с {@code degraded = false}
     * @throws EngineDataException поток некорректен или единица измерения не поддерживается
     */
    public FootprintResult calculate(List<InventoryFlow> flows,
                                     GwpFactorTable factors,
                                     CalculationOptions options,
                                     String engineVersion,
                                     long durationMs) {
        if (flows == null) {
            throw new EngineDataException("Engine returned no inventory");
        }

        List<InventoryFlow> gasFlows = new ArrayList<>();
        List<InventoryFlow> waterFlows = new ArrayList<>();
        for (InventoryFlow flow : flows) {
            if (flow == null || flow.getName() == null || flow.getName().isBlank()) {
                throw new EngineDataException("Engine returned a flow without a name");
            }
            switch (flow.flowCategory()) {
                case AIR_EMISSION:
                    if (GreenhouseGases.isKnown(flow.getName())) {
                        gasFlows.add(flow);
                    }
                    break;
                case WATER_CONSUMPTION:
                    waterFlows.add(flow);
                    break;
                default:
                    break;
            }
        }
        gasFlows.sort(FLOW_ORDER);
        waterFlows.sort(FLOW_ORDER);

        Map<String, GasTotal> perGas = new LinkedHashMap<>();
        Set<String> excluded = new TreeSet<>();
        double totalCo2e = 0.0;
        for (InventoryFlow flow : gasFlows) {
            double massKg = FlowUnits.toKilograms(flow.getName(), flow.getAmount(), flow.getUnit());
            OptionalDouble factor = factors.factorFor(flow.getName());
            if (factor.isEmpty()) {
                excluded.add(flow.getName());
                continue;
            }
            double co2e = massKg * factor.getAsDouble();
            totalCo2e += co2e;
            perGas.computeIfAbsent(flow.getName(), name -> new GasTotal(factor.getAsDouble()))
                    .add(massKg, co2e);
        }

        double waterLiters = 0.0;
        for (InventoryFlow flow : waterFlows) {
            waterLiters += FlowUnits.toLiters(flow.getName(), flow.getAmount(), flow.getUnit());
        }

        FootprintResult.FootprintResultBuilder result = FootprintResult.builder()
                .totalCo2e(totalCo2e)
                .waterFootprintLiters(waterLiters)
                .degraded(false)
                .metadata(FootprintMetadata.builder()
                        .engineVersion(engineVersion)
                        .factorVersion(factors.getVersion())
                        .durationMs(durationMs)
                        .calculationMethod(METHOD + (options.getMethod() != null
                                ? "/" + options.getMethod().name().toLowerCase(Locale.ROOT) : ""))
                        .excludedGases(excluded)
                        .build());
        perGas.forEach((gas, total) -> result.ghgEntry(GasContribution.builder()
                .gasName(gas)
                .massKg(total.massKg)
                .gwpFactor(total.factor)
                .co2e(total.co2e)
                .build()));
        return result.build();
    }

    private static final class GasTotal {
        private final double factor;
        private double massKg;
        private double co2e;

        private GasTotal(double factor) {
            this.factor = factor;
        }

        private void add(double massKg, double co2e) {
            this.massKg += massKg;
            this.co2e += co2e;
        }
    }
}
