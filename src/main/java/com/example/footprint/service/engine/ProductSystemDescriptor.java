package com.example.footprint.service.engine;

import com.example.footprint.model.AllocationMethod;
import com.example.footprint.model.CalculationJob;
import com.example.footprint.model.MaterialInput;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Описание производственной системы, передаваемое движку.
 */
@Value
@Builder
public class ProductSystemDescriptor {
    String subjectRef;
    String productCategory;
    List<MaterialInput> materials;
    Map<String, Double> productionParameters;
    AllocationMethod allocationMethod;

    public static ProductSystemDescriptor from(CalculationJob job) {
        return ProductSystemDescriptor.builder()
                .subjectRef(job.getSubjectRef())
                .productCategory(job.getInputsSnapshot().getProductCategory())
                .materials(job.getInputsSnapshot().getMaterials())
                .productionParameters(job.getInputsSnapshot().getProductionParameters())
                .allocationMethod(job.getOptions().getAllocationMethod())
                .build();
    }
}
