package com.project.coin.measurement.DTOs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.project.coin.measurement.model.MeasuredImage;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MeasurementResponse(
        String name,
        int width,
        int height,
        Double scale,
        int objectCount,
        List<ObjectView> objects
) {
    public static MeasurementResponse from(MeasuredImage image) {
        List<ObjectView> views = image.objects().stream().map(ObjectView::from).toList();
        return new MeasurementResponse(image.name(), image.width(), image.height(), image.scale(), views.size(), views);
    }
}
