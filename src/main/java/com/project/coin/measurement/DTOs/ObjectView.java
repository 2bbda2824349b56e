package com.project.coin.measurement.DTOs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.project.coin.measurement.model.DetectedObject;

/** One detected object as shown in tables and returned by the JSON API. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObjectView(
        int id,
        double centerX,
        double centerY,
        double diameterPx,
        Double diameterPhysical   // omitted when no scale is set
) {
    public static ObjectView from(DetectedObject o) {
        return new ObjectView(o.id(), o.center().x(), o.center().y(), o.diameterPx(), o.diameterPhysical());
    }
}
