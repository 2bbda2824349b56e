package com.project.coin.measurement.service;

import com.project.coin.measurement.model.MeasuredImage;
import org.springframework.stereotype.Component;
import org.springframework.web.context.annotation.SessionScope;

import java.io.Serializable;
import java.util.Optional;

/**
 * Per-user holder of the current {@link InspectionState}. A new image replaces the previous
 * state entirely.
 */
@Component
@SessionScope
public class InspectionSession implements Serializable {

    private transient InspectionState state;

    public Optional<InspectionState> current() {
        return Optional.ofNullable(state);
    }

    public InspectionState show(MeasuredImage image) {
        this.state = InspectionState.of(image);
        return state;
    }

    public void update(InspectionState next) {
        this.state = next;
    }

    public void clear() {
        this.state = null;
    }
}
