package com.vidnyan.vbuilder.domain.model;

import java.util.List;

/**
 * A module port. Immutable once parsed; replaced wholesale on module refresh.
 * <p>
 * {@code width} is the first packed dimension, {@code packedDimensions} any
 * further packed dimensions and {@code dimensions} the unpacked dimensions
 * written after the name, each in declaration order.
 */
public record Port(
    String name,
    PortDirection direction,
    String dataType,
    WidthSpec width,
    List<WidthSpec> packedDimensions,
    List<WidthSpec> dimensions
) {

    public static final String DEFAULT_DATA_TYPE = "wire";

    public Port {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Port name is required");
        }
        if (direction == null) {
            throw new IllegalArgumentException("Port '" + name + "' has no direction");
        }
        dataType = dataType == null || dataType.isBlank() ? DEFAULT_DATA_TYPE : dataType;
        width = width == null ? WidthSpec.absent() : width;
        packedDimensions = packedDimensions == null ? List.of() : List.copyOf(packedDimensions);
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    }

    /**
     * Single-dimension port.
     */
    public static Port of(String name, PortDirection direction, WidthSpec width) {
        return new Port(name, direction, DEFAULT_DATA_TYPE, width, List.of(), List.of());
    }

    public boolean isMultiDimensional() {
        return !packedDimensions.isEmpty() || !dimensions.isEmpty();
    }
}
