package com.pensionai.orchestration.api;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Optional renderer turning a Vega-Lite chart descriptor into PNG bytes.
 */
public interface ChartRasterizer {

    @Nullable
    byte[] rasterize(Map<String, Object> chartDescriptor);
}
