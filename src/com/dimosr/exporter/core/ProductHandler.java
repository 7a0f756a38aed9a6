package com.dimosr.exporter.core;

import com.dimosr.exporter.instance.Instance;

import java.util.List;

/**
 * The product-specific part of the collection of a namespace:
 * which instances are monitored and how their series are resolved
 */
public interface ProductHandler extends SeriesResolver {
    List<Instance> getInstances();
}
