package com.dimosr.exporter;

import com.dimosr.exporter.config.ProductConfig;
import com.dimosr.exporter.core.InstanceRepository;
import com.dimosr.exporter.core.ProductHandler;
import com.dimosr.exporter.instance.Instance;
import com.dimosr.exporter.metric.Metric;
import com.dimosr.exporter.metric.Series;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Optional;

/**
 * The handler used by products whose metrics have the instance as their only dimension.
 *
 * Instances are listed through the instance repository and filtered by the instance allow/deny lists of the product.
 * Products without instance discovery are monitored on the custom instances of their configuration.
 */
public class DefaultProductHandler implements ProductHandler {
    public static final String INSTANCE_DIMENSION = "InstanceId";

    private final String namespace;
    private final ProductConfig productConfig;
    private final Optional<InstanceRepository> instanceRepository;

    public DefaultProductHandler(final String namespace,
                                 final ProductConfig productConfig,
                                 final Optional<InstanceRepository> instanceRepository) {
        this.namespace = namespace;
        this.productConfig = productConfig;
        this.instanceRepository = instanceRepository;
    }

    @Override
    public List<Instance> getInstances() {
        if (!instanceRepository.isPresent()) {
            ImmutableList.Builder<Instance> custom = ImmutableList.builder();
            for (String instanceId : productConfig.getCustomInstances()) {
                custom.add(Instance.of(instanceId));
            }
            return custom.build();
        }

        ImmutableList.Builder<Instance> included = ImmutableList.builder();
        for (Instance instance : instanceRepository.get().list(namespace)) {
            if (productConfig.isInstanceIncluded(instance.getInstanceId())) {
                included.add(instance);
            }
        }
        return included.build();
    }

    @Override
    public List<Series> resolveSeries(final Metric metric, final List<Instance> instances) {
        ImmutableList.Builder<Series> series = ImmutableList.builder();
        for (Instance instance : instances) {
            series.add(new Series(metric.getName(), instance, ImmutableMap.of(INSTANCE_DIMENSION, instance.getInstanceId())));
        }
        return series.build();
    }
}
