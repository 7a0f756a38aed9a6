package com.dimosr.exporter.core;

import com.dimosr.exporter.instance.Instance;

import java.util.List;

/**
 * An abstraction of the remote API listing the live resources of a cloud product
 *
 * Implementations are expected to throw a RepositoryException when the remote listing fails
 */
public interface InstanceRepository {
    List<Instance> list(String namespace);
}
