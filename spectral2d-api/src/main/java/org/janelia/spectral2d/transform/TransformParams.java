package org.janelia.spectral2d.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Named transform settings. Values may be given as their typed value or as a string,
 * e.g. when they come from system properties.
 */
public class TransformParams {

    public static final String NUM_TASKS = "numTasks";
    public static final String CACHE_KERNELS = "cacheKernels";
    public static final String KERNEL_CACHE_SIZE = "kernelCacheSize";

    private final Map<String, Object> params = new LinkedHashMap<>();

    public TransformParams setParam(String name, Object value) {
        if (value == null) {
            params.remove(name);
        } else {
            params.put(name, value);
        }
        return this;
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(params);
    }

    public Integer getIntParam(String name, Integer defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Number) {
            return ((Number) value).intValue();
        } else if (StringUtils.isBlank(value.toString())) {
            return defaultValue;
        } else {
            return Integer.valueOf(value.toString().trim());
        }
    }

    public Long getLongParam(String name, Long defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Number) {
            return ((Number) value).longValue();
        } else if (StringUtils.isBlank(value.toString())) {
            return defaultValue;
        } else {
            return Long.valueOf(value.toString().trim());
        }
    }

    public Boolean getBoolParam(String name, Boolean defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Boolean) {
            return (Boolean) value;
        } else if (StringUtils.isBlank(value.toString())) {
            return defaultValue;
        } else {
            return Boolean.valueOf(value.toString().trim());
        }
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("params", params)
                .toString();
    }
}
