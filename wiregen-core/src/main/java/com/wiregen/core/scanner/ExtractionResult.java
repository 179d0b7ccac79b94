package com.wiregen.core.scanner;

import com.wiregen.core.model.ConfigurationField;
import com.wiregen.core.model.DependencyDescriptor;
import com.wiregen.core.model.TypeDescriptor;

import java.util.List;

/**
 * Descriptors extracted from one snapshot.
 *
 * @param types type descriptors sorted by qualified name
 * @param dependencies dependency descriptors, grouped by owner in type order, declaration order within
 * @param configurationFields fields bound to configuration values, ordered like {@code dependencies}
 * @param statistics extraction statistics
 */
public record ExtractionResult(
    List<TypeDescriptor> types,
    List<DependencyDescriptor> dependencies,
    List<ConfigurationField> configurationFields,
    ScanStatistics statistics
) {
    public ExtractionResult {
        types = types == null ? List.of() : List.copyOf(types);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        configurationFields = configurationFields == null ? List.of() : List.copyOf(configurationFields);
        if (statistics == null) {
            statistics = ScanStatistics.empty();
        }
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of(), List.of(), ScanStatistics.empty());
    }

    public List<DependencyDescriptor> dependenciesOf(String owner) {
        return dependencies.stream().filter(d -> d.owner().equals(owner)).toList();
    }

    public List<ConfigurationField> configurationFieldsOf(String owner) {
        return configurationFields.stream().filter(f -> f.owner().equals(owner)).toList();
    }
}
