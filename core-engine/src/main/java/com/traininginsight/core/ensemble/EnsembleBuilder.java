package com.traininginsight.core.ensemble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates ensemble members, applying the confidence bar for optional
 * members in one place.
 *
 * @since 1.0.0
 */
public class EnsembleBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleBuilder.class);

    private final List<EnsembleMember> members = new ArrayList<>();

    /**
     * Always include {@code member}.
     */
    public EnsembleBuilder add(EnsembleMember member) {
        members.add(Objects.requireNonNull(member, "member must not be null"));
        return this;
    }

    /**
     * Include {@code member} only when its confidence is strictly above
     * {@code threshold}; otherwise it is omitted, not added with zero weight.
     */
    public EnsembleBuilder addIfConfident(EnsembleMember member, double threshold) {
        Objects.requireNonNull(member, "member must not be null");
        double confidence = member.effectiveConfidence();
        if (confidence > threshold) {
            members.add(member);
        } else {
            LOG.debug("Omitting member '{}': confidence {} <= {}", member.getId(), confidence, threshold);
        }
        return this;
    }

    public int size() {
        return members.size();
    }

    /**
     * @return unmodifiable members in insertion order
     */
    public List<EnsembleMember> build() {
        return List.copyOf(members);
    }
}
