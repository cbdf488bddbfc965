package com.z254.verity.rca;

import com.z254.verity.domain.model.EvidenceBundle;
import com.z254.verity.domain.model.Hypothesis;
import com.z254.verity.domain.model.SignalType;
import com.z254.verity.domain.model.SignalWeights;
import com.z254.verity.domain.model.WeightProposal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Proposes moving-average nudges toward signal types that backed the top hypothesis.
 * <p>
 * For every contributing type the delta is {@code alpha * (1 - current)}. The proposal is
 * returned to the caller; the snapshot is never modified.
 */
@Slf4j
@Component
public class WeightAdjuster {

    public WeightProposal propose(Hypothesis top, List<EvidenceBundle> bundles,
                                  SignalWeights snapshot, double alpha) {
        Map<SignalType, Double> deltas = new EnumMap<>(SignalType.class);
        if (top == null) {
            return WeightProposal.builder().tenant(snapshot.getTenant()).deltas(deltas).build();
        }

        Set<SignalType> contributing = EnumSet.noneOf(SignalType.class);
        bundles.stream()
                .filter(b -> top.getSupportingBundles().contains(b.getId()))
                .forEach(b -> contributing.addAll(b.signalTypes()));

        for (SignalType type : contributing) {
            double current = snapshot.weight(type);
            double delta = alpha * (1.0 - current);
            if (delta != 0.0) {
                deltas.put(type, delta);
            }
        }

        log.debug("Weight proposal for tenant {} from {}: {}", snapshot.getTenant(), top.getId(), deltas);
        return WeightProposal.builder()
                .tenant(snapshot.getTenant())
                .deltas(deltas)
                .basedOnHypothesis(top.getId())
                .build();
    }
}
