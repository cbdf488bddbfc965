package com.z254.verity.correlation;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.AnomalyCluster;
import com.z254.verity.domain.model.AnomalyEvent;
import com.z254.verity.domain.model.EvidenceSignal;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Density clustering of anomalies over onset time and peak value.
 * <p>
 * Both features are min-max scaled to {@code [0, 1]} before DBSCAN, so {@code eps} is a
 * fraction of the observed range. Anomalies that join no cluster are reported together
 * as one noise cluster.
 */
@Slf4j
@Component
public class AnomalyClusterer {

    private static final double EPSILON = 1e-9;

    private final VerityProperties properties;

    public AnomalyClusterer(VerityProperties properties) {
        this.properties = properties;
    }

    public List<AnomalyCluster> cluster(Collection<AnomalyEvent> anomalies) {
        VerityProperties.Grouping config = properties.getGrouping();
        return cluster(anomalies, config.getClusterEps(), config.getClusterMinSamples());
    }

    /**
     * Clusters ordered by descending size, noise last among equals.
     *
     * @param minSamples neighbourhood size, the anomaly itself included, that makes a core point
     */
    public List<AnomalyCluster> cluster(Collection<AnomalyEvent> anomalies, double eps, int minSamples) {
        if (anomalies.isEmpty() || anomalies.size() < minSamples) {
            return List.of();
        }
        List<AnomalyEvent> sorted = anomalies.stream()
                .sorted(Comparator.<AnomalyEvent, Instant>comparing(EvidenceSignal::getOnset).thenComparing(AnomalyEvent::getId))
                .toList();

        // Step 1: scaled feature points
        double[] times = sorted.stream().mapToDouble(a -> a.getOnset().toEpochMilli()).toArray();
        double[] values = sorted.stream().mapToDouble(AnomalyEvent::getPeakValue).toArray();
        List<AnomalyPoint> points = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            points.add(new AnomalyPoint(sorted.get(i), scale(times, i), scale(values, i)));
        }

        // Step 2: DBSCAN; commons-math counts neighbours without the point itself
        DBSCANClusterer<AnomalyPoint> clusterer = new DBSCANClusterer<>(eps, Math.max(0, minSamples - 1));
        List<Cluster<AnomalyPoint>> found = clusterer.cluster(points);

        // Step 3: clusters, then everything left over as noise
        Map<AnomalyEvent, Boolean> clustered = new IdentityHashMap<>();
        List<AnomalyCluster> result = new ArrayList<>();
        for (int id = 0; id < found.size(); id++) {
            List<AnomalyEvent> members = found.get(id).getPoints().stream().map(AnomalyPoint::event).toList();
            members.forEach(m -> clustered.put(m, Boolean.TRUE));
            result.add(toCluster(id, members));
        }
        List<AnomalyEvent> noise = sorted.stream().filter(a -> !clustered.containsKey(a)).toList();
        if (!noise.isEmpty()) {
            result.add(toCluster(AnomalyCluster.NOISE_ID, noise));
        }

        result.sort(Comparator.comparingInt(AnomalyCluster::getSize).reversed()
                .thenComparing(AnomalyCluster::isNoise)
                .thenComparingInt(AnomalyCluster::getClusterId));
        log.debug("Clustered {} anomalies into {} cluster(s), {} noise", sorted.size(), found.size(), noise.size());
        return result;
    }

    // ========== Private Helper Methods ==========

    private static double scale(double[] values, int index) {
        double min = StatUtils.min(values);
        double range = StatUtils.max(values) - min;
        return (values[index] - min) / (range + EPSILON);
    }

    private static AnomalyCluster toCluster(int id, List<AnomalyEvent> members) {
        double[] times = members.stream().mapToDouble(a -> a.getOnset().toEpochMilli()).toArray();
        double[] values = members.stream().mapToDouble(AnomalyEvent::getPeakValue).toArray();
        LinkedHashSet<String> seriesIds = new LinkedHashSet<>();
        members.stream()
                .sorted(Comparator.<AnomalyEvent, Instant>comparing(EvidenceSignal::getOnset).thenComparing(AnomalyEvent::getId))
                .forEach(m -> seriesIds.add(m.getSeriesId()));
        return AnomalyCluster.builder()
                .clusterId(id)
                .members(members)
                .centroidTimestamp(Instant.ofEpochMilli(Math.round(StatUtils.mean(times))))
                .centroidValue(StatUtils.mean(values))
                .seriesIds(seriesIds)
                .build();
    }

    private record AnomalyPoint(AnomalyEvent event, double time, double value) implements Clusterable {

        @Override
        public double[] getPoint() {
            return new double[]{time, value};
        }
    }
}
