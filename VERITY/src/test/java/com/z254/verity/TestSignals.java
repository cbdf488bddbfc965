package com.z254.verity;

import com.z254.verity.domain.model.AnomalyEvent;
import com.z254.verity.domain.model.ChangeType;
import com.z254.verity.domain.model.LogBurst;
import com.z254.verity.domain.model.Query;
import com.z254.verity.domain.model.QueryKind;
import com.z254.verity.domain.model.Sample;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.TimeInterval;
import com.z254.verity.domain.model.TimeSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for series and evidence used across tests.
 */
public final class TestSignals {

    public static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private TestSignals() {
    }

    public static Instant at(long seconds) {
        return T0.plusSeconds(seconds);
    }

    public static List<Sample> samples(double... values) {
        List<Sample> samples = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            samples.add(new Sample(at(i), values[i]));
        }
        return samples;
    }

    public static TimeSeries series(String id, String service, double... values) {
        Query query = Query.builder()
                .id(id)
                .kind(QueryKind.METRIC)
                .expression("up")
                .service(service)
                .start(T0)
                .end(at(Math.max(0, values.length - 1)))
                .step(Duration.ofSeconds(1))
                .build();
        return TimeSeries.builder()
                .id(id)
                .query(query)
                .samples(samples(values))
                .build();
    }

    public static double[] constant(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    public static AnomalyEvent anomaly(String seriesId, long startSeconds, long endSeconds, Severity severity) {
        return AnomalyEvent.builder()
                .id(seriesId + "@" + at(startSeconds).toEpochMilli())
                .seriesId(seriesId)
                .service("checkout")
                .interval(new TimeInterval(at(startSeconds), at(endSeconds)))
                .severity(severity)
                .changeType(ChangeType.SPIKE)
                .score(4.0)
                .peakValue(1.0)
                .pointCount((int) (endSeconds - startSeconds + 1))
                .build();
    }

    public static LogBurst logBurst(String signalId, long startSeconds, long endSeconds, Severity severity) {
        return LogBurst.builder()
                .id(signalId + "@" + at(startSeconds).toEpochMilli())
                .signalId(signalId)
                .service("checkout")
                .interval(new TimeInterval(at(startSeconds), at(endSeconds)))
                .lineCount(50)
                .ratePerSecond(5.0)
                .baselineRate(0.3)
                .ratio(15.0)
                .severity(severity)
                .build();
    }
}
