package com.z254.verity.datasource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.verity.domain.model.Query;
import com.z254.verity.domain.model.QueryKind;
import com.z254.verity.domain.model.TimeSeries;
import com.z254.verity.exception.DataSourceException;
import com.z254.verity.exception.InvalidQueryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PrometheusResponseParser}.
 */
class PrometheusResponseParserTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Query QUERY = Query.builder().id("latency").kind(QueryKind.METRIC).expression("up").build();

    @Nested
    @DisplayName("Result types")
    class ResultTypeTests {

        @Test
        @DisplayName("should parse a matrix into series ordered by id")
        void matrix() throws Exception {
            List<TimeSeries> series = PrometheusResponseParser.parse(json("""
                    {"status":"success","data":{"resultType":"matrix","result":[
                      {"metric":{"pod":"b"},"values":[[1714557600,"1.5"],[1714557615,"NaN"]]},
                      {"metric":{"pod":"a"},"values":[[1714557615,"2"],[1714557600,"+Inf"]]}
                    ]}}
                    """), QUERY, "mimir");

            assertThat(series).extracting(TimeSeries::getId)
                    .containsExactly("latency{pod=a}", "latency{pod=b}");
            TimeSeries first = series.get(0);
            assertThat(first.getSamples()).hasSize(2);
            assertThat(first.getSamples().get(0).timestamp()).isEqualTo(Instant.ofEpochSecond(1714557600));
            assertThat(first.getSamples().get(0).value()).isEqualTo(Double.POSITIVE_INFINITY);
            assertThat(series.get(1).getSamples().get(1).value()).isNaN();
            assertThat(first.getQuery()).isSameAs(QUERY);
        }

        @Test
        @DisplayName("should parse a vector into single-sample series")
        void vector() throws Exception {
            List<TimeSeries> series = PrometheusResponseParser.parse(json("""
                    {"status":"success","data":{"resultType":"vector","result":[
                      {"metric":{},"value":[1714557600.5,"42"]}
                    ]}}
                    """), QUERY, "mimir");

            assertThat(series).singleElement().satisfies(ts -> {
                assertThat(ts.getId()).isEqualTo("latency");
                assertThat(ts.getSamples()).singleElement()
                        .satisfies(s -> assertThat(s.timestamp()).isEqualTo(Instant.ofEpochMilli(1714557600500L)));
            });
        }

        @Test
        @DisplayName("should return no series for an empty result")
        void emptyResult() throws Exception {
            assertThat(PrometheusResponseParser.parse(json("""
                    {"status":"success","data":{"resultType":"matrix","result":[]}}
                    """), QUERY, "mimir")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("should raise an invalid query for error bodies")
        void errorStatus() throws Exception {
            JsonNode body = json("""
                    {"status":"error","errorType":"bad_data","error":"parse error at char 3"}
                    """);

            assertThatThrownBy(() -> PrometheusResponseParser.parse(body, QUERY, "mimir"))
                    .isInstanceOf(InvalidQueryException.class)
                    .hasMessageContaining("bad_data")
                    .hasMessageContaining("parse error");
        }

        @Test
        @DisplayName("should reject unknown result types")
        void unknownType() throws Exception {
            JsonNode body = json("""
                    {"status":"success","data":{"resultType":"string","result":[1,"x"]}}
                    """);

            assertThatThrownBy(() -> PrometheusResponseParser.parse(body, QUERY, "mimir"))
                    .isInstanceOf(DataSourceException.class)
                    .hasMessageContaining("Unsupported result type");
        }
    }

    private static JsonNode json(String body) throws Exception {
        return MAPPER.readTree(body);
    }
}
