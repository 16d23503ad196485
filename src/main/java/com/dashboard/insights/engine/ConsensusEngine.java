package com.dashboard.insights.engine;

import com.dashboard.insights.config.MetricsConfig;
import com.dashboard.insights.exception.AnalysisException;
import com.dashboard.insights.exception.AnalysisFailedException;
import com.dashboard.insights.model.AnomalyDetectionResult;
import com.dashboard.insights.model.AnomalySummary;
import com.dashboard.insights.model.DetectorFlag;
import com.dashboard.insights.model.DetectorId;
import com.dashboard.insights.model.DetectorOutput;
import com.dashboard.insights.model.DetectorType;
import com.dashboard.insights.model.FeatureMatrix;
import com.dashboard.insights.model.IqrBounds;
import com.dashboard.insights.model.MethodFailure;
import com.dashboard.insights.model.ObservationSeries;
import com.dashboard.insights.model.RowAnomalies;
import com.dashboard.insights.model.SeriesTable;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs every registered detector over a dataset and combines their flags into one
 * verdict per row. A row is a consensus anomaly when at least
 * {@link #CONSENSUS_THRESHOLD} detectors flag it.
 *
 * Each detector runs in isolation: a failing detector is reported in the summary and
 * contributes no flags, and the others still run.
 */
@Component
public class ConsensusEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsensusEngine.class);

    public static final int CONSENSUS_THRESHOLD = 2;

    private final Map<DetectorType, UnivariateDetector> univariateDetectors;
    private final Map<DetectorType, MultivariateDetector> multivariateDetectors;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public ConsensusEngine(List<UnivariateDetector> univariate, List<MultivariateDetector> multivariate,
                           Tracer tracer, MetricsConfig metricsConfig) {
        this.univariateDetectors = new EnumMap<>(DetectorType.class);
        this.multivariateDetectors = new EnumMap<>(DetectorType.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all detector implementations
        for (UnivariateDetector detector : univariate) {
            univariateDetectors.put(detector.getDetectorType(), detector);
            log.info("Registered detector: {} -> {}",
                    detector.getDetectorType(), detector.getClass().getSimpleName());
        }
        for (MultivariateDetector detector : multivariate) {
            multivariateDetectors.put(detector.getDetectorType(), detector);
            log.info("Registered detector: {} -> {}",
                    detector.getDetectorType(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Run all detectors and build the per-row consensus.
     *
     * @throws AnalysisFailedException if no detector produced a result
     */
    @Observed(name = "detectors.run_all", contextualName = "run-all-detectors")
    public AnomalyDetectionResult detect(SeriesTable table) {
        List<DetectorOutput> outputs = new ArrayList<>();
        List<MethodFailure> failures = new ArrayList<>();

        for (MultivariateDetector detector : multivariateDetectors.values()) {
            DetectorId id = DetectorId.multivariate(detector.getDetectorType());
            run(id, () -> detector.detect(FeatureMatrix.fromColumns(table.columns())), outputs, failures);
        }
        for (ObservationSeries column : table.columns()) {
            for (UnivariateDetector detector : univariateDetectors.values()) {
                if (!detector.appliesTo(table.isOrdered())) {
                    continue;
                }
                DetectorId id = DetectorId.univariate(detector.getDetectorType(), column.getName());
                run(id, () -> detector.detect(column), outputs, failures);
            }
        }

        if (outputs.isEmpty()) {
            throw new AnalysisFailedException("No anomaly detector produced a result", failures);
        }

        int rowCount = table.rowCount();
        List<RowAnomalies> rows = new ArrayList<>(rowCount);
        long consensusCount = 0;
        for (int i = 0; i < rowCount; i++) {
            Map<DetectorId, DetectorFlag> flags = new LinkedHashMap<>();
            int votes = 0;
            int applicable = 0;
            for (DetectorOutput output : outputs) {
                DetectorFlag flag = output.flags().get(i);
                flags.put(output.id(), flag);
                if (flag.applicable()) applicable++;
                if (flag.flagged()) votes++;
            }
            boolean consensus = votes >= CONSENSUS_THRESHOLD;
            if (consensus) consensusCount++;
            rows.add(RowAnomalies.builder()
                    .index(i)
                    .timestamp(table.timestampAt(i))
                    .flags(flags)
                    .voteCount(votes)
                    .applicableCount(applicable)
                    .consensus(consensus)
                    .build());
        }

        metricsConfig.recordDetection(rowCount, consensusCount);

        return AnomalyDetectionResult.builder()
                .rows(rows)
                .summary(summarize(rowCount, consensusCount, outputs, failures))
                .analyzedAt(System.currentTimeMillis())
                .build();
    }

    private void run(DetectorId id, Supplier<DetectorOutput> detection,
                     List<DetectorOutput> outputs, List<MethodFailure> failures) {
        Span span = tracer.nextSpan()
                .name("detector.run." + id.type())
                .tag("detector.type", id.type().name())
                .tag("detector.column", id.column() == null ? "*" : id.column())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            DetectorOutput output = detection.get();
            outputs.add(output);
            long flagged = output.flaggedCount();
            span.tag("detector.flagged", String.valueOf(flagged));
            metricsConfig.recordDetectorFlags(id.type().name(), flagged);
            log.debug("Detector {} flagged {} of {} rows", id, flagged, output.flags().size());
        } catch (AnalysisException e) {
            span.error(e);
            log.warn("Detector {} could not run: {}", id, e.getMessage());
            failures.add(new MethodFailure(id.label(), e.getMessage()));
            metricsConfig.recordDetectorFailure(id.type().name());
        } catch (RuntimeException e) {
            span.error(e);
            log.error("Error running detector {}: {}", id, e.getMessage(), e);
            // Don't let one bad detector block the entire run
            failures.add(new MethodFailure(id.label(), e.getClass().getSimpleName() + ": " + e.getMessage()));
            metricsConfig.recordDetectorFailure(id.type().name());
        } finally {
            span.end();
        }
    }

    private AnomalySummary summarize(int rowCount, long consensusCount,
                                     List<DetectorOutput> outputs, List<MethodFailure> failures) {
        Map<String, Long> methodCounts = new LinkedHashMap<>();
        Map<String, IqrBounds> iqrBounds = new LinkedHashMap<>();
        List<String> methodsRun = new ArrayList<>();
        for (DetectorOutput output : outputs) {
            methodCounts.put(output.id().label(), output.flaggedCount());
            methodsRun.add(output.id().label());
            if (output.bounds() != null) {
                iqrBounds.put(output.id().column(), output.bounds());
            }
        }
        return AnomalySummary.builder()
                .totalRecords(rowCount)
                .methodCounts(methodCounts)
                .consensusAnomalies(consensusCount)
                .iqrBounds(iqrBounds)
                .methodsRun(methodsRun)
                .failedMethods(List.copyOf(failures))
                .build();
    }
}
