package com.dashboard.insights.service;

import com.dashboard.insights.engine.ConsensusEngine;
import com.dashboard.insights.model.AnomalyDetectionResult;
import com.dashboard.insights.model.Dataset;
import com.dashboard.insights.model.SeriesTable;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for consensus anomaly detection.
 *
 * Flow:
 * 1. Parse and (when dated) sort the dataset
 * 2. Run every detector through the ConsensusEngine
 * 3. Log the outcome, including any detectors that failed
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DatasetReader datasetReader;
    private final ConsensusEngine consensusEngine;

    public AnomalyDetectionService(DatasetReader datasetReader, ConsensusEngine consensusEngine) {
        this.datasetReader = datasetReader;
        this.consensusEngine = consensusEngine;
    }

    @Observed(name = "anomaly.detect", contextualName = "detect-anomalies")
    public AnomalyDetectionResult detect(Dataset dataset) {
        SeriesTable table = datasetReader.read(dataset);
        AnomalyDetectionResult result = consensusEngine.detect(table);

        log.info("Anomaly detection over {} rows x {} columns: {} consensus anomalies, {} methods run, {} failed",
                table.rowCount(), table.columns().size(),
                result.getSummary().getConsensusAnomalies(),
                result.getSummary().getMethodsRun().size(),
                result.getSummary().getFailedMethods().size());
        return result;
    }
}
