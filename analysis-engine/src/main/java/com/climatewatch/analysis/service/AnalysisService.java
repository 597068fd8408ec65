package com.climatewatch.analysis.service;

import com.climatewatch.analysis.client.LiveTemperatureProvider;
import com.climatewatch.analysis.dto.CityReport;
import com.climatewatch.analysis.dto.DatasetSummary;
import com.climatewatch.analysis.dto.LiveCheckResult;
import com.climatewatch.analysis.exception.NoDatasetException;
import com.climatewatch.analysis.exception.UnknownCityException;
import com.climatewatch.analysis.ingest.CsvDatasetReader;
import com.climatewatch.common.analysis.ClimateAnalyzer;
import com.climatewatch.common.classifier.LiveClassifier;
import com.climatewatch.common.model.CityAnalysis;
import com.climatewatch.common.model.ClimateAnalysis;
import com.climatewatch.common.model.LiveVerdict;
import com.climatewatch.common.model.RawReading;
import com.climatewatch.common.model.RollingStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single active analysis snapshot.
 *
 * <p>An upload is parsed, validated and analyzed in full on the bounded-elastic
 * scheduler, then swapped in atomically; readers always see either the previous
 * or the new snapshot. A rejected upload leaves the previous snapshot in place.
 *
 * <p>The live check captures the snapshot before the weather fetch, so the
 * reading is classified against the baselines that were active when it was asked for.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final CsvDatasetReader reader;
    private final ClimateAnalyzer analyzer;
    private final LiveTemperatureProvider liveTemperatureProvider;
    private final AtomicReference<ActiveDataset> active = new AtomicReference<>();

    public AnalysisService(CsvDatasetReader reader, ClimateAnalyzer analyzer,
                           LiveTemperatureProvider liveTemperatureProvider) {
        this.reader = reader;
        this.analyzer = analyzer;
        this.liveTemperatureProvider = liveTemperatureProvider;
    }

    public Mono<DatasetSummary> loadDataset(String csv) {
        return Mono.fromCallable(() -> {
                List<RawReading> rows = reader.read(csv);
                ClimateAnalysis analysis = analyzer.analyze(rows);
                ActiveDataset dataset = new ActiveDataset(analysis, Instant.now());
                active.set(dataset);
                log.info("Dataset loaded. cities={} readings={} window={}",
                    analysis.cityNames().size(), analysis.readingCount(), analysis.window());
                return toSummary(dataset);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnError(e -> log.warn("Dataset rejected. err={}", e.getMessage()));
    }

    public DatasetSummary currentDataset() {
        return toSummary(requireDataset());
    }

    public List<String> cities() {
        return List.copyOf(requireDataset().analysis().cityNames());
    }

    public CityReport cityReport(String city) {
        return CityReport.from(requireCity(requireDataset().analysis(), city));
    }

    public List<RollingStats> anomalies(String city) {
        return requireCity(requireDataset().analysis(), city).rolling().anomalies();
    }

    /**
     * Fetches the current temperature of the city and classifies it against the
     * seasonal baseline of the active snapshot.
     */
    public Mono<LiveCheckResult> checkLive(String city, String apiKey) {
        return Mono.defer(() -> {
            ClimateAnalysis analysis = requireDataset().analysis();
            requireCity(analysis, city);

            return liveTemperatureProvider.fetch(city, apiKey)
                // the dataset's spelling of the city selects the baseline
                .map(live -> live.forCity(city))
                .map(live -> {
                    LiveVerdict verdict = LiveClassifier.classify(analysis.baselines(), live.toObservation());
                    log.info("Live check. city={} temperature={} season={} anomalous={}",
                        city, live.temperature(), verdict.season(), verdict.anomalous());
                    return new LiveCheckResult(live, verdict);
                });
        });
    }

    private ActiveDataset requireDataset() {
        ActiveDataset dataset = active.get();
        if (dataset == null) {
            throw new NoDatasetException();
        }
        return dataset;
    }

    private static CityAnalysis requireCity(ClimateAnalysis analysis, String city) {
        CityAnalysis cityAnalysis = analysis.city(city);
        if (cityAnalysis == null) {
            throw new UnknownCityException(city);
        }
        return cityAnalysis;
    }

    private static DatasetSummary toSummary(ActiveDataset dataset) {
        ClimateAnalysis analysis = dataset.analysis();
        return new DatasetSummary(List.copyOf(analysis.cityNames()), analysis.readingCount(),
            analysis.window(), dataset.loadedAt());
    }
}
