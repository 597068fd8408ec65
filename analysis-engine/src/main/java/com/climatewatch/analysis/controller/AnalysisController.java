package com.climatewatch.analysis.controller;

import com.climatewatch.analysis.dto.CityReport;
import com.climatewatch.analysis.dto.DatasetSummary;
import com.climatewatch.analysis.dto.LiveCheckResult;
import com.climatewatch.analysis.service.AnalysisService;
import com.climatewatch.common.model.RollingStats;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/v1/analysis")
public class AnalysisController {

    public static final String API_KEY_HEADER = "X-Weather-Api-Key";

    private final AnalysisService service;

    public AnalysisController(AnalysisService service) {
        this.service = service;
    }

    @PostMapping(value = "/dataset", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public Mono<ResponseEntity<DatasetSummary>> loadDataset(@RequestBody String csv) {
        return service.loadDataset(csv)
            .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/dataset", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<DatasetSummary>> uploadDataset(@RequestPart("file") FilePart file) {
        return DataBufferUtils.join(file.content())
            .map(buffer -> {
                String csv = buffer.toString(StandardCharsets.UTF_8);
                DataBufferUtils.release(buffer);
                return csv;
            })
            .defaultIfEmpty("")
            .flatMap(service::loadDataset)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/dataset")
    public ResponseEntity<DatasetSummary> currentDataset() {
        return ResponseEntity.ok(service.currentDataset());
    }

    @GetMapping("/cities")
    public ResponseEntity<List<String>> cities() {
        return ResponseEntity.ok(service.cities());
    }

    @GetMapping("/cities/{city}")
    public ResponseEntity<CityReport> cityReport(@PathVariable String city) {
        return ResponseEntity.ok(service.cityReport(city));
    }

    @GetMapping("/cities/{city}/anomalies")
    public ResponseEntity<List<RollingStats>> anomalies(@PathVariable String city) {
        return ResponseEntity.ok(service.anomalies(city));
    }

    @GetMapping("/cities/{city}/live")
    public Mono<ResponseEntity<LiveCheckResult>> checkLive(
            @PathVariable String city,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {
        return service.checkLive(city, apiKey)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
