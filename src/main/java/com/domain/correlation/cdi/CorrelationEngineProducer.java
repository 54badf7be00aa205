package com.domain.correlation.cdi;

import com.domain.correlation.api.CorrelationEngine;
import com.domain.correlation.api.CorrelationOptions;
import com.domain.correlation.metrics.MetricsService;
import com.domain.correlation.metrics.NoOpMetricsService;
import com.domain.correlation.rules.DefaultNoiseRules;
import com.domain.correlation.rules.NoiseFilter;
import com.domain.correlation.rules.PlatformDenylist;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * CDI producer that wires the correlation engine from MicroProfile Config properties.
 *
 * <pre>
 * domain-correlation:
 *   group-size-cap: 50
 *   min-cluster-size: 2
 *   hub:
 *     top-n: 20
 *     percentile: 0.90
 *   noise-rules:
 *     enabled: true
 *   denylist:
 *     path: /etc/domain-correlation/denylist.txt
 * </pre>
 *
 * <p>A {@link MetricsService} bean is used when the container provides one.</p>
 */
@ApplicationScoped
public class CorrelationEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(CorrelationEngineProducer.class);

    @Inject
    @ConfigProperty(name = "domain-correlation.group-size-cap", defaultValue = "50")
    int groupSizeCap;

    @Inject
    @ConfigProperty(name = "domain-correlation.min-cluster-size", defaultValue = "2")
    int minClusterSize;

    @Inject
    @ConfigProperty(name = "domain-correlation.hub.top-n", defaultValue = "20")
    int hubTopN;

    @Inject
    @ConfigProperty(name = "domain-correlation.hub.percentile", defaultValue = "0.90")
    double hubPercentile;

    @Inject
    @ConfigProperty(name = "domain-correlation.noise-rules.enabled", defaultValue = "true")
    boolean noiseRulesEnabled;

    @Inject
    @ConfigProperty(name = "domain-correlation.denylist.path")
    Optional<String> denylistPath;

    @Inject
    Instance<MetricsService> metricsServices;

    @Produces
    @ApplicationScoped
    public CorrelationOptions correlationOptions() {
        NoiseFilter noiseFilter = noiseRulesEnabled ? DefaultNoiseRules.createDefaultFilter() : NoiseFilter.none();
        CorrelationOptions options = CorrelationOptions.builder()
                .groupSizeCap(groupSizeCap)
                .minClusterSize(minClusterSize)
                .hubTopN(hubTopN)
                .hubPercentile(hubPercentile)
                .noiseFilter(noiseFilter)
                .denylist(loadDenylist())
                .build();
        log.info("Producing CorrelationOptions: {}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public CorrelationEngine correlationEngine(CorrelationOptions options) {
        MetricsService metrics = resolveMetricsService();
        log.info("Producing CorrelationEngine: metrics={}", metrics.getClass().getSimpleName());
        return CorrelationEngine.builder()
                .options(options)
                .metricsService(metrics)
                .build();
    }

    private MetricsService resolveMetricsService() {
        if (metricsServices != null && metricsServices.isResolvable()) {
            return metricsServices.get();
        }
        return new NoOpMetricsService();
    }

    /**
     * Reads the configured denylist file, or returns an empty denylist when none is configured.
     *
     * @throws UncheckedIOException if the configured file cannot be read
     */
    PlatformDenylist loadDenylist() {
        if (denylistPath == null || denylistPath.isEmpty() || denylistPath.get().isBlank()) {
            return PlatformDenylist.empty();
        }
        Path path = Path.of(denylistPath.get());
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return PlatformDenylist.load(reader);
        } catch (IOException e) {
            log.error("Failed to read denylist from {}", path, e);
            throw new UncheckedIOException("Failed to read denylist: " + path, e);
        }
    }
}
