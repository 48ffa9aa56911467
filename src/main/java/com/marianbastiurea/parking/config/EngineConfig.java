package com.marianbastiurea.parking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marianbastiurea.parking.domain.model.Facility;
import com.marianbastiurea.parking.domain.policy.PolicyFactory;
import com.marianbastiurea.parking.domain.scoring.ModelBundle;
import com.marianbastiurea.parking.domain.scoring.ModelScoringAdapter;
import com.marianbastiurea.parking.domain.scoring.ScoringAdapter;
import com.marianbastiurea.parking.domain.scoring.StateDiscretizer;
import com.marianbastiurea.parking.domain.scoring.TimeLimitedScoringAdapter;
import com.marianbastiurea.parking.domain.services.AllocationService;
import com.marianbastiurea.parking.domain.services.SimulationRunner;
import com.marianbastiurea.parking.infrastructure.model.ModelBundleLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/** Wires the allocation engine: facility, trained models, scoring, policies and the runner. */
@Configuration(proxyBeanMethods = false)
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Facility facility(@Value("${parking.facility.num-bays:4}") int numBays,
                             @Value("${parking.facility.slots-per-bay:10}") int slotsPerBay) {
        Facility facility = new Facility(numBays, slotsPerBay);
        log.info("Facility configured: {} bays x {} slots = {} cells", numBays, slotsPerBay, facility.capacity());
        return facility;
    }

    @Bean
    public ModelBundleLoader modelBundleLoader(ObjectMapper mapper) {
        return new ModelBundleLoader(mapper);
    }

    @Bean
    public ModelBundle modelBundle(ModelBundleLoader loader,
                                   ResourceLoader resources,
                                   @Value("${parking.model.location:classpath:models/parking-model.json}") String location) {
        return loader.load(resources.getResource(location));
    }

    @Bean
    public StateDiscretizer stateDiscretizer(@Value("${parking.learned.occupancy-buckets:5}") int buckets) {
        return new StateDiscretizer(buckets);
    }

    @Bean
    public ScoringAdapter scoringAdapter(Facility facility,
                                         ModelBundle models,
                                         StateDiscretizer discretizer,
                                         @Qualifier("scoringExecutor") ExecutorService executor,
                                         @Value("${parking.learned.candidate-limit:5}") int candidateLimit,
                                         @Value("${parking.scoring.timeout-ms:250}") long timeoutMs) {
        ScoringAdapter modelScoring = new ModelScoringAdapter(facility, models, discretizer, candidateLimit);
        log.info("Scoring adapter ready (candidateLimit={}, timeoutMs={})", candidateLimit, timeoutMs);
        return new TimeLimitedScoringAdapter(modelScoring, executor, Duration.ofMillis(timeoutMs));
    }

    @Bean
    public PolicyFactory policyFactory(ScoringAdapter scoring,
                                       Clock clock,
                                       @Value("${parking.learned.blend-weight:0.3}") double blendWeight,
                                       @Value("${parking.random.seed:42}") long randomSeed) {
        return new PolicyFactory(scoring, blendWeight, randomSeed, clock);
    }

    @Bean
    public SimulationRunner simulationRunner(Clock clock, @Value("${parking.grid.fill-seed:7}") long fillSeed) {
        return new SimulationRunner(fillSeed, clock);
    }

    @Bean
    public ApplicationRunner liveGridBootstrap(AllocationService service) {
        return args -> {
            long t0 = System.nanoTime();
            int replayed = service.rebuildLiveGrid();
            log.info("Live grid rebuilt in {} ms ({} active allocation(s) replayed).",
                    (System.nanoTime() - t0) / 1_000_000, replayed);
        };
    }
}
