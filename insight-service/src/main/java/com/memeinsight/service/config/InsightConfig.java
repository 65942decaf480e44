package com.memeinsight.service.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.memeinsight.common.alert.OperatorAlertSink;
import com.memeinsight.common.extraction.SymbolCatalog;
import com.memeinsight.common.extraction.TickerExtractor;
import com.memeinsight.marketdata.cache.FetchCache;
import com.memeinsight.marketdata.service.MarketDataService;
import com.memeinsight.marketdata.source.PostSource;
import com.memeinsight.marketdata.source.PriceBarSource;
import com.memeinsight.marketdata.source.ShortAvailabilitySource;
import com.memeinsight.service.api.InsightService;
import com.memeinsight.service.engine.PollCoordinator;
import com.memeinsight.service.engine.SourceSuspensions;
import com.memeinsight.service.logger.CycleFlowLogger;
import com.memeinsight.service.registry.TickerRegistry;
import com.memeinsight.service.scheduler.PollScheduler;
import com.memeinsight.service.store.HistoricalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Engine wiring. {@link InsightProperties} is validated here, so a bad configuration
 * stops the application before any cycle runs.
 */
@Configuration
@EnableConfigurationProperties(InsightProperties.class)
public class InsightConfig {

    private static final Logger log = LoggerFactory.getLogger(InsightConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Adjusts Boot's own mapper so its defaults stay in place. ISO-8601 instants on the wire. */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer insightJacksonCustomizer() {
        return builder -> builder
            .modulesToInstall(JavaTimeModule.class)
            .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public RuntimeSettings runtimeSettings(InsightProperties properties) {
        EngineSettings settings = properties.toSettings();
        log.info("Engine settings loaded. subreddits={} updateInterval={} minPosts={} minKarma={} weights={}",
            settings.subreddits(), settings.updateInterval(), settings.minPosts(), settings.minKarma(),
            settings.weights());
        return new RuntimeSettings(settings);
    }

    @Bean
    public SymbolCatalog symbolCatalog(InsightProperties properties) {
        return SymbolCatalog.defaults().withExtraSymbols(properties.getExtraSymbols());
    }

    @Bean
    public TickerExtractor tickerExtractor(SymbolCatalog symbolCatalog) {
        return TickerExtractor.from(symbolCatalog);
    }

    @Bean
    public FetchCache fetchCache(Clock clock, InsightProperties properties) {
        return new FetchCache(clock, properties.toFetchPolicy());
    }

    @Bean
    public MarketDataService marketDataService(FetchCache fetchCache, InsightProperties properties,
                                               PostSource postSource, PriceBarSource priceBarSource,
                                               ShortAvailabilitySource shortAvailabilitySource) {
        return new MarketDataService(fetchCache, properties.toCacheTtls(), postSource, priceBarSource,
            shortAvailabilitySource);
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler commitScheduler() {
        return Schedulers.newSingle("insight-commit");
    }

    @Bean
    public HistoricalStore historicalStore() {
        return new HistoricalStore();
    }

    @Bean
    public TickerRegistry tickerRegistry() {
        return new TickerRegistry();
    }

    @Bean
    public SourceSuspensions sourceSuspensions(OperatorAlertSink operatorAlertSink, Clock clock) {
        return new SourceSuspensions(operatorAlertSink, clock);
    }

    @Bean
    public CycleFlowLogger cycleFlowLogger() {
        return new CycleFlowLogger();
    }

    @Bean
    public PollCoordinator pollCoordinator(MarketDataService marketDataService, TickerExtractor tickerExtractor,
                                           SymbolCatalog symbolCatalog, HistoricalStore historicalStore,
                                           TickerRegistry tickerRegistry, RuntimeSettings runtimeSettings,
                                           SourceSuspensions sourceSuspensions, CycleFlowLogger cycleFlowLogger,
                                           Clock clock, @Qualifier("commitScheduler") Scheduler commitScheduler) {
        return new PollCoordinator(marketDataService, tickerExtractor, symbolCatalog, historicalStore,
            tickerRegistry, runtimeSettings, sourceSuspensions, cycleFlowLogger, clock, commitScheduler);
    }

    @Bean
    public PollScheduler pollScheduler(PollCoordinator pollCoordinator, RuntimeSettings runtimeSettings,
                                       InsightProperties properties) {
        return new PollScheduler(pollCoordinator, runtimeSettings, properties.getScheduler().isEnabled(),
            properties.getScheduler().getInitialDelay());
    }

    @Bean
    public InsightService insightService(PollCoordinator pollCoordinator, MarketDataService marketDataService,
                                         RuntimeSettings runtimeSettings, SourceSuspensions sourceSuspensions) {
        return new InsightService(pollCoordinator, marketDataService, runtimeSettings, sourceSuspensions);
    }
}
