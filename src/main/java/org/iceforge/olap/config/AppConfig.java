package org.iceforge.olap.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.iceforge.olap.engine.aggregate.AggregationEngine;
import org.iceforge.olap.engine.stats.StatisticsEngine;
import org.iceforge.olap.engine.timeseries.TimeSeriesEngine;
import org.iceforge.olap.engine.window.WindowEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(OlapProperties.class)
public class AppConfig {

    @Bean
    public ObjectMapper yamlObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public AggregationEngine aggregationEngine(OlapProperties props) {
        return new AggregationEngine(props.getNullOrdering());
    }

    @Bean
    public TimeSeriesEngine timeSeriesEngine(AggregationEngine aggregationEngine) {
        return new TimeSeriesEngine(aggregationEngine);
    }

    @Bean
    public WindowEngine windowEngine(OlapProperties props) {
        return new WindowEngine(props.getNullOrdering());
    }

    @Bean
    public StatisticsEngine statisticsEngine(OlapProperties props) {
        return new StatisticsEngine(props.getPercentileMethod(), props.getNullOrdering());
    }
}
