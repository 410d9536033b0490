package com.paygate.gateapi.config;

import com.paygate.integration.fetch.FetchPolicy;
import com.paygate.integration.fetch.FetchProperties;
import com.paygate.integration.fetch.OutboundFetchClient;
import com.paygate.integration.fetch.ProxiedHttpClientFactory;
import com.paygate.integration.fetch.SsrfGuard;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FetchProperties.class)
public class FetchClientConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public FetchPolicy fetchPolicy(FetchProperties properties) {
    return properties.toPolicy();
  }

  @Bean
  @ConditionalOnMissingBean
  public SsrfGuard ssrfGuard(FetchPolicy fetchPolicy) {
    return new SsrfGuard(fetchPolicy);
  }

  @Bean
  @ConditionalOnMissingBean
  public OutboundFetchClient outboundFetchClient(
      FetchProperties properties,
      FetchPolicy fetchPolicy,
      SsrfGuard ssrfGuard,
      MeterRegistry meterRegistry) {
    return new OutboundFetchClient(
        ProxiedHttpClientFactory.create(properties.getProxy(), fetchPolicy.timeout()),
        fetchPolicy,
        ssrfGuard,
        meterRegistry);
  }
}
