package com.paygate.gateapi.config;

import com.paygate.gateapi.api.PaymentInstructionsFactory;
import com.paygate.gateapi.gate.GateMetrics;
import com.paygate.gateapi.gate.GateProperties;
import com.paygate.gateapi.gate.PaymentClaimExtractor;
import com.paygate.gateapi.gate.PaymentGateOrchestrator;
import com.paygate.gateapi.ratelimit.ClientIdentityResolver;
import com.paygate.gateapi.ratelimit.FixedWindowRateLimiter;
import com.paygate.gateapi.ratelimit.InMemoryRateWindowStore;
import com.paygate.gateapi.ratelimit.RateLimitProperties;
import com.paygate.gateapi.ratelimit.RateWindowStore;
import com.paygate.gateapi.replay.InMemoryReplayStore;
import com.paygate.gateapi.replay.ReplayGuard;
import com.paygate.gateapi.replay.ReplayStore;
import com.paygate.gateapi.run.TargetUrlPreflight;
import com.paygate.gateapi.run.WebFetchService;
import com.paygate.integration.chain.ChainVerifierRegistry;
import com.paygate.integration.fetch.FetchProperties;
import com.paygate.integration.fetch.OutboundFetchClient;
import com.paygate.integration.fetch.SsrfGuard;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({GateProperties.class, RateLimitProperties.class})
public class GateConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock gateClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public RateWindowStore rateWindowStore() {
    return new InMemoryRateWindowStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public FixedWindowRateLimiter fixedWindowRateLimiter(
      RateWindowStore rateWindowStore, RateLimitProperties properties, Clock gateClock) {
    return new FixedWindowRateLimiter(rateWindowStore, properties, gateClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public ClientIdentityResolver clientIdentityResolver(RateLimitProperties properties) {
    return new ClientIdentityResolver(properties.isTrustForwardedFor());
  }

  @Bean
  @ConditionalOnMissingBean
  public ReplayStore replayStore() {
    return new InMemoryReplayStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public ReplayGuard replayGuard(ReplayStore replayStore, Clock gateClock) {
    return new ReplayGuard(replayStore, gateClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public PaymentClaimExtractor paymentClaimExtractor(GateProperties properties) {
    return new PaymentClaimExtractor(properties.getSignatureHeader(), properties.getNetworkHeader());
  }

  @Bean
  @ConditionalOnMissingBean
  public GateMetrics gateMetrics(MeterRegistry meterRegistry) {
    return new GateMetrics(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public PaymentGateOrchestrator paymentGateOrchestrator(
      FixedWindowRateLimiter rateLimiter,
      PaymentClaimExtractor claimExtractor,
      ChainVerifierRegistry chainVerifierRegistry,
      ReplayGuard replayGuard,
      GateProperties properties,
      GateMetrics gateMetrics) {
    return new PaymentGateOrchestrator(
        rateLimiter, claimExtractor, chainVerifierRegistry, replayGuard, properties, gateMetrics);
  }

  @Bean
  @ConditionalOnMissingBean
  public TargetUrlPreflight targetUrlPreflight(SsrfGuard ssrfGuard) {
    return new TargetUrlPreflight(ssrfGuard);
  }

  @Bean
  @ConditionalOnMissingBean
  public WebFetchService webFetchService(
      OutboundFetchClient outboundFetchClient,
      GateProperties gateProperties,
      FetchProperties fetchProperties) {
    return new WebFetchService(
        outboundFetchClient,
        gateProperties.getMaxTextLength(),
        fetchProperties.getProxy().getCountry());
  }

  @Bean
  @ConditionalOnMissingBean
  public PaymentInstructionsFactory paymentInstructionsFactory(
      GateProperties properties, ChainVerifierRegistry chainVerifierRegistry) {
    return new PaymentInstructionsFactory(properties, chainVerifierRegistry);
  }
}
