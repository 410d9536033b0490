package com.paygate.gateapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paygate.domain.payment.PaymentAmountPolicy;
import com.paygate.integration.chain.BaseChainVerifier;
import com.paygate.integration.chain.ChainRpcConfig;
import com.paygate.integration.chain.ChainRpcProperties;
import com.paygate.integration.chain.ChainVerifier;
import com.paygate.integration.chain.ChainVerifierRegistry;
import com.paygate.integration.chain.HttpJsonRpcClient;
import com.paygate.integration.chain.SolanaChainVerifier;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ChainRpcProperties.class)
public class ChainVerifierConfiguration {
  private static final Logger log = LoggerFactory.getLogger(ChainVerifierConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public PaymentAmountPolicy paymentAmountPolicy() {
    return new PaymentAmountPolicy();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(
      prefix = "chain.solana",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public SolanaChainVerifier solanaChainVerifier(
      ChainRpcProperties properties,
      ObjectMapper objectMapper,
      PaymentAmountPolicy paymentAmountPolicy,
      MeterRegistry meterRegistry) {
    ChainRpcProperties.Solana solana = properties.getSolana();
    return new SolanaChainVerifier(
        rpcClient(solana.toConfig(), objectMapper),
        solana.getUsdcMint(),
        paymentAmountPolicy,
        meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(
      prefix = "chain.base",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public BaseChainVerifier baseChainVerifier(
      ChainRpcProperties properties,
      ObjectMapper objectMapper,
      PaymentAmountPolicy paymentAmountPolicy,
      MeterRegistry meterRegistry) {
    ChainRpcProperties.Base base = properties.getBase();
    return new BaseChainVerifier(
        rpcClient(base.toConfig(), objectMapper),
        base.getUsdcContract(),
        paymentAmountPolicy,
        meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public ChainVerifierRegistry chainVerifierRegistry(ObjectProvider<ChainVerifier> verifiers) {
    List<ChainVerifier> enabled = verifiers.orderedStream().toList();
    if (enabled.isEmpty()) {
      log.warn("no chain verifiers enabled, every payment will be denied");
    }
    return new ChainVerifierRegistry(enabled);
  }

  private static HttpJsonRpcClient rpcClient(ChainRpcConfig config, ObjectMapper objectMapper) {
    HttpClient httpClient = HttpClient.newBuilder().connectTimeout(config.timeout()).build();
    return new HttpJsonRpcClient(httpClient, objectMapper, config);
  }
}
