package com.paygate.gateapi.config;

import com.paygate.domain.payment.Network;
import com.paygate.gateapi.gate.GateProperties;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import java.util.Arrays;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
  static final String SIGNATURE_PARAMETER = "paymentSignature";
  static final String NETWORK_PARAMETER = "paymentNetwork";

  @Bean
  public OpenAPI gateApiOpenApi(
      ObjectProvider<BuildProperties> buildPropertiesProvider, GateProperties gateProperties) {
    BuildProperties buildProperties = buildPropertiesProvider.getIfAvailable();
    String version = buildProperties != null ? buildProperties.getVersion() : null;

    StringSchema networks = new StringSchema();
    Arrays.stream(Network.values()).map(Network::wireName).forEach(networks::addEnumItem);

    return new OpenAPI()
        .info(
            new Info()
                .title(gateProperties.getServiceName())
                .version(version == null || version.isBlank() ? "unknown" : version)
                .description(
                    gateProperties.getDescription()
                        + " Costs "
                        + gateProperties.getPriceUsd().toPlainString()
                        + " USDC per request. Requests without a verified payment get HTTP 402"
                        + " with payment instructions."))
        .components(
            new Components()
                .addParameters(
                    SIGNATURE_PARAMETER,
                    new HeaderParameter()
                        .name(gateProperties.getSignatureHeader())
                        .description("Transaction signature or hash of the USDC payment")
                        .schema(new StringSchema()))
                .addParameters(
                    NETWORK_PARAMETER,
                    new HeaderParameter()
                        .name(gateProperties.getNetworkHeader())
                        .description(
                            "Network the payment was sent on, inferred from the id when absent")
                        .schema(networks)));
  }

  @Bean
  public GroupedOpenApi publicApiGroup() {
    return GroupedOpenApi.builder()
        .group("public")
        .pathsToMatch("/api/**", "/actuator/health")
        .build();
  }
}
