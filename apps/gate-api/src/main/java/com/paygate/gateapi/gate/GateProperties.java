package com.paygate.gateapi.gate;

import com.paygate.domain.payment.Network;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "gate")
public class GateProperties {
  private String serviceName = "web-scraper";
  private String walletAddress = "";
  private String solanaWalletAddress = "";
  @NotNull @Positive private BigDecimal priceUsd = new BigDecimal("0.005");
  private String description =
      "Fetch any webpage through a real 4G/5G mobile IP. Returns clean text content.";
  private String endpoint = "/api/run";
  @NotBlank private String signatureHeader = "X-Payment-Signature";
  @NotBlank private String networkHeader = "X-Payment-Network";
  @Min(1)
  private int maxTextLength = 50_000;

  public String requireWalletAddress() {
    if (walletAddress == null || walletAddress.isBlank()) {
      throw new GateMisconfiguredException("Service misconfigured: WALLET_ADDRESS not set");
    }
    return walletAddress.trim();
  }

  public String recipientFor(Network network) {
    if (network == Network.SOLANA && solanaWalletAddress != null && !solanaWalletAddress.isBlank()) {
      return solanaWalletAddress.trim();
    }
    return requireWalletAddress();
  }

  public String getServiceName() {
    return serviceName;
  }

  public void setServiceName(String serviceName) {
    this.serviceName = serviceName;
  }

  public String getWalletAddress() {
    return walletAddress;
  }

  public void setWalletAddress(String walletAddress) {
    this.walletAddress = walletAddress;
  }

  public String getSolanaWalletAddress() {
    return solanaWalletAddress;
  }

  public void setSolanaWalletAddress(String solanaWalletAddress) {
    this.solanaWalletAddress = solanaWalletAddress;
  }

  public BigDecimal getPriceUsd() {
    return priceUsd;
  }

  public void setPriceUsd(BigDecimal priceUsd) {
    this.priceUsd = priceUsd;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public void setEndpoint(String endpoint) {
    this.endpoint = endpoint;
  }

  public String getSignatureHeader() {
    return signatureHeader;
  }

  public void setSignatureHeader(String signatureHeader) {
    this.signatureHeader = signatureHeader;
  }

  public String getNetworkHeader() {
    return networkHeader;
  }

  public void setNetworkHeader(String networkHeader) {
    this.networkHeader = networkHeader;
  }

  public int getMaxTextLength() {
    return maxTextLength;
  }

  public void setMaxTextLength(int maxTextLength) {
    this.maxTextLength = maxTextLength;
  }
}
