package com.paygate.integration.chain;

import java.net.URI;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chain")
public class ChainRpcProperties {
  private Solana solana = new Solana();
  private Base base = new Base();

  public Solana getSolana() {
    return solana;
  }

  public void setSolana(Solana solana) {
    this.solana = solana;
  }

  public Base getBase() {
    return base;
  }

  public void setBase(Base base) {
    this.base = base;
  }

  public static class Solana {
    private boolean enabled = true;
    private String rpcUrl = "https://api.mainnet-beta.solana.com";
    private String usdcMint = SolanaChainVerifier.USDC_MINT;
    private long timeoutMs = 10000L;

    public ChainRpcConfig toConfig() {
      return new ChainRpcConfig(URI.create(rpcUrl.trim()), Duration.ofMillis(timeoutMs));
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getRpcUrl() {
      return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
      this.rpcUrl = rpcUrl;
    }

    public String getUsdcMint() {
      return usdcMint;
    }

    public void setUsdcMint(String usdcMint) {
      this.usdcMint = usdcMint;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }

  public static class Base {
    private boolean enabled = true;
    private String rpcUrl = "https://mainnet.base.org";
    private String usdcContract = BaseChainVerifier.USDC_CONTRACT;
    private long timeoutMs = 10000L;

    public ChainRpcConfig toConfig() {
      return new ChainRpcConfig(URI.create(rpcUrl.trim()), Duration.ofMillis(timeoutMs));
    }

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getRpcUrl() {
      return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
      this.rpcUrl = rpcUrl;
    }

    public String getUsdcContract() {
      return usdcContract;
    }

    public void setUsdcContract(String usdcContract) {
      this.usdcContract = usdcContract;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }
}
