package com.watchwise.backend.pairing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.pairing")
public class PairingProperties {

    /** digits per code */
    private int codeLength = 6;

    /** how long a code can be submitted */
    private Duration codeTtl = Duration.ofMinutes(10);

    /** tries to avoid digits another live code already holds */
    private int generationAttempts = 5;

    /** codes older than this are purged regardless of state */
    private Duration staleAfter = Duration.ofHours(24);

    /** retries when a concurrent pairing transaction lost */
    private int maxPairAttempts = 3;

    public int getCodeLength() { return codeLength; }
    public void setCodeLength(int codeLength) { this.codeLength = codeLength; }

    public Duration getCodeTtl() { return codeTtl; }
    public void setCodeTtl(Duration codeTtl) { this.codeTtl = codeTtl; }

    public int getGenerationAttempts() { return generationAttempts; }
    public void setGenerationAttempts(int generationAttempts) { this.generationAttempts = generationAttempts; }

    public Duration getStaleAfter() { return staleAfter; }
    public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }

    public int getMaxPairAttempts() { return maxPairAttempts; }
    public void setMaxPairAttempts(int maxPairAttempts) { this.maxPairAttempts = maxPairAttempts; }
}
