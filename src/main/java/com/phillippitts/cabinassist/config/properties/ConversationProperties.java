package com.phillippitts.cabinassist.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the conversation loop and state machine.
 */
@Validated
@ConfigurationProperties(prefix = "conversation")
public class ConversationProperties {

    /** Transcriptions below this confidence are answered with a clarification prompt. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.7;

    /** Fixed delay between steady-state loop iterations. */
    @NotNull
    private Duration tickInterval = Duration.ofMillis(100);

    /** Pause applied to the loop after a non-critical error. */
    @NotNull
    private Duration errorBackoff = Duration.ofSeconds(1);

    /** Listening with no utterance for this long ends the conversation. */
    @NotNull
    private Duration listeningTimeout = Duration.ofSeconds(8);

    /** Conversation ends after this many user turns. */
    @Positive
    private int maxTurns = 10;

    @NotBlank
    private String acknowledgement = "I'm listening";

    @NotBlank
    private String clarificationPrompt = "I didn't catch that. Could you please repeat?";

    @NotBlank
    private String apology = "I'm sorry, I encountered an error. Please try again.";

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getErrorBackoff() {
        return errorBackoff;
    }

    public void setErrorBackoff(Duration errorBackoff) {
        this.errorBackoff = errorBackoff;
    }

    public Duration getListeningTimeout() {
        return listeningTimeout;
    }

    public void setListeningTimeout(Duration listeningTimeout) {
        this.listeningTimeout = listeningTimeout;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public void setMaxTurns(int maxTurns) {
        this.maxTurns = maxTurns;
    }

    public String getAcknowledgement() {
        return acknowledgement;
    }

    public void setAcknowledgement(String acknowledgement) {
        this.acknowledgement = acknowledgement;
    }

    public String getClarificationPrompt() {
        return clarificationPrompt;
    }

    public void setClarificationPrompt(String clarificationPrompt) {
        this.clarificationPrompt = clarificationPrompt;
    }

    public String getApology() {
        return apology;
    }

    public void setApology(String apology) {
        this.apology = apology;
    }
}
