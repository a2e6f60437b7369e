package com.phillippitts.voicecapture.domain;

/**
 * Selects which signal-conditioning stages run over a finished recording.
 */
public enum QualityPreset {

    /** Trim leading and trailing silence only. */
    LOW(true, false, false, false),
    /** Trim silence and normalize loudness. */
    MEDIUM(true, false, true, false),
    /** Trim, noise gate, normalize, then remove low-frequency rumble. */
    HIGH(true, true, true, true);

    private final boolean silenceTrimming;
    private final boolean noiseReduction;
    private final boolean normalization;
    private final boolean highPassFilter;

    QualityPreset(boolean silenceTrimming, boolean noiseReduction, boolean normalization, boolean highPassFilter) {
        this.silenceTrimming = silenceTrimming;
        this.noiseReduction = noiseReduction;
        this.normalization = normalization;
        this.highPassFilter = highPassFilter;
    }

    public boolean silenceTrimming() { return silenceTrimming; }
    public boolean noiseReduction() { return noiseReduction; }
    public boolean normalization() { return normalization; }
    public boolean highPassFilter() { return highPassFilter; }
}
