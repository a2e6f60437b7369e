package com.phillippitts.voicecapture.service.audio.quality;

/** Problems a {@link QualityReport} can flag for a finished recording. */
public enum QualityIssue {

    CLIPPING("Reduce input gain or move further from the microphone"),
    TOO_QUIET("Speak closer to the microphone or increase input gain"),
    TOO_MUCH_SILENCE("Pause recording between thoughts or enable silence trimming"),
    HIGH_NOISE("Record in a quieter environment or enable noise reduction"),
    POOR_QUALITY("Check the microphone connection and recording environment");

    private final String recommendation;

    QualityIssue(String recommendation) {
        this.recommendation = recommendation;
    }

    public String recommendation() {
        return recommendation;
    }
}
