/**
 * Ports to the speech-to-text collaborator and its settings.
 *
 * <p>{@link com.phillippitts.voicecapture.service.transcription.TranscriptionClient} is the only
 * network-facing seam; the application ships
 * {@link com.phillippitts.voicecapture.service.transcription.UnconfiguredTranscriptionClient}
 * until a real client bean is provided.
 *
 * @since 1.1
 */
package com.phillippitts.voicecapture.service.transcription;
