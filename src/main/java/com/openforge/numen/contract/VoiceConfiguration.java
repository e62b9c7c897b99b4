package com.openforge.numen.contract;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * TTS/STT settings. Required when the agent type is {@code voice}; the
 * runtime only stores and validates it, the voice transport reads it.
 */
@Builder(toBuilder = true)
public record VoiceConfiguration(
        String provider,
        String voiceId,
        String language,
        Double speed,
        Double pitch,
        Double stability,
        Double similarityBoost,
        String sttProvider,
        String sttModel,
        String sttLanguage,
        Boolean vadEnabled
) {

    public VoiceConfiguration withDefaults() {
        return new VoiceConfiguration(
                provider != null ? provider : "elevenlabs",
                voiceId,
                language != null ? language : "en-US",
                speed != null ? speed : 1.0,
                pitch != null ? pitch : 1.0,
                stability != null ? stability : 0.75,
                similarityBoost != null ? similarityBoost : 0.75,
                sttProvider != null ? sttProvider : "deepgram",
                sttModel != null ? sttModel : "nova-2",
                sttLanguage != null ? sttLanguage : "en",
                vadEnabled != null ? vadEnabled : Boolean.TRUE);
    }

    List<String> violations() {
        List<String> out = new ArrayList<>();
        if (voiceId == null || voiceId.isBlank()) out.add("voice.voice_id is required");
        checkRange(out, "voice.speed", speed, 0.5, 2.0);
        checkRange(out, "voice.pitch", pitch, 0.5, 2.0);
        checkRange(out, "voice.stability", stability, 0.0, 1.0);
        checkRange(out, "voice.similarity_boost", similarityBoost, 0.0, 1.0);
        return out;
    }

    private static void checkRange(List<String> out, String field, Double value, double min, double max) {
        if (value != null && (value < min || value > max)) {
            out.add("%s must be within [%s,%s]".formatted(field, min, max));
        }
    }
}
